package com.guildauction.controller;

import com.guildauction.dto.CommandResult;
import com.guildauction.dto.OpenAuctionRequest;
import com.guildauction.dto.PlaceBidRequest;
import com.guildauction.service.AuctionChecks.Caller;
import com.guildauction.service.AuctionCommandService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * HTTP face of the command surface. The platform adapter identifies the caller
 * through the X-User-Id, X-Role-Ids and X-Admin headers.
 */
@RestController
@RequestMapping("/api")
public class AuctionCommandController {

    private final AuctionCommandService commandService;

    public AuctionCommandController(AuctionCommandService commandService) {
        this.commandService = commandService;
    }

    @PostMapping("/guilds/{guildId}/auction/open")
    public ResponseEntity<CommandResult> open(@PathVariable Long guildId,
                                              @RequestHeader("X-User-Id") long userId,
                                              @RequestHeader(value = "X-Role-Ids", required = false) String roleIds,
                                              @RequestHeader(value = "X-Admin", defaultValue = "false") boolean admin,
                                              @RequestBody OpenAuctionRequest request) {
        return respond(commandService.open(guildId, caller(userId, roleIds, admin), request));
    }

    @PostMapping("/guilds/{guildId}/auction/bids")
    public ResponseEntity<CommandResult> placeBid(@PathVariable Long guildId,
                                                  @RequestHeader("X-User-Id") long userId,
                                                  @RequestHeader(value = "X-Role-Ids", required = false) String roleIds,
                                                  @RequestHeader(value = "X-Admin", defaultValue = "false") boolean admin,
                                                  @RequestBody PlaceBidRequest request) {
        return respond(commandService.placeBid(guildId, caller(userId, roleIds, admin), request));
    }

    @PostMapping("/guilds/{guildId}/auction/undo")
    public ResponseEntity<CommandResult> undo(@PathVariable Long guildId,
                                              @RequestHeader("X-User-Id") long userId,
                                              @RequestHeader(value = "X-Role-Ids", required = false) String roleIds,
                                              @RequestHeader(value = "X-Admin", defaultValue = "false") boolean admin) {
        return respond(commandService.undoLast(guildId, caller(userId, roleIds, admin)));
    }

    @PostMapping("/guilds/{guildId}/auction/end")
    public ResponseEntity<CommandResult> end(@PathVariable Long guildId,
                                             @RequestHeader("X-User-Id") long userId,
                                             @RequestHeader(value = "X-Role-Ids", required = false) String roleIds,
                                             @RequestHeader(value = "X-Admin", defaultValue = "false") boolean admin) {
        return respond(commandService.end(guildId, caller(userId, roleIds, admin)));
    }

    @GetMapping("/guilds/{guildId}/auction")
    public ResponseEntity<CommandResult> current(@PathVariable Long guildId) {
        return respond(commandService.debugAuction(guildId));
    }

    @GetMapping("/debug/status")
    public CommandResult status() {
        return commandService.debugStatus();
    }

    @PostMapping("/debug/persistence/reconnect")
    public ResponseEntity<CommandResult> reconnect(@RequestHeader("X-User-Id") long userId,
                                                   @RequestHeader(value = "X-Role-Ids", required = false) String roleIds,
                                                   @RequestHeader(value = "X-Admin", defaultValue = "false") boolean admin) {
        return respond(commandService.reconnect(caller(userId, roleIds, admin)));
    }

    private static Caller caller(long userId, String roleIds, boolean admin) {
        Set<Long> roles = roleIds == null || roleIds.isBlank()
                ? Set.of()
                : Arrays.stream(roleIds.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .map(Long::valueOf)
                        .collect(Collectors.toSet());
        return new Caller(userId, roles, admin);
    }

    private static ResponseEntity<CommandResult> respond(CommandResult result) {
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    static HttpStatus statusFor(CommandResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        return switch (result.code()) {
            case "FORBIDDEN" -> HttpStatus.FORBIDDEN;
            case "NO_AUCTION" -> HttpStatus.NOT_FOUND;
            case "CONCURRENCY_CONFLICT", "AUCTION_ACTIVE", "INVALID_STATE" -> HttpStatus.CONFLICT;
            case "STORAGE_UNAVAILABLE" -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
