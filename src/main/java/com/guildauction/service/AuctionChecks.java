package com.guildauction.service;

import com.guildauction.model.GuildConfig;

import java.util.Objects;
import java.util.Set;

/**
 * Permission and placement checks. Each returns a {@link Check} instead of throwing so the
 * command layer can chain them and report the first failure.
 */
public final class AuctionChecks {

    private AuctionChecks() {
    }

    public record Check(boolean ok, String reason) {

        public static Check pass() {
            return new Check(true, null);
        }

        public static Check fail(String reason) {
            return new Check(false, reason);
        }
    }

    /** Who issued a command, as reported by the platform adapter. */
    public record Caller(long userId, Set<Long> roleIds, boolean admin) {

        public Caller {
            roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
        }
    }

    public static Check inGuild(Long guildId) {
        return guildId != null && guildId > 0 ? Check.pass() : Check.fail("This command only works inside a guild");
    }

    /** An empty channel list means every channel is allowed. */
    public static Check channelAllowed(GuildConfig config, long channelId) {
        if (config.auctionChannelIds().isEmpty() || config.auctionChannelIds().contains(channelId)) {
            return Check.pass();
        }
        return Check.fail("Auctions are not allowed in this channel");
    }

    public static Check hasAuctionRole(GuildConfig config, Caller caller) {
        if (config.roleId() != null && caller.roleIds().contains(config.roleId())) {
            return Check.pass();
        }
        return Check.fail("You need the auction role for this");
    }

    public static Check isAdmin(Caller caller) {
        return caller.admin() ? Check.pass() : Check.fail("Only administrators can do this");
    }

    public static Check secretMatches(GuildConfig config, String secretCode) {
        if (config.secretCode() != null && Objects.equals(config.secretCode(), secretCode)) {
            return Check.pass();
        }
        return Check.fail("Wrong secret code");
    }

    /** Opening needs the auction role, admin rights or the guild's secret code. */
    public static Check canOpen(GuildConfig config, Caller caller, String secretCode) {
        if (isAdmin(caller).ok() || hasAuctionRole(config, caller).ok()) {
            return Check.pass();
        }
        if (secretCode != null && !secretCode.isBlank()) {
            return secretMatches(config, secretCode);
        }
        return Check.fail("You need the auction role, admin rights or the secret code to start an auction");
    }

    /** Bidding takes the auction role itself; admin rights do not stand in for it. */
    public static Check canBid(GuildConfig config, Caller caller) {
        if (config.roleId() == null) {
            return Check.fail("The auction role has not been configured by an admin yet");
        }
        return hasAuctionRole(config, caller);
    }

    /** Undo and forced end are reserved for the auction role and admins. */
    public static Check canManage(GuildConfig config, Caller caller) {
        if (isAdmin(caller).ok() || hasAuctionRole(config, caller).ok()) {
            return Check.pass();
        }
        return Check.fail("You need the auction role or admin rights for this");
    }

    /** First failing check, or pass. */
    public static Check all(Check... checks) {
        for (Check check : checks) {
            if (!check.ok()) {
                return check;
            }
        }
        return Check.pass();
    }
}
