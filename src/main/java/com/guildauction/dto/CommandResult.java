package com.guildauction.dto;

import java.util.Map;

/**
 * Outcome of a command as reported back to the platform adapter.
 */
public record CommandResult(boolean success, String code, String message, Map<String, Object> data) {

    public CommandResult {
        data = data == null ? Map.of() : data;
    }

    public static CommandResult ok(String message, Map<String, Object> data) {
        return new CommandResult(true, "OK", message, data);
    }

    public static CommandResult failed(String code, String message) {
        return new CommandResult(false, code, message, Map.of());
    }

    public static CommandResult failed(String code, String message, Map<String, Object> data) {
        return new CommandResult(false, code, message, data);
    }
}
