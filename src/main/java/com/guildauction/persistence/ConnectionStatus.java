package com.guildauction.persistence;

import java.time.Instant;

/**
 * Diagnostics view of the gateway.
 *
 * @param pendingReplay writes the primary has not seen yet; replayed on reconnect
 * @param replayOverflow writes that found the journal full and are recovered through replay markers
 */
public record ConnectionStatus(BackendStatus status,
                               String activeBackend,
                               long primaryAttempts,
                               long primaryFailures,
                               long secondaryFailures,
                               long failovers,
                               long reconnectAttempts,
                               int pendingReplay,
                               long replayOverflow,
                               String lastError,
                               Instant degradedSince) {
}
