package com.guildauction.transport;

/**
 * Opaque handle to a message the transport has sent.
 */
public record MessageRef(long channelId, String messageId) {
}
