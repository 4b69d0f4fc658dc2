package com.guildauction.transport;

import com.guildauction.exception.TransportException;
import com.guildauction.exception.TransportPermissionException;

/**
 * Outbound display channel of the chat platform.
 * Implementations throw {@link TransportException} for transient failures and
 * {@link TransportPermissionException} when the channel refuses the bot.
 */
public interface MessagingTransport {

    MessageRef send(long channelId, DisplayPayload payload);

    void edit(MessageRef ref, DisplayPayload payload);

    void delete(MessageRef ref);
}
