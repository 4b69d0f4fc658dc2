package com.guildauction.exception;

/**
 * The transport refused the channel. Fatal for that channel, never retried.
 */
public class TransportPermissionException extends TransportException {

    public TransportPermissionException(String message) {
        super(message);
    }
}
