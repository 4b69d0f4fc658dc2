package com.guildauction.transport;

import com.guildauction.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Publishes display payloads to STOMP subscribers on /topic/channels/{channelId}.
 * The platform adapter subscribes there and turns SEND/EDIT/DELETE events into real messages.
 */
@Component
public class StompMessagingTransport implements MessagingTransport {

    private static final Logger log = LoggerFactory.getLogger(StompMessagingTransport.class);

    private final SimpMessagingTemplate messagingTemplate;

    public StompMessagingTransport(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public MessageRef send(long channelId, DisplayPayload payload) {
        MessageRef ref = new MessageRef(channelId, UUID.randomUUID().toString());
        publish(ref, "SEND", payload);
        return ref;
    }

    @Override
    public void edit(MessageRef ref, DisplayPayload payload) {
        publish(ref, "EDIT", payload);
    }

    @Override
    public void delete(MessageRef ref) {
        publish(ref, "DELETE", null);
    }

    private void publish(MessageRef ref, String action, DisplayPayload payload) {
        try {
            messagingTemplate.convertAndSend("/topic/channels/" + ref.channelId(),
                    Map.of("action", action,
                            "messageId", ref.messageId(),
                            "type", payload != null ? payload.type() : "",
                            "fields", payload != null ? payload.fields() : Map.of()));
            log.debug("{} {} on channel {}", action, ref.messageId(), ref.channelId());
        } catch (MessagingException e) {
            throw new TransportException("Failed to " + action + " message on channel " + ref.channelId(), e);
        }
    }
}
