package com.crisisalert.notification.channel;

import com.crisisalert.domain.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes alerts over STOMP to {@code /topic/alerts/{userId}}, which the web client's
 * notification center subscribes to.
 */
@Component
public class WebSocketInAppSink implements InAppSink {

    private static final Logger log = LoggerFactory.getLogger(WebSocketInAppSink.class);

    static final String DESTINATION_PREFIX = "/topic/alerts/";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public WebSocketInAppSink(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Override
    public void publish(Alert alert) {
        simpMessagingTemplate.convertAndSend(DESTINATION_PREFIX + alert.getUserId(), alert);
        log.debug("In-app alert published: alertId={}, userId={}", alert.getId(), alert.getUserId());
    }
}
