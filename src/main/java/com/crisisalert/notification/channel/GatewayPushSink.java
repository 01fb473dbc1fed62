package com.crisisalert.notification.channel;

import com.crisisalert.domain.enums.NotificationChannel;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class GatewayPushSink implements PushSink {

    private final DeliveryGatewayClient deliveryGatewayClient;

    public GatewayPushSink(DeliveryGatewayClient deliveryGatewayClient) {
        this.deliveryGatewayClient = deliveryGatewayClient;
    }

    @Override
    public boolean send(String userId, String title, String body, PushOptions options) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("userId", userId);
        payload.put("title", title);
        payload.put("body", body);
        payload.put("tag", options.tag());
        payload.put("requireInteraction", options.requireInteraction());
        payload.put("vibrate", options.vibrationPattern());
        payload.put("actions", options.actions());
        return deliveryGatewayClient.post(NotificationChannel.PUSH, "/push", payload);
    }
}
