package com.crisisalert.notification.channel;

import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.domain.model.AlertAction;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class GatewayEmailSink implements EmailSink {

    private final DeliveryGatewayClient deliveryGatewayClient;

    public GatewayEmailSink(DeliveryGatewayClient deliveryGatewayClient) {
        this.deliveryGatewayClient = deliveryGatewayClient;
    }

    @Override
    public boolean send(String address, String subject, String body, List<AlertAction> actions) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("to", address);
        payload.put("subject", subject);
        payload.put("message", body);
        payload.put("actions", actions != null ? actions : List.of());
        return deliveryGatewayClient.post(NotificationChannel.EMAIL, "/email", payload);
    }
}
