package com.crisisalert.notification.channel;

import com.crisisalert.domain.enums.NotificationChannel;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class GatewaySmsSink implements SmsSink {

    private final DeliveryGatewayClient deliveryGatewayClient;

    public GatewaySmsSink(DeliveryGatewayClient deliveryGatewayClient) {
        this.deliveryGatewayClient = deliveryGatewayClient;
    }

    @Override
    public boolean send(String phoneNumber, String message) {
        return deliveryGatewayClient.post(NotificationChannel.SMS, "/sms", Map.of("to", phoneNumber, "message", message));
    }
}
