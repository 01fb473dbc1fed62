package com.crisisalert.notification.channel;

import com.crisisalert.domain.enums.NotificationChannel;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Asks the gateway to create a push subscription for the user. */
@Component
public class GatewayPushRegistrationService implements PushRegistrationService {

    private final DeliveryGatewayClient deliveryGatewayClient;

    public GatewayPushRegistrationService(DeliveryGatewayClient deliveryGatewayClient) {
        this.deliveryGatewayClient = deliveryGatewayClient;
    }

    @Override
    public void register(String userId) {
        deliveryGatewayClient.post(NotificationChannel.PUSH, "/push/subscriptions", Map.of("userId", userId));
    }
}
