package com.crisisalert.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/** HTTP client for the external delivery gateway behind the push, SMS and email sinks. */
@Configuration
public class DeliveryGatewayConfig {

    @Bean("deliveryGatewayRestTemplate")
    public RestTemplate deliveryGatewayRestTemplate(
            RestTemplateBuilder restTemplateBuilder, NotificationProperties notificationProperties) {
        NotificationProperties.Gateway gateway = notificationProperties.getGateway();
        RestTemplateBuilder builder = restTemplateBuilder
                .setConnectTimeout(gateway.getConnectTimeout())
                .setReadTimeout(gateway.getReadTimeout());
        if (gateway.getBaseUrl() != null && !gateway.getBaseUrl().isBlank()) {
            builder = builder.rootUri(gateway.getBaseUrl());
        }
        return builder.build();
    }
}
