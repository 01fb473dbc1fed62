package com.crisisalert.notification.channel;

import com.crisisalert.config.NotificationProperties;
import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.exception.ChannelUnavailableException;
import com.crisisalert.exception.DispatchFailureException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts delivery requests to the external gateway that fronts the push, SMS and
 * email providers.
 *
 * <p>Retry policy lives here, not in the engine:
 * <ul>
 *   <li><b>Retry</b> ({@code deliveryGateway}): transient {@link DispatchFailureException}s are retried
 *       with exponential backoff; {@link ChannelUnavailableException} is never retried</li>
 *   <li><b>Circuit breaker</b> ({@code deliveryGateway}): stops hammering a gateway that keeps failing</li>
 * </ul>
 *
 * <p>401/403 from the gateway means the channel is not permitted for this deployment and is
 * reported as unavailable; any other error is a dispatch failure.
 */
@Component
public class DeliveryGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(DeliveryGatewayClient.class);

    private final RestTemplate restTemplate;
    private final NotificationProperties notificationProperties;

    public DeliveryGatewayClient(
            @Qualifier("deliveryGatewayRestTemplate") RestTemplate restTemplate,
            NotificationProperties notificationProperties) {
        this.restTemplate = restTemplate;
        this.notificationProperties = notificationProperties;
    }

    @Retry(name = "deliveryGateway")
    @CircuitBreaker(name = "deliveryGateway")
    public boolean post(NotificationChannel channel, String path, Map<String, Object> payload) {
        if (!notificationProperties.getGateway().isEnabled()) {
            throw new ChannelUnavailableException(channel, "Delivery gateway disabled");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(path, new HttpEntity<>(payload, headers), String.class);
            log.debug("Gateway accepted {} request: status={}", channel, response.getStatusCode());
            return response.getStatusCode().is2xxSuccessful();
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode() == HttpStatus.UNAUTHORIZED || e.getStatusCode() == HttpStatus.FORBIDDEN) {
                throw new ChannelUnavailableException(channel, "Gateway denied " + channel + ": " + e.getStatusCode());
            }
            throw new DispatchFailureException(channel, "Gateway rejected " + channel + ": " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new DispatchFailureException(channel, "Gateway call failed for " + channel + ": " + e.getMessage(), e);
        }
    }
}
