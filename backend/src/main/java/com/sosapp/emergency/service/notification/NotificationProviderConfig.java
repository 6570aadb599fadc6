package com.sosapp.emergency.service.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sosapp.emergency.config.NotificationProperties;
import com.sosapp.emergency.model.NotificationChannel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class NotificationProviderConfig {

    @Bean
    public RestTemplate notificationRestTemplate(
            @Value("${sos.notifications.http.connect-timeout-ms:3000}") int connectTimeoutMs,
            @Value("${sos.notifications.http.read-timeout-ms:10000}") int readTimeoutMs
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }

    @Bean
    public CircuitBreakerRegistry notificationCircuitBreakers(
            @Value("${sos.notifications.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${sos.notifications.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${sos.notifications.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public NotificationChannelSender pushSender(NotificationProperties properties, RestTemplate notificationRestTemplate,
                                                CircuitBreakerRegistry notificationCircuitBreakers, ObjectMapper objectMapper) {
        return sender(NotificationChannel.PUSH, properties, notificationRestTemplate, notificationCircuitBreakers, objectMapper);
    }

    @Bean
    public NotificationChannelSender smsSender(NotificationProperties properties, RestTemplate notificationRestTemplate,
                                               CircuitBreakerRegistry notificationCircuitBreakers, ObjectMapper objectMapper) {
        return sender(NotificationChannel.SMS, properties, notificationRestTemplate, notificationCircuitBreakers, objectMapper);
    }

    @Bean
    public NotificationChannelSender emailSender(NotificationProperties properties, RestTemplate notificationRestTemplate,
                                                 CircuitBreakerRegistry notificationCircuitBreakers, ObjectMapper objectMapper) {
        return sender(NotificationChannel.EMAIL, properties, notificationRestTemplate, notificationCircuitBreakers, objectMapper);
    }

    private NotificationChannelSender sender(NotificationChannel channel, NotificationProperties properties,
                                             RestTemplate restTemplate, CircuitBreakerRegistry registry,
                                             ObjectMapper objectMapper) {
        CircuitBreaker breaker = registry.circuitBreaker("notification-" + channel.name().toLowerCase());
        return new HttpChannelSender(channel, properties, restTemplate, breaker, objectMapper);
    }
}
