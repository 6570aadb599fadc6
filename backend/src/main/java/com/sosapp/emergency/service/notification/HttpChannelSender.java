package com.sosapp.emergency.service.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sosapp.emergency.config.NotificationProperties;
import com.sosapp.emergency.exception.DeliveryException;
import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.model.NotificationJob;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Sends through a provider's HTTP API: {@code POST url} with a JSON body, answered by
 * {@code {"messageId": "..."}} or, on rejection, {@code {"errorCode": "..."}}. In {@code log} mode the
 * message is only written to the application log.
 */
@Slf4j
public class HttpChannelSender implements NotificationChannelSender {

    static final String LOG_MODE = "log";

    private final NotificationChannel channel;
    private final NotificationProperties.Provider provider;
    private final Set<String> permanentErrorCodes;
    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;

    public HttpChannelSender(NotificationChannel channel,
                             NotificationProperties properties,
                             RestTemplate restTemplate,
                             CircuitBreaker circuitBreaker,
                             ObjectMapper objectMapper) {
        this.channel = channel;
        this.provider = properties.provider(channel);
        this.permanentErrorCodes = properties.getPermanentErrorCodes();
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.objectMapper = objectMapper;
    }

    @Override
    public NotificationChannel channel() {
        return channel;
    }

    @Override
    public DeliveryResult send(NotificationJob job, NotificationMessage message) {
        if (LOG_MODE.equalsIgnoreCase(provider.getMode()) || provider.getUrl() == null || provider.getUrl().isBlank()) {
            log.info("[{}] to={} job={} subject=\"{}\" body=\"{}\"", channel, job.getDestination(), job.getId(),
                    message.subject(), message.body());
            return DeliveryResult.sent("log-" + UUID.randomUUID());
        }
        try {
            String messageId = circuitBreaker.executeSupplier(() -> post(job, message));
            return DeliveryResult.sent(messageId);
        } catch (CallNotPermittedException ex) {
            return DeliveryResult.failed("CIRCUIT_OPEN", channel + " provider circuit open", false);
        } catch (DeliveryException ex) {
            return DeliveryResult.failed(ex.getErrorCode(), ex.getMessage(), permanentErrorCodes.contains(ex.getErrorCode()));
        }
    }

    private String post(NotificationJob job, NotificationMessage message) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (provider.getApiKey() != null && !provider.getApiKey().isBlank()) {
            headers.setBearerAuth(provider.getApiKey());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", job.getDestination());
        body.put("subject", message.subject());
        body.put("body", message.body());
        body.put("reference", job.getId().toString());
        try {
            String response = restTemplate.postForObject(provider.getUrl(), new HttpEntity<>(body, headers), String.class);
            String messageId = field(response, "messageId");
            return messageId != null ? messageId : job.getId().toString();
        } catch (HttpClientErrorException ex) {
            String code = field(ex.getResponseBodyAsString(), "errorCode");
            throw new DeliveryException(channel + " provider rejected message: " + ex.getStatusCode(),
                    code != null ? code : "HTTP_" + ex.getStatusCode().value(), ex);
        } catch (HttpServerErrorException ex) {
            throw new DeliveryException(channel + " provider error: " + ex.getStatusCode(), "PROVIDER_UNAVAILABLE", ex);
        } catch (ResourceAccessException ex) {
            throw new DeliveryException(channel + " provider unreachable: " + ex.getMessage(), "PROVIDER_UNREACHABLE", ex);
        }
    }

    private String field(String json, String name) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(json).get(name);
            return node != null && !node.isNull() ? node.asText() : null;
        } catch (Exception ex) {
            log.debug("[{}] unparseable provider response: {}", channel, json);
            return null;
        }
    }
}
