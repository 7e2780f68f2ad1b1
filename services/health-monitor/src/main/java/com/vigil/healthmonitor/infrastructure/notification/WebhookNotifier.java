package com.vigil.healthmonitor.infrastructure.notification;

import com.vigil.monitoring.alert.Notification;
import com.vigil.monitoring.alert.NotificationReceipt;
import com.vigil.monitoring.alert.Notifier;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

/**
 * Posts notifications as JSON to the notification service, which fans them out to email, chat
 * or SMS depending on urgency. Without a configured URL the notification is only logged.
 *
 * <p>Non-2xx responses surface as {@link org.springframework.web.client.RestClientException} and
 * are handled by the dispatcher.
 */
public class WebhookNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    static final String LOG_CHANNEL = "log";
    static final String WEBHOOK_CHANNEL = "webhook";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final URI webhookUrl;

    public WebhookNotifier(RestTemplate restTemplate, URI webhookUrl) {
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl;
    }

    @Override
    public NotificationReceipt sendNotification(Notification notification) {
        if (webhookUrl == null) {
            log.warn("[ALERT u{}] {}: {}", notification.urgency(), notification.subject(), notification.message());
            return new NotificationReceipt(List.of(LOG_CHANNEL));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                webhookUrl, HttpMethod.POST, new HttpEntity<>(payload(notification), headers), JSON_OBJECT);

        List<String> channels = channels(response.getBody());
        log.info("Notification '{}' delivered via {}", notification.subject(), channels);
        return new NotificationReceipt(channels);
    }

    static Map<String, Object> payload(Notification notification) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("subject", notification.subject());
        body.put("message", notification.message());
        body.put("urgency", notification.urgency());
        body.put("category", notification.category());
        body.put("metadata", notification.metadata());
        return body;
    }

    private static List<String> channels(Map<String, Object> body) {
        if (body != null && body.get("channels") instanceof List<?> list && !list.isEmpty()) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(WEBHOOK_CHANNEL);
    }
}
