package com.payment.observability.alert.messaging;

import com.payment.observability.alert.domain.AlertEvent;
import com.payment.observability.alert.domain.AlertSeverity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts alerts to a Slack incoming webhook as a header plus one section block per detail.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.alerts.slack.webhook-url")
public class SlackWebhookNotifier implements AlertNotifier {

    private final RestTemplate restTemplate;
    private final String webhookUrl;

    public SlackWebhookNotifier(@Value("${payment.alerts.slack.webhook-url}") String webhookUrl,
                                @Value("${payment.alerts.slack.timeout-ms:5000}") int timeoutMs) {
        this(webhookUrl, restTemplate(timeoutMs));
    }

    SlackWebhookNotifier(String webhookUrl, RestTemplate restTemplate) {
        this.webhookUrl = webhookUrl;
        this.restTemplate = restTemplate;
    }

    private static RestTemplate restTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public String sendAlert(AlertEvent alert) {
        ResponseEntity<String> response = restTemplate.postForEntity(webhookUrl, payload(alert), String.class);
        log.info("Delivered alert {} to Slack status={}", alert.getAlertId(), response.getStatusCode().value());
        return "slack-" + alert.getAlertId();
    }

    @Override
    public String name() {
        return "slack";
    }

    static Map<String, Object> payload(AlertEvent alert) {
        String headline = icon(alert.getSeverity()) + " " + alert.getTitle();
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(Map.of("type", "header", "text", Map.of("type", "plain_text", "text", headline)));
        blocks.add(section(alert.getMessage()));
        if (alert.getProvider() != null) {
            blocks.add(section("*Provider:* " + alert.getProvider()));
        }
        if (alert.getDetailedExplanation() != null) {
            blocks.add(section(alert.getDetailedExplanation()));
        }
        blocks.add(Map.of("type", "context", "elements", List.of(Map.of("type", "mrkdwn",
                "text", "alert " + alert.getAlertId() + " | " + alert.getType() + " | window "
                        + alert.getWindowStart() + " - " + alert.getWindowEnd()))));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", headline);
        payload.put("blocks", blocks);
        return payload;
    }

    private static Map<String, Object> section(String markdown) {
        return Map.of("type", "section", "text", Map.of("type", "mrkdwn", "text", markdown));
    }

    private static String icon(AlertSeverity severity) {
        return switch (severity) {
            case CRITICAL -> ":rotating_light:";
            case WARNING -> ":warning:";
            case INFO -> ":information_source:";
        };
    }
}
