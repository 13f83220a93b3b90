package com.karting.entries.mail;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mandrill transactional e-mail API ({@code messages/send.json}). Calls go through the
 * {@code mail-provider} circuit breaker and carry connect/read timeouts.
 */
@Slf4j
@Component
public class MandrillMailClient implements MailTransport {

    static final String CIRCUIT_BREAKER = "mail-provider";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;

    @Value("${karting.mail.api-url:https://mandrillapp.com/api/1.0/messages/send.json}")
    private String apiUrl;

    @Value("${karting.mail.api-key:}")
    private String apiKey;

    @Value("${karting.mail.from-email:noreply@rokcup.co.za}")
    private String fromEmail;

    @Value("${karting.mail.from-name:ROK Cup SA}")
    private String fromName;

    public MandrillMailClient(CircuitBreakerRegistry circuitBreakerRegistry,
                              @Value("${karting.mail.timeout-ms:10000}") int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        this.restTemplate = new RestTemplate(factory);
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
    }

    @Override
    public void send(EmailMessage message) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Mail API key not set, skipping template={}", message.getTemplateName());
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("key", apiKey);
        body.put("message", toMandrillMessage(message));
        try {
            circuitBreaker.executeRunnable(() -> restTemplate.postForEntity(apiUrl, body, String.class));
            log.info("Mail accepted by provider: template={}", message.getTemplateName());
        } catch (CallNotPermittedException e) {
            throw new MailDeliveryException("Mail provider circuit open", e);
        } catch (RestClientException e) {
            throw new MailDeliveryException("Mail provider call failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> toMandrillMessage(EmailMessage message) {
        Map<String, Object> recipient = new LinkedHashMap<>();
        recipient.put("email", message.getToEmail());
        if (message.getToName() != null) {
            recipient.put("name", message.getToName());
        }
        recipient.put("type", "to");

        List<Map<String, String>> images = new ArrayList<>();
        for (InlineImage image : message.getImages()) {
            images.add(Map.of(
                    "type", image.getMimeType(),
                    "name", image.getContentId(),
                    "content", Base64.getEncoder().encodeToString(image.getContent())));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from_email", fromEmail);
        payload.put("from_name", fromName);
        payload.put("to", List.of(recipient));
        payload.put("subject", message.getSubject());
        payload.put("html", message.getHtml());
        if (message.getText() != null) {
            payload.put("text", message.getText());
        }
        if (!images.isEmpty()) {
            payload.put("images", images);
        }
        return payload;
    }
}
