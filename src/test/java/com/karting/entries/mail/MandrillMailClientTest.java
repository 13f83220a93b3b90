package com.karting.entries.mail;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MandrillMailClientTest {

    private static final String API_URL = "https://mail.example.test/api/1.0/messages/send.json";

    private CircuitBreakerRegistry registry;
    private MandrillMailClient client;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        registry = CircuitBreakerRegistry.ofDefaults();
        client = new MandrillMailClient(registry, 1000);
        ReflectionTestUtils.setField(client, "apiUrl", API_URL);
        ReflectionTestUtils.setField(client, "apiKey", "md-test-key");
        ReflectionTestUtils.setField(client, "fromEmail", "noreply@example.test");
        ReflectionTestUtils.setField(client, "fromName", "ROK Cup SA");
        server = MockRestServiceServer.bindTo((RestTemplate) ReflectionTestUtils.getField(client, "restTemplate")).build();
    }

    @Test
    void messageIsPostedWithInlineImages() {
        server.expect(requestTo(API_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.key").value("md-test-key"))
                .andExpect(jsonPath("$.message.to[0].email").value("dee@example.test"))
                .andExpect(jsonPath("$.message.subject").value("Race entry confirmation - Red Star Nationals"))
                .andExpect(jsonPath("$.message.images[0].name").value("engine-barcode"))
                .andExpect(jsonPath("$.message.images[0].type").value("image/png"))
                .andRespond(withSuccess("[{\"status\":\"sent\"}]", MediaType.APPLICATION_JSON));

        client.send(message());

        server.verify();
    }

    @Test
    void providerErrorBecomesDeliveryFailure() {
        server.expect(requestTo(API_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.send(message()))
                .isInstanceOf(MailDeliveryException.class)
                .hasMessageContaining("Mail provider call failed");
    }

    @Test
    void openCircuitRefusesWithoutCallingProvider() {
        registry.circuitBreaker(MandrillMailClient.CIRCUIT_BREAKER).transitionToOpenState();

        assertThatThrownBy(() -> client.send(message()))
                .isInstanceOf(MailDeliveryException.class)
                .hasMessage("Mail provider circuit open");
        server.verify();
    }

    @Test
    void missingApiKeySkipsSending() {
        ReflectionTestUtils.setField(client, "apiKey", "");

        client.send(message());

        server.verify();
        CircuitBreaker breaker = registry.circuitBreaker(MandrillMailClient.CIRCUIT_BREAKER);
        assertThat(breaker.getMetrics().getNumberOfBufferedCalls()).isZero();
    }

    private static EmailMessage message() {
        return EmailMessage.builder()
                .toEmail("dee@example.test")
                .toName("Dee River")
                .subject("Race entry confirmation - Red Star Nationals")
                .html("<p>Engine <img src=\"cid:engine-barcode\"></p>")
                .templateName("RACE_ENTRY_CONFIRMATION")
                .image(new InlineImage("engine-barcode", "image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G'}))
                .build();
    }
}
