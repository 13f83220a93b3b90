package com.karting.entries.api;

import com.karting.entries.core.NotificationReceipt;
import com.karting.entries.core.PaymentNotificationService;
import com.karting.entries.core.ReconcileOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PaymentNotifyController.class)
@ExtendWith(MockitoExtension.class)
class PaymentNotifyControllerTest {

    private static final String REFERENCE = "RACE-E-RED-D-001-1700000000000";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaymentNotificationService notificationService;

    @Captor
    private ArgumentCaptor<Map<String, String>> payload;

    @Test
    void notificationIsAcknowledged() throws Exception {
        when(notificationService.handle(anyMap(), anyMap()))
                .thenReturn(new NotificationReceipt(REFERENCE, ReconcileOutcome.Result.ENTRY_COMPLETED, false));

        mockMvc.perform(post("/api/v1/payments/notify")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("m_payment_id", REFERENCE)
                        .param("pf_payment_id", "1089250")
                        .param("payment_status", "COMPLETE")
                        .param("amount_gross", "14900.00")
                        .param("signature", "0f1e2d"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("ENTRY_COMPLETED"))
                .andExpect(jsonPath("$.loggedForReview").value(false));

        verify(notificationService).handle(payload.capture(), any());
        assertThat(payload.getValue())
                .containsEntry("pf_payment_id", "1089250")
                .containsEntry("payment_status", "COMPLETE");
    }

    @Test
    void payloadLoggedForReviewStillAnswersOk() throws Exception {
        when(notificationService.handle(anyMap(), anyMap()))
                .thenReturn(new NotificationReceipt(REFERENCE, null, true));

        mockMvc.perform(post("/api/v1/payments/notify")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("m_payment_id", REFERENCE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loggedForReview").value(true));
    }

    @Test
    void badSignatureIsRejected() throws Exception {
        when(notificationService.handle(anyMap(), anyMap()))
                .thenThrow(new SignatureInvalidException("Notification signature does not match"));

        mockMvc.perform(post("/api/v1/payments/notify")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("m_payment_id", REFERENCE)
                        .param("signature", "forged"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("SIGNATURE_INVALID"));
    }

    @Test
    void jsonBodyIsUnsupported() throws Exception {
        mockMvc.perform(post("/api/v1/payments/notify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnsupportedMediaType());
    }
}
