package com.karting.entries.api;

import com.karting.entries.core.NotificationReceipt;
import com.karting.entries.core.PaymentNotificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * PayFast ITN endpoint. Anything that passes the signature check is answered 200, including
 * payloads that failed processing and were logged for operator review.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payment notifications", description = "Gateway-to-server payment notifications")
public class PaymentNotifyController {

    private final PaymentNotificationService notificationService;

    @PostMapping(value = "/notify", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Receive a PayFast payment notification")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accepted: applied, already applied, or logged for review"),
            @ApiResponse(responseCode = "400", description = "SIGNATURE_INVALID: nothing was changed")
    })
    public ResponseEntity<NotificationReceipt> notify(@RequestParam Map<String, String> payload,
                                                      @RequestHeader Map<String, String> headers) {
        NotificationReceipt receipt = notificationService.handle(payload, headers);
        log.info("Notification answered: paymentReference={}, result={}, loggedForReview={}",
                receipt.getPaymentReference(), receipt.getResult(), receipt.isLoggedForReview());
        return ResponseEntity.ok(receipt);
    }
}
