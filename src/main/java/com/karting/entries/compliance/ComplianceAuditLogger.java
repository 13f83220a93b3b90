package com.karting.entries.compliance;

import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.domain.WebhookNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Writes {@code [AUDIT]} log lines for every decision that moves money or entry state.
 * Complements the audit_log table, which operators query; these lines go to log retention.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void logInitiation(String paymentReference, String driverId, String eventId, BigDecimal amount) {
        log.info("[AUDIT] ENTRY_INITIATED paymentReference={} driverId={} eventId={} amount={}",
                paymentReference, driverId, eventId, amount);
    }

    public void logNotification(WebhookNotification notification) {
        log.info("[AUDIT] PAYMENT_NOTIFICATION paymentReference={} pfPaymentId={} status={} amountGross={} payer={}",
                notification.getPaymentReference(),
                notification.getPfPaymentId(),
                notification.getRawPaymentStatus(),
                notification.getAmountGross(),
                PayerDataMasker.maskEmail(notification.getPayerEmail()));
    }

    public void logTransition(String entryId, String paymentReference, PaymentStatus from, PaymentStatus to, String actor) {
        log.info("[AUDIT] ENTRY_TRANSITION entryId={} paymentReference={} from={} to={} actor={}",
                entryId, paymentReference, from, to, actor);
    }

    public void logPoolRental(String rentalId, String paymentReference, PaymentStatus status, String actor) {
        log.info("[AUDIT] POOL_RENTAL rentalId={} paymentReference={} status={} actor={}",
                rentalId, paymentReference, status, actor);
    }
}
