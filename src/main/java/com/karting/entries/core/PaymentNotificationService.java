package com.karting.entries.core;

import com.karting.entries.api.SignatureInvalidException;
import com.karting.entries.domain.WebhookNotification;
import com.karting.entries.persistence.service.EntryStore;
import com.karting.entries.persistence.service.StoreTransactions;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Inbound payment notifications. The signature check is the only thing that can reject a
 * delivery; once it passes, the gateway always gets a success answer and any failure is written
 * to the failed-notification log for an operator.
 */
@Slf4j
@Service
public class PaymentNotificationService {

    private final GatewayAdapter gatewayAdapter;
    private final PaymentReconciler reconciler;
    private final EntryStore entryStore;
    private final StoreTransactions transactions;
    private final TimeLimiter timeLimiter;
    private final long timeBudgetMs;
    private final ExecutorService executor;

    public PaymentNotificationService(GatewayAdapter gatewayAdapter,
                                      PaymentReconciler reconciler,
                                      EntryStore entryStore,
                                      StoreTransactions transactions,
                                      @Value("${karting.webhook.time-budget-ms:20000}") long timeBudgetMs,
                                      @Value("${karting.webhook.workers:8}") int workers,
                                      @Value("${karting.webhook.queue-capacity:64}") int queueCapacity) {
        this.gatewayAdapter = gatewayAdapter;
        this.reconciler = reconciler;
        this.entryStore = entryStore;
        this.transactions = transactions;
        this.timeBudgetMs = timeBudgetMs;
        // A running reconcile is never interrupted mid-transaction; its late result is recorded instead.
        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeBudgetMs))
                .cancelRunningFuture(false)
                .build());
        AtomicInteger threads = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), r -> {
                    Thread t = new Thread(r, "payment-notify-" + threads.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }, new ThreadPoolExecutor.AbortPolicy());
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
    }

    /**
     * @throws SignatureInvalidException when the payload is not from the gateway; nothing is stored
     */
    public NotificationReceipt handle(Map<String, String> payload, Map<String, String> headers) {
        WebhookNotification notification = gatewayAdapter.verifyNotification(payload, headers);
        String reference = notification.getPaymentReference().getValue();
        CompletableFuture<ReconcileOutcome> running;
        try {
            running = CompletableFuture.supplyAsync(() -> reconciler.reconcileNotification(notification), executor);
        } catch (RejectedExecutionException e) {
            log.error("Payment notification rejected, workers saturated: paymentReference={}", reference);
            recordFailure(reference, "Not processed: notification workers saturated", payload, headers);
            return NotificationReceipt.loggedForReview(reference);
        }
        try {
            ReconcileOutcome outcome = timeLimiter.executeFutureSupplier(() -> running);
            log.info("Payment notification processed: paymentReference={}, pfPaymentId={}, result={}",
                    reference, notification.getPfPaymentId(), outcome.getResult());
            return NotificationReceipt.processed(outcome);
        } catch (TimeoutException e) {
            log.error("Payment notification exceeded time budget: paymentReference={}, budgetMs={}", reference, timeBudgetMs);
            recordFailure(reference, "Processing exceeded time budget of " + timeBudgetMs
                    + "ms; outcome unknown, reconciliation still running", payload, headers);
            running.whenComplete((late, error) -> recordLateOutcome(reference, late, error, payload, headers));
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            log.error("Payment notification failed: paymentReference={}", reference, cause);
            recordFailure(reference, cause.getClass().getSimpleName() + ": " + cause.getMessage(), payload, headers);
        }
        return NotificationReceipt.loggedForReview(reference);
    }

    private void recordLateOutcome(String reference, ReconcileOutcome late, Throwable error,
                                   Map<String, String> payload, Map<String, String> headers) {
        String summary;
        if (error == null) {
            log.warn("Timed out payment notification finished late: paymentReference={}, result={}", reference, late.getResult());
            summary = "Finished after time budget: result=" + late.getResult();
        } else {
            Throwable cause = unwrap(error);
            log.error("Timed out payment notification failed late: paymentReference={}", reference, cause);
            summary = "Failed after time budget: " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
        recordFailure(reference, summary, payload, headers);
    }

    private void recordFailure(String reference, String summary, Map<String, String> payload, Map<String, String> headers) {
        try {
            transactions.run("append_failed_notification", () ->
                    entryStore.appendFailedNotification(reference, summary, formEncode(payload), PaymentReconciler.toJson(headers)));
        } catch (RuntimeException e) {
            // Last resort: the payload must survive somewhere.
            log.error("Could not persist failed notification paymentReference={} payload={}", reference, formEncode(payload), e);
        }
    }

    private static Throwable unwrap(Throwable e) {
        Throwable t = e;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** Verbatim form body, fields in the order received. */
    static String formEncode(Map<String, String> payload) {
        return payload.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
