package com.karting.entries.mail;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bounded FIFO of outbound mail drained by a single consumer with a minimum gap between sends.
 * Callers enqueue and return. When the queue is full the oldest message is dropped.
 * <p>
 * Admin activity is collected separately and flushed as one batch per interval through
 * {@link #setBatchHandler(Consumer)}.
 */
@Slf4j
@Component
public class MailQueue {

    private final MailTransport transport;
    private final BlockingQueue<EmailMessage> queue;
    private final List<AdminActivity> batch = new ArrayList<>();
    private final long minDelayMs;
    private final long batchIntervalMs;

    private ScheduledExecutorService worker;
    private volatile boolean running;
    private volatile Consumer<List<AdminActivity>> batchHandler = activities -> { };
    private long lastSentAt;

    public MailQueue(MailTransport transport,
                     @Value("${karting.mail.queue.capacity:100}") int capacity,
                     @Value("${karting.mail.queue.min-delay-ms:1000}") long minDelayMs,
                     @Value("${karting.mail.queue.batch-interval-ms:30000}") long batchIntervalMs) {
        this.transport = transport;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.minDelayMs = minDelayMs;
        this.batchIntervalMs = batchIntervalMs;
    }

    @PostConstruct
    void start() {
        running = true;
        worker = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "mail-queue");
            t.setDaemon(true);
            return t;
        });
        worker.execute(this::drainLoop);
        worker.scheduleWithFixedDelay(this::flushBatch, batchIntervalMs, batchIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Mail queue started: capacity={}, minDelayMs={}, batchIntervalMs={}",
                queue.remainingCapacity(), minDelayMs, batchIntervalMs);
    }

    @PreDestroy
    void stop() {
        running = false;
        if (worker != null) {
            worker.shutdownNow();
        }
        flushBatch();
        if (!queue.isEmpty()) {
            log.warn("Mail queue stopped with {} undelivered message(s)", queue.size());
        }
    }

    public void enqueue(EmailMessage message) {
        while (!queue.offer(message)) {
            EmailMessage dropped = queue.poll();
            if (dropped != null) {
                log.warn("Mail queue full, dropping oldest message template={}", dropped.getTemplateName());
            }
        }
        log.debug("Mail enqueued template={} depth={}", message.getTemplateName(), queue.size());
    }

    public void addToBatch(AdminActivity activity) {
        synchronized (batch) {
            batch.add(activity);
        }
    }

    public void setBatchHandler(Consumer<List<AdminActivity>> batchHandler) {
        this.batchHandler = batchHandler;
    }

    public int pending() {
        return queue.size();
    }

    /** Hands the collected admin activity to the batch handler. */
    public void flushBatch() {
        List<AdminActivity> drained;
        synchronized (batch) {
            if (batch.isEmpty()) {
                return;
            }
            drained = new ArrayList<>(batch);
            batch.clear();
        }
        try {
            batchHandler.accept(drained);
        } catch (RuntimeException e) {
            log.error("Admin activity summary failed for {} action(s)", drained.size(), e);
        }
    }

    private void drainLoop() {
        while (running) {
            try {
                deliverNext(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Sends at most one message, waiting up to {@code timeoutMs} for one to arrive.
     *
     * @return whether a message was taken from the queue
     */
    boolean deliverNext(long timeoutMs) throws InterruptedException {
        EmailMessage message = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
        if (message == null) {
            return false;
        }
        long wait = lastSentAt + minDelayMs - System.currentTimeMillis();
        if (wait > 0) {
            Thread.sleep(wait);
        }
        try {
            transport.send(message);
        } catch (RuntimeException e) {
            log.error("Mail delivery failed template={}: {}", message.getTemplateName(), e.getMessage());
        } finally {
            lastSentAt = System.currentTimeMillis();
        }
        return true;
    }
}
