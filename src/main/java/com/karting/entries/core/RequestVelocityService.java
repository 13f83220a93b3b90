package com.karting.entries.core;

import com.karting.entries.api.TooManyAttemptsException;
import com.karting.entries.compliance.PayerDataMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Counts login and reset attempts per email and per client IP over the last 60 seconds.
 * Over-threshold attempts are refused before any password hash is checked.
 */
@Slf4j
@Service
public class RequestVelocityService {

    private static final long WINDOW_MS = 60_000L;

    private final Map<String, CopyOnWriteArrayList<Long>> byEmail = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<Long>> byIp = new ConcurrentHashMap<>();

    @Value("${karting.login.max-per-email-per-60s:5}")
    private int maxPerEmailPer60s;

    @Value("${karting.login.max-per-ip-per-60s:20}")
    private int maxPerIpPer60s;

    /**
     * Record an attempt and refuse it when either counter is over its threshold. A threshold of
     * zero disables that counter.
     */
    public VelocitySnapshot checkAttempt(String email, String clientIp) {
        VelocitySnapshot snapshot = record(email, clientIp, System.currentTimeMillis());
        if (snapshot.isOverThreshold()) {
            log.warn("Attempt throttled: email={} emailCount={} ipCount={} (thresholds: email={}, ip={})",
                    PayerDataMasker.maskEmail(email), snapshot.getEmailCountLast60s(), snapshot.getIpCountLast60s(),
                    maxPerEmailPer60s, maxPerIpPer60s);
            throw new TooManyAttemptsException("Too many attempts, try again in a minute");
        }
        return snapshot;
    }

    VelocitySnapshot record(String email, String clientIp, long now) {
        long cutoff = now - WINDOW_MS;
        int emailCount = count(byEmail, email == null ? null : email.toLowerCase(Locale.ROOT), now, cutoff);
        int ipCount = count(byIp, clientIp, now, cutoff);
        boolean overThreshold = (maxPerEmailPer60s > 0 && emailCount > maxPerEmailPer60s)
                || (maxPerIpPer60s > 0 && ipCount > maxPerIpPer60s);
        return new VelocitySnapshot(emailCount, ipCount, overThreshold);
    }

    /** Successful login clears the email counter so a driver who finally typed it right is not locked out. */
    public void reset(String email) {
        if (email != null) {
            byEmail.remove(email.toLowerCase(Locale.ROOT));
        }
    }

    void setThresholds(int perEmail, int perIp) {
        this.maxPerEmailPer60s = perEmail;
        this.maxPerIpPer60s = perIp;
    }

    /** Drops counters with no attempt left in the window. */
    @Scheduled(fixedDelayString = "${karting.login.eviction-interval-ms:60000}")
    public void evictIdle() {
        evictIdle(System.currentTimeMillis());
    }

    void evictIdle(long now) {
        long cutoff = now - WINDOW_MS;
        int evicted = prune(byEmail, cutoff) + prune(byIp, cutoff);
        if (evicted > 0) {
            log.debug("Evicted idle attempt counters: count={}", evicted);
        }
    }

    int trackedKeys() {
        return byEmail.size() + byIp.size();
    }

    private static int prune(Map<String, CopyOnWriteArrayList<Long>> counters, long cutoff) {
        int evicted = 0;
        for (String key : counters.keySet()) {
            CopyOnWriteArrayList<Long> kept = counters.computeIfPresent(key, (k, list) -> {
                list.removeIf(ts -> ts < cutoff);
                return list.isEmpty() ? null : list;
            });
            if (kept == null) {
                evicted++;
            }
        }
        return evicted;
    }

    private static int count(Map<String, CopyOnWriteArrayList<Long>> counters, String key, long now, long cutoff) {
        if (key == null || key.isBlank()) {
            return 0;
        }
        CopyOnWriteArrayList<Long> list = counters.compute(key, (k, existing) -> {
            CopyOnWriteArrayList<Long> timestamps = existing != null ? existing : new CopyOnWriteArrayList<>();
            timestamps.add(now);
            timestamps.removeIf(ts -> ts < cutoff);
            return timestamps;
        });
        return list.size();
    }

    @lombok.Value
    public static class VelocitySnapshot {
        int emailCountLast60s;
        int ipCountLast60s;
        boolean overThreshold;
    }
}
