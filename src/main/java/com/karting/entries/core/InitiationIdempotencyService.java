package com.karting.entries.core;

import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Remembers which payment reference a client initiation key produced, so a double-submitted
 * checkout returns the same reference instead of creating a second Pending entry.
 * Redis is the fast path; {@code race_entries.request_key} is the persistent fallback. If both
 * are unavailable the lookup fails open.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InitiationIdempotencyService {

    private static final String KEY_PREFIX = "karting:initiation:";
    private static final Duration TTL = Duration.ofHours(24);

    private final StringRedisTemplate redisTemplate;
    private final RaceEntryRepository entryRepository;

    /** Request keys are scoped per driver so two drivers cannot collide on a client key. */
    public static String scopedKey(String driverId, String clientKey) {
        return driverId + ":" + clientKey.trim();
    }

    public Optional<RaceEntryEntity> findPrior(String scopedKey) {
        try {
            String reference = redisTemplate.opsForValue().get(KEY_PREFIX + scopedKey);
            if (reference != null) {
                log.debug("Initiation key hit in Redis: key={}, paymentReference={}", scopedKey, reference);
                Optional<RaceEntryEntity> entry = entryRepository.findByPaymentReference(reference).stream().findFirst();
                if (entry.isPresent()) {
                    return entry;
                }
            }
        } catch (Exception e) {
            log.warn("Initiation key lookup in Redis failed for key={}, falling back to database: {}", scopedKey, e.getMessage());
        }

        try {
            Optional<RaceEntryEntity> entry = entryRepository.findByRequestKey(scopedKey);
            entry.ifPresent(e -> remember(scopedKey, e.getPaymentReference()));
            return entry;
        } catch (Exception e) {
            log.error("Initiation key lookup in database failed for key={}: {}", scopedKey, e.getMessage());
            return Optional.empty();
        }
    }

    public void remember(String scopedKey, String paymentReference) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + scopedKey, paymentReference, TTL);
        } catch (Exception e) {
            log.warn("Failed to cache initiation key={} in Redis: {}", scopedKey, e.getMessage());
        }
    }
}
