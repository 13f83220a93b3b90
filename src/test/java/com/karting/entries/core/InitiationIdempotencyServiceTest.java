package com.karting.entries.core;

import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis first, request_key column second, and neither failure blocks an initiation.
 */
@ExtendWith(MockitoExtension.class)
class InitiationIdempotencyServiceTest {

    private static final String REFERENCE = "RACE-E-RED-D-001-1700000000000";

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;
    @Mock
    private RaceEntryRepository entryRepository;

    private InitiationIdempotencyService service;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        service = new InitiationIdempotencyService(redisTemplate, entryRepository);
    }

    @Test
    void keysAreScopedPerDriver() {
        assertThat(InitiationIdempotencyService.scopedKey("D-001", " client-key-1 ")).isEqualTo("D-001:client-key-1");
    }

    @Test
    void redisHitResolvesEntryByReference() {
        RaceEntryEntity entry = RaceEntryEntity.builder().entryId("entry-1").paymentReference(REFERENCE).build();
        when(valueOps.get("karting:initiation:D-001:k1")).thenReturn(REFERENCE);
        when(entryRepository.findByPaymentReference(REFERENCE)).thenReturn(List.of(entry));

        Optional<RaceEntryEntity> prior = service.findPrior("D-001:k1");

        assertThat(prior).contains(entry);
        verify(entryRepository, never()).findByRequestKey(anyString());
    }

    @Test
    void redisMissFallsBackToRequestKeyAndWarmsCache() {
        RaceEntryEntity entry = RaceEntryEntity.builder().entryId("entry-1").paymentReference(REFERENCE).build();
        when(valueOps.get("karting:initiation:D-001:k1")).thenReturn(null);
        when(entryRepository.findByRequestKey("D-001:k1")).thenReturn(Optional.of(entry));

        Optional<RaceEntryEntity> prior = service.findPrior("D-001:k1");

        assertThat(prior).contains(entry);
        verify(valueOps).set(eq("karting:initiation:D-001:k1"), eq(REFERENCE), eq(Duration.ofHours(24)));
    }

    @Test
    void redisOutageFallsBackToDatabase() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("Connection refused"));
        doThrow(new RedisConnectionFailureException("Connection refused"))
                .when(valueOps).set(anyString(), anyString(), any(Duration.class));
        RaceEntryEntity entry = RaceEntryEntity.builder().entryId("entry-1").paymentReference(REFERENCE).build();
        when(entryRepository.findByRequestKey("D-001:k1")).thenReturn(Optional.of(entry));

        assertThat(service.findPrior("D-001:k1")).contains(entry);
    }

    @Test
    void databaseFailureIsTreatedAsNoPriorInitiation() {
        when(valueOps.get(anyString())).thenReturn(null);
        when(entryRepository.findByRequestKey("D-001:k1")).thenThrow(new IllegalStateException("Database unavailable"));

        assertThat(service.findPrior("D-001:k1")).isEmpty();
    }

    @Test
    void rememberSwallowsRedisFailure() {
        doThrow(new RedisConnectionFailureException("Connection refused"))
                .when(valueOps).set(anyString(), anyString(), any(Duration.class));

        service.remember("D-001:k1", REFERENCE);

        verify(valueOps).set("karting:initiation:D-001:k1", REFERENCE, Duration.ofHours(24));
    }
}
