package com.karting.entries.persistence.service;

import com.karting.entries.api.DuplicateEntryException;
import com.karting.entries.api.EntryServiceException;
import com.karting.entries.api.StoreUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs one business event as one database transaction, retried once by the {@code store}
 * Resilience4j instance when the failure is transient or a concurrent insert won a
 * uniqueness race. Whatever still fails is translated into the service error taxonomy.
 */
@Slf4j
@Component
public class StoreTransactions {

    static final String RETRY_INSTANCE = "store";

    private final TransactionTemplate transactionTemplate;
    private final Retry retry;

    public StoreTransactions(PlatformTransactionManager transactionManager, RetryRegistry retryRegistry) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.retry = retryRegistry.retry(RETRY_INSTANCE);
    }

    public <T> T execute(String operation, Supplier<T> work) {
        Supplier<T> transactional = () -> transactionTemplate.execute(status -> work.get());
        try {
            return Retry.decorateSupplier(retry, transactional).get();
        } catch (EntryServiceException e) {
            throw e;
        } catch (DataIntegrityViolationException e) {
            log.warn("Store conflict persisted after retry: operation={}, error={}", operation, e.getMostSpecificCause().getMessage());
            throw new DuplicateEntryException(null, "Conflicting concurrent write during " + operation);
        } catch (DataAccessException | TransactionException e) {
            log.error("Store unavailable: operation={}", operation, e);
            throw new StoreUnavailableException("Store unavailable during " + operation, e);
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }
}
