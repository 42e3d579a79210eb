package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.error.ConcurrencyConflictException;
import com.flagship.account_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Component;

/**
 * Runs an attempt, and runs it again from scratch when it fails with a
 * {@link ConcurrencyConflictException}, up to {@code ledger.retry.max-attempts} times.
 *
 * Each attempt must open its own unit of work: only the whole read-mutate-write
 * sequence is retried, never a commit alone. Any other exception ends the loop at once.
 * Once attempts are exhausted the last conflict is rethrown.
 */
@Component
@Slf4j
public class ConflictRetryExecutor {

    private static final String OPERATION_ATTRIBUTE = "ledger.operation";

    private final RetryTemplate retryTemplate;

    public ConflictRetryExecutor(@Value("${ledger.retry.max-attempts:3}") int maxAttempts,
                                 @Value("${ledger.retry.backoff-ms:0}") long backoffMs,
                                 LedgerMetrics metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("ledger.retry.max-attempts must be at least 1, got " + maxAttempts);
        }
        if (backoffMs < 0) {
            throw new IllegalArgumentException("ledger.retry.backoff-ms cannot be negative, got " + backoffMs);
        }

        RetryTemplateBuilder builder = RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .retryOn(ConcurrencyConflictException.class)
            .withListener(new ConflictListener(maxAttempts, metrics));
        this.retryTemplate = backoffMs > 0
            ? builder.fixedBackoff(backoffMs).build()
            : builder.noBackoff().build();
    }

    /**
     * @param operation name used in logs and metric tags
     * @param attempt the unit of work to run; receives the 1-based attempt number
     */
    public <T> T execute(String operation, Attempt<T> attempt) {
        return retryTemplate.execute(context -> {
            context.setAttribute(OPERATION_ATTRIBUTE, operation);
            return attempt.run(context.getRetryCount() + 1);
        });
    }

    /**
     * One complete attempt of a retryable operation.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attemptNumber);
    }

    /**
     * Logs and counts every conflict: a retry while attempts remain, exhaustion on the last one.
     */
    private static final class ConflictListener implements RetryListener {

        private final int maxAttempts;
        private final LedgerMetrics metrics;

        private ConflictListener(int maxAttempts, LedgerMetrics metrics) {
            this.maxAttempts = maxAttempts;
            this.metrics = metrics;
        }

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            if (!(throwable instanceof ConcurrencyConflictException)) {
                return;
            }
            String operation = String.valueOf(context.getAttribute(OPERATION_ATTRIBUTE));
            int attempts = context.getRetryCount();
            if (attempts >= maxAttempts) {
                metrics.incrementRetriesExhausted(operation);
                log.error("{} gave up after {} attempts: {}", operation, attempts, throwable.getMessage());
            } else {
                metrics.incrementConflictRetries(operation);
                log.warn("{} hit a concurrency conflict on attempt {}/{}, retrying: {}",
                        operation, attempts, maxAttempts, throwable.getMessage());
            }
        }
    }
}
