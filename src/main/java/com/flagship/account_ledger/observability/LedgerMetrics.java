package com.flagship.account_ledger.observability;

import com.flagship.account_ledger.error.LedgerException;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: counter tagged by operation and outcome
 * - ledger.operation.latency: timer tagged by operation
 * - ledger.concurrency.retries: attempts repeated after a concurrency conflict
 * - ledger.concurrency.exhausted: operations that ran out of attempts
 */
@Component
public class LedgerMetrics {

    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void incrementConflictRetries(String operation) {
        registry.counter("ledger.concurrency.retries", "operation", sanitizeTag(operation)).increment();
    }

    public void incrementRetriesExhausted(String operation) {
        registry.counter("ledger.concurrency.exhausted", "operation", sanitizeTag(operation)).increment();
    }

    /**
     * Outcome tag for a failed operation: the error kind for ledger errors, "error" otherwise.
     */
    public static String outcomeOf(Throwable failure) {
        if (failure instanceof LedgerException) {
            return ((LedgerException) failure).getKind().name().toLowerCase(Locale.ROOT);
        }
        return "error";
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
