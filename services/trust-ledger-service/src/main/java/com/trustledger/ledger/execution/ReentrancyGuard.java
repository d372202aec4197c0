package com.trustledger.ledger.execution;

import com.trustledger.ledger.exception.ReentrantCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Marks a guarded operation as in progress for its whole duration and rejects any nested entry
 * into a guarded operation, including the same one, until it returns.
 */
@Component
@Slf4j
public class ReentrancyGuard {

    private final AtomicReference<String> inProgress = new AtomicReference<>();

    public <T> T guard(String operation, Supplier<T> body) {
        if (!inProgress.compareAndSet(null, operation)) {
            String current = inProgress.get();
            log.warn("Rejected re-entrant call: operation={} inProgress={}", operation, current);
            throw new ReentrantCallException(operation, current);
        }
        try {
            return body.get();
        } finally {
            inProgress.set(null);
        }
    }

    public boolean isEntered() {
        return inProgress.get() != null;
    }
}
