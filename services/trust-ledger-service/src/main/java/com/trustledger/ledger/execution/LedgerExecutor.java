package com.trustledger.ledger.execution;

import com.trustledger.common.exception.BusinessException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs ledger operations one at a time, each as a single atomic unit.
 *
 * <p>A fair lock totally orders invocations, and each invocation runs inside one transaction so
 * a failure leaves no trace: entity changes, index entries, allocated ids, emitted events and
 * value movements roll back together.
 *
 * <p>A nested invocation on the same thread (a callback fired by a value transfer) runs inside the
 * unit that is already open. Its writes commit or roll back with the outer operation. A nested
 * call rejected with a {@link BusinessException} writes nothing, since every operation checks its
 * preconditions before it writes, so a callback may catch the rejection and the outer operation
 * still commits. Any other nested failure rolls back the outermost unit even if the callback
 * swallows it.
 */
@Component
@Slf4j
public class LedgerExecutor {

    private static final String OPERATION_TIMER = "trust.ledger.operation";
    private static final String REJECTION_COUNTER = "trust.ledger.rejections";

    private final ReentrantLock serialLock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;

    // guarded by serialLock
    private RuntimeException nestedFailure;

    public LedgerExecutor(PlatformTransactionManager transactionManager, MeterRegistry meterRegistry) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(String operation, Supplier<T> body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        boolean nested = serialLock.isHeldByCurrentThread();
        serialLock.lock();
        try {
            return nested ? body.get() : runOutermost(body);
        } catch (BusinessException e) {
            outcome = "rejected";
            meterRegistry.counter(REJECTION_COUNTER,
                    "operation", operation,
                    "code", e.getErrorCode().getCode()).increment();
            log.warn("Ledger operation rejected: operation={} code={} message={}",
                    operation, e.getErrorCode().getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            if (nested && nestedFailure == null) {
                nestedFailure = e;
            }
            log.error("Ledger operation failed: operation={} nested={}", operation, nested, e);
            throw e;
        } finally {
            serialLock.unlock();
            sample.stop(Timer.builder(OPERATION_TIMER)
                    .tag("operation", operation)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    private <T> T runOutermost(Supplier<T> body) {
        nestedFailure = null;
        try {
            return transactionTemplate.execute(status -> {
                T result = body.get();
                if (nestedFailure != null) {
                    throw new IllegalStateException("Nested ledger operation failed", nestedFailure);
                }
                return result;
            });
        } finally {
            nestedFailure = null;
        }
    }
}
