package com.flagship.flight_surety.common;

import com.flagship.flight_surety.observability.CorrelationContext;
import com.flagship.flight_surety.observability.SuretyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs core operations one at a time, in arrival order.
 *
 * Every state transition of the registry goes through here, so callers racing from
 * many request threads observe a single serial history. The lock is reentrant:
 * an operation may call into another component (oracle resolution into the flight
 * registry and the payout engine) without releasing it.
 *
 * Only the outermost operation of a nested call records latency and rejection metrics.
 */
@Component
@Slf4j
public class ExecutionSerializer {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final SuretyMetrics metrics;

    public ExecutionSerializer(SuretyMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Executes a state-changing operation.
     *
     * @param operation Operation name, used for logging and metrics
     * @param caller Account on whose behalf the operation runs (may be null for internal calls)
     * @param body The operation
     * @return The operation result
     * @throws SuretyException if the operation rejects the call
     */
    public <T> T execute(String operation, AccountId caller, Supplier<T> body) {
        boolean outermost = !lock.isHeldByCurrentThread();
        long startTime = System.nanoTime();
        lock.lock();
        CorrelationContext.Scope accountScope = CorrelationContext.withAccount(caller);
        try {
            return body.get();
        } catch (SuretyException e) {
            if (outermost) {
                metrics.recordRejection(operation, e.getError());
                log.warn("Rejected {}: code={}, message={}", operation, e.getError(), e.getMessage());
            }
            throw e;
        } finally {
            accountScope.close();
            lock.unlock();
            if (outermost) {
                metrics.recordOperationLatency(operation, Duration.ofNanos(System.nanoTime() - startTime));
            }
        }
    }

    public void run(String operation, AccountId caller, Runnable body) {
        execute(operation, caller, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Executes a side-effect free query against a consistent view of the state.
     */
    public <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }
}
