package com.nosota.groupbuy.service;

import com.nosota.groupbuy.error.StateConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes state-mutating ledger operations.
 *
 * <p>At most one guarded operation runs at a time. A thread that re-enters while already
 * inside a guarded operation (for example from a callback of a value transfer) is rejected
 * instead of being let through, so a transfer can never observe or mutate the ledger
 * halfway through an operation.
 *
 * <p>Callers wrap the transactional call, so the transaction commits or rolls back
 * before the guard is released.
 */
@Component
@Slf4j
public class ExecutionGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * Runs {@code action} exclusively.
     *
     * @param operation Operation name for diagnostics
     * @param action    Guarded work
     * @return Result of the action
     * @throws StateConflictException if the current thread is already inside a guarded operation
     */
    public <T> T execute(String operation, Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Re-entrant call rejected: operation={}", operation);
            throw new StateConflictException("Re-entrant call rejected: " + operation);
        }

        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * @return true if the current thread is inside a guarded operation
     */
    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
