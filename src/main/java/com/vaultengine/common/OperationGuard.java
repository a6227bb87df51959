package com.vaultengine.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs state-changing vault operations one at a time, each in its own transaction.
 *
 * Operations are serialized by a process-wide lock acquired outside the transaction,
 * so the next operation only starts after the previous one committed or rolled back.
 * A call that re-enters while the current thread already holds the lock (for example
 * from inside a collaborator callback) fails with REENTRANT_CALL. Any exception thrown
 * by the operation rolls back everything it wrote.
 */
@Component
@Slf4j
public class OperationGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public OperationGuard(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T execute(String operation, Supplier<T> work) {
        if (lock.isHeldByCurrentThread()) {
            throw new VaultException(VaultErrorCode.REENTRANT_CALL, "Reentrant call to " + operation);
        }
        lock.lock();
        try {
            log.debug("Starting {}", operation);
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }
}
