package com.auctionhouse.engine.support;

import com.auctionhouse.core.error.StateException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes marketplace operations into one total order and rejects
 * re-entrant calls made from inside a running operation, for example by a
 * collaborator calling back into the engine during a transfer.
 */
public class OperationGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * Runs a mutating operation exclusively.
     *
     * @throws StateException if the current thread is already inside an operation
     */
    public <T> T run(String operation, Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            throw new StateException("REENTRANT_CALL", "Re-entrant call to " + operation + " rejected");
        }
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a read-only query. Queries made from inside an operation see its
     * in-progress state instead of being rejected.
     */
    public <T> T read(Supplier<T> query) {
        if (lock.isHeldByCurrentThread()) {
            return query.get();
        }
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
