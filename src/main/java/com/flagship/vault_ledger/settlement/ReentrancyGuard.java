package com.flagship.vault_ledger.settlement;

import com.flagship.vault_ledger.exception.ReentrantCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide guard around every value-moving operation.
 *
 * A guarded operation that tries to enter again from inside itself (same
 * thread, e.g. a transfer callback) fails immediately with
 * {@link ReentrantCallException}. Operations from other threads wait for the
 * holder to finish, which serializes all mutations of the vault.
 *
 * Use with try-with-resources so the guard is released on every exit path.
 */
@Component
@Slf4j
public class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    public Scope enter(String operation) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Re-entrant call rejected: operation={}", operation);
            throw new ReentrantCallException(operation);
        }
        lock.lock();
        return new Scope();
    }

    public boolean isHeld() {
        return lock.isLocked();
    }

    public final class Scope implements AutoCloseable {

        private boolean released;

        private Scope() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
