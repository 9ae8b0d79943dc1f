package me.golemcore.meter.domain.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single coarse lock guarding the in-memory cache, history and runtime
 * configuration. Network I/O and file writes must happen outside of it.
 */
@Component
public class SharedStateLock {

    private final ReentrantLock lock = new ReentrantLock();

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
