package com.projecthub.xp.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Live events share the gate; a retroactive backfill takes it exclusively so no live award interleaves with a replay.
 * Scoped to this process.
 */
@Component
public class EventProcessingGate {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public <T> T runLive(Supplier<T> work) {
        lock.readLock().lock();
        try {
            return work.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T runExclusive(Supplier<T> work) {
        lock.writeLock().lock();
        try {
            return work.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean exclusiveRunInProgress() {
        return lock.isWriteLocked();
    }
}
