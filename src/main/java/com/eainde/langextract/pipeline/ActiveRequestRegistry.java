package com.eainde.langextract.pipeline;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Requests currently running in an engine, keyed by request id. Lookups take the read lock,
 * so introspection never waits for other readers.
 */
final class ActiveRequestRegistry {

    private final Map<String, RequestTracker> active = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @throws RequestValidationException if a request with the same id is already running
     */
    void register(RequestTracker tracker) {
        lock.writeLock().lock();
        try {
            if (active.putIfAbsent(tracker.requestId(), tracker) != null) {
                throw new RequestValidationException("request " + tracker.requestId() + " is already running");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    void unregister(String requestId) {
        lock.writeLock().lock();
        try {
            active.remove(requestId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    boolean contains(String requestId) {
        lock.readLock().lock();
        try {
            return active.containsKey(requestId);
        } finally {
            lock.readLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return active.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    Map<String, ExtractionProgress> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, ExtractionProgress> result = new LinkedHashMap<>();
            active.forEach((id, tracker) -> result.put(id, tracker.snapshot()));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }
}
