package com.adlanda.codexai.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One read/write lock per project.
 *
 * Index writes for a project (upsert, delete, rebuild) hold the write lock, so they
 * are serialized with each other and with reads of that project. Reads of the same
 * project share the read lock. Other projects are never blocked.
 */
@Component
public class ProjectLockRegistry {

    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public <T> T withWriteLock(String projectId, Supplier<T> action) {
        return withLock(lockFor(projectId).writeLock(), action);
    }

    public <T> T withReadLock(String projectId, Supplier<T> action) {
        return withLock(lockFor(projectId).readLock(), action);
    }

    public boolean isWriteLocked(String projectId) {
        ReentrantReadWriteLock lock = locks.get(projectId);
        return lock != null && lock.isWriteLocked();
    }

    private ReentrantReadWriteLock lockFor(String projectId) {
        return locks.computeIfAbsent(projectId, id -> new ReentrantReadWriteLock());
    }

    private static <T> T withLock(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
