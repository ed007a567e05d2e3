package com.diseaseforecast.service;

import com.diseaseforecast.exception.PipelineBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-flight guard for pipeline runs inside this process.
 * <p>
 * Runs sharing a key never overlap; a caller that cannot get the key within the configured
 * wait gets {@link PipelineBusyException}.
 */
@Slf4j
@Component
public class PipelineGuard {

    /** Aggregation, training and stored-model forecasts all read or write weekly_case. */
    public static final String WEEKLY_CASE_LOCK = "weekly_case";
    public static final String NOTIFICATION_LOCK = "notifications";

    @Value("${pipeline.lock.wait-seconds:5}")
    private long waitSeconds;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T exclusive(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(waitSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PipelineBusyException(key);
        }
        if (!acquired) {
            log.warn("Pipeline busy | lock={} | waitedSeconds={}", key, waitSeconds);
            throw new PipelineBusyException(key);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeld(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
