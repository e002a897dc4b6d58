package com.esports.scraper.service.fetch;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-host pacing gate. Two request starts to the same host are never closer
 * together than {@code minInterval}, whichever threads issue them.
 * <p>
 * Each host owns a fair lock; a caller holds it while waiting for the host's
 * next slot, so waiters are released strictly one by one in arrival order.
 * One gate lives for one extraction run and is handed to that run's fetcher.
 * </p>
 */
@Slf4j
public class HostRateGate {

    private final long minIntervalNanos;

    private final Map<String, HostSlot> hosts = new ConcurrentHashMap<>();

    public HostRateGate(final Duration minInterval) {
        this.minIntervalNanos = Math.max(0, minInterval.toNanos());
    }

    /**
     * Blocks until the host may receive another request.
     *
     * @param host upstream host name (case-insensitive)
     * @return the {@link System#nanoTime()} at which the caller was released
     * @throws InterruptedException if interrupted while waiting
     */
    public long acquire(final String host) throws InterruptedException {
        HostSlot slot = hosts.computeIfAbsent(host.toLowerCase(Locale.ROOT), h -> new HostSlot());
        return slot.acquire();
    }

    private final class HostSlot {

        private final ReentrantLock lock = new ReentrantLock(true);

        private long lastStart;

        private boolean used;

        long acquire() throws InterruptedException {
            lock.lockInterruptibly();
            try {
                long now = System.nanoTime();
                if (used) {
                    long earliest = lastStart + minIntervalNanos;
                    while (now < earliest) {
                        TimeUnit.NANOSECONDS.sleep(earliest - now);
                        now = System.nanoTime();
                    }
                }
                used = true;
                lastStart = now;
                return now;
            } finally {
                lock.unlock();
            }
        }
    }
}
