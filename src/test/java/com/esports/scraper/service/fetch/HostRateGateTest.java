package com.esports.scraper.service.fetch;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertTrue;

class HostRateGateTest {

    private static final Duration INTERVAL = Duration.ofMillis(80);

    @Test
    void testGrantsToOneHostAreSpacedAcrossThreads() throws Exception {
        HostRateGate gate = new HostRateGate(INTERVAL);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Long>> calls = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                String host = i % 2 == 0 ? "www.vlr.gg" : "WWW.VLR.GG";
                calls.add(() -> gate.acquire(host));
            }
            List<Long> grants = new ArrayList<>();
            for (Future<Long> f : pool.invokeAll(calls)) {
                grants.add(f.get());
            }
            Collections.sort(grants);
            for (int i = 1; i < grants.size(); i++) {
                long gap = grants.get(i) - grants.get(i - 1);
                assertTrue(gap >= INTERVAL.toNanos(), "grant gap " + TimeUnit.NANOSECONDS.toMillis(gap) + "ms");
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testHostsArePacedIndependently() throws Exception {
        HostRateGate gate = new HostRateGate(Duration.ofSeconds(5));
        long start = System.nanoTime();

        gate.acquire("www.vlr.gg");
        gate.acquire("cdn.vlr.gg");

        assertTrue(System.nanoTime() - start < Duration.ofSeconds(2).toNanos());
    }

    @Test
    void testZeroIntervalNeverWaits() throws Exception {
        HostRateGate gate = new HostRateGate(Duration.ZERO);
        long first = gate.acquire("www.vlr.gg");
        long second = gate.acquire("www.vlr.gg");

        assertTrue(second - first < Duration.ofSeconds(1).toNanos());
    }
}
