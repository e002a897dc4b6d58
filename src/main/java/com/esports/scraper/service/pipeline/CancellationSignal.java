package com.esports.scraper.service.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request for a running extraction. Once raised, the run
 * issues no further fetches; fetches already in flight complete.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
