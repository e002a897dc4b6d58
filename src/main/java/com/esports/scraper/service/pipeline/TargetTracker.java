package com.esports.scraper.service.pipeline;

import com.esports.scraper.model.FetchTarget;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run bookkeeping of target states, keyed by URL. Rejects transitions
 * the lifecycle does not allow.
 */
class TargetTracker {

    private final Map<String, TargetState> states = new ConcurrentHashMap<>();

    void register(final FetchTarget target) {
        TargetState previous = states.putIfAbsent(target.url(), TargetState.PENDING);
        if (previous != null) {
            throw new IllegalStateException("target registered twice: " + target.url());
        }
    }

    void move(final FetchTarget target, final TargetState to) {
        states.compute(target.url(), (url, from) -> {
            if (from == null) {
                throw new IllegalStateException("unknown target " + url);
            }
            if (!from.canMoveTo(to)) {
                throw new IllegalStateException(url + ": " + from + " -> " + to + " is not allowed");
            }
            return to;
        });
    }

    TargetState state(final FetchTarget target) {
        return states.get(target.url());
    }

    /** States by URL, sorted. */
    Map<String, TargetState> snapshot() {
        return new TreeMap<>(states);
    }
}
