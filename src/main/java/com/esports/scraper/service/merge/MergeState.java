package com.esports.scraper.service.merge;

import com.esports.scraper.model.CanonicalRecord;
import com.esports.scraper.model.NormalizedFields;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-scoped merge state: canonical records by id, plus the content-key
 * aliases that route id-less partials to the record of their native id.
 * <p>
 * Merges into one id are serialized through {@link ConcurrentHashMap#compute};
 * different ids merge in parallel. Alias resolution, and the rare re-homing
 * of an id-less record once its native id shows up, run under one lock.
 * </p>
 */
@Slf4j
public class MergeState {

    private final ConflictPolicy policy;

    private final ConcurrentHashMap<String, MergedRecord> records = new ConcurrentHashMap<>();

    /** Content key to the id its record is filed under. Guarded by itself. */
    private final Map<String, String> aliases = new HashMap<>();

    public MergeState(final ConflictPolicy policy) {
        this.policy = policy;
    }

    /**
     * Merges one normalized partial.
     *
     * @return id of the canonical record it landed in
     */
    public String merge(final NormalizedFields f) {
        String content = RecordKeys.contentKey(f.type(), f.name(), f.scheduledTime());
        if (f.nativeId() == null) {
            synchronized (aliases) {
                String id = content == null ? RecordKeys.primaryKey(f) : aliases.getOrDefault(content, content);
                apply(id, f);
                return id;
            }
        }

        String id = RecordKeys.nativeKey(f.type(), f.nativeId());
        if (content != null) {
            synchronized (aliases) {
                if (!aliases.containsKey(content)) {
                    aliases.put(content, id);
                    MergedRecord orphan = records.remove(content);
                    if (orphan != null) {
                        log.debug("Re-homing {} under {}", content, id);
                        records.compute(id, (k, existing) -> {
                            MergedRecord target = existing != null ? existing : new MergedRecord(id, f.type(), policy);
                            target.absorb(orphan);
                            return target;
                        });
                    }
                }
            }
        }
        apply(id, f);
        return id;
    }

    /**
     * Flags a record whose enrichment failed.
     *
     * @return {@code false} when no record has that id
     */
    public boolean degrade(final String id, final String reason) {
        MergedRecord updated = records.computeIfPresent(id, (k, r) -> {
            r.degrade(reason);
            return r;
        });
        if (updated == null) {
            log.warn("Cannot mark unknown record {} degraded: {}", id, reason);
            return false;
        }
        return true;
    }

    public Optional<CanonicalRecord> get(final String id) {
        return Optional.ofNullable(snapshot(id));
    }

    public int size() {
        return records.size();
    }

    /**
     * All records, sorted by id.
     */
    public List<CanonicalRecord> records() {
        return records.keySet().stream()
                .map(this::snapshot)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(CanonicalRecord::id))
                .toList();
    }

    @Nullable
    private CanonicalRecord snapshot(final String id) {
        AtomicReference<CanonicalRecord> out = new AtomicReference<>();
        records.computeIfPresent(id, (k, r) -> {
            out.set(r.toRecord());
            return r;
        });
        return out.get();
    }

    private void apply(final String id, final NormalizedFields f) {
        records.compute(id, (k, existing) -> {
            MergedRecord target = existing != null ? existing : new MergedRecord(id, f.type(), policy);
            target.absorb(f);
            return target;
        });
    }
}
