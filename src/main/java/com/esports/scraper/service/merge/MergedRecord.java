package com.esports.scraper.service.merge;

import com.esports.scraper.model.CanonicalRecord;
import com.esports.scraper.model.FieldDiscrepancy;
import com.esports.scraper.model.FieldSource;
import com.esports.scraper.model.MapScore;
import com.esports.scraper.model.MatchStatus;
import com.esports.scraper.model.NormalizationWarning;
import com.esports.scraper.model.NormalizedFields;
import com.esports.scraper.model.PlayerStat;
import com.esports.scraper.model.RecordType;
import com.esports.scraper.model.ScheduledTime;
import com.esports.scraper.model.Score;
import com.esports.scraper.service.normalize.RecordNormalizer;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Mutable accumulator behind one canonical record. Only ever touched from
 * inside {@code ConcurrentHashMap.compute} for its id, so it needs no locking
 * of its own.
 * <p>
 * Every field is a slot holding the winning value and its {@link FieldSource}.
 * An incoming value fills an empty slot, overwrites a value from a lower page
 * precedence, and is ignored below it. Equal precedence with a different
 * value goes to the {@link ConflictPolicy} and leaves a discrepancy behind.
 * </p>
 */
final class MergedRecord {

    static final String NATIVE_ID = "nativeId";
    static final String NAME = "name";
    static final String SCHEDULED_TIME = "scheduledTime";
    static final String PARTICIPANTS = "participants";
    static final String STATUS = "status";
    static final String SCORE = "score";
    static final String MAPS = "maps";
    static final String PLAYER_STATS = "playerStats";
    static final String ATTRIBUTE_PREFIX = "attributes.";

    private static final Comparator<NormalizationWarning> WARNING_ORDER =
            Comparator.comparing(NormalizationWarning::field)
                    .thenComparing(NormalizationWarning::message)
                    .thenComparing(w -> Objects.toString(w.raw(), ""));

    private static final Comparator<FieldDiscrepancy> DISCREPANCY_ORDER =
            Comparator.comparing(FieldDiscrepancy::field)
                    .thenComparing(FieldDiscrepancy::rejectedSource)
                    .thenComparing(FieldDiscrepancy::rejected)
                    .thenComparing(FieldDiscrepancy::kept);

    private record Slot(@Nullable Object value, FieldSource source) {
    }

    private final String id;

    private final RecordType type;

    private final ConflictPolicy policy;

    private final Map<String, Slot> slots = new TreeMap<>();

    private final Set<FieldDiscrepancy> discrepancies = new HashSet<>();

    private final Set<NormalizationWarning> warnings = new HashSet<>();

    private final Set<String> provenance = new TreeSet<>();

    private final Set<String> degradations = new TreeSet<>();

    private Instant lastUpdated = Instant.EPOCH;

    MergedRecord(final String id, final RecordType type, final ConflictPolicy policy) {
        this.id = id;
        this.type = type;
        this.policy = policy;
    }

    void absorb(final NormalizedFields f) {
        FieldSource src = FieldSource.of(f);
        offer(NATIVE_ID, f.nativeId(), src);
        offer(NAME, f.name(), src);
        offer(SCHEDULED_TIME, f.scheduledTime(), src);
        offer(PARTICIPANTS, f.participants(), src);
        offer(STATUS, f.status(), src);
        offer(SCORE, f.score(), src);
        offer(MAPS, f.maps(), src);
        offer(PLAYER_STATS, f.playerStats(), src);
        f.attributes().forEach((k, v) -> offer(ATTRIBUTE_PREFIX + k, v, src));

        provenance.add(f.sourceUrl());
        warnings.addAll(f.warnings());
        touch(f.observedAt());
    }

    /**
     * Folds a record that turned out to share this identity into this one.
     */
    void absorb(final MergedRecord other) {
        other.slots.forEach((field, slot) -> offer(field, slot.value(), slot.source()));
        discrepancies.addAll(other.discrepancies);
        warnings.addAll(other.warnings);
        provenance.addAll(other.provenance);
        degradations.addAll(other.degradations);
        touch(other.lastUpdated);
    }

    void degrade(final String reason) {
        degradations.add(reason);
    }

    private void touch(final Instant observedAt) {
        if (observedAt != null && observedAt.isAfter(lastUpdated)) {
            lastUpdated = observedAt;
        }
    }

    private void offer(final String field, @Nullable final Object value, final FieldSource src) {
        Slot current = slots.get(field);
        if (current == null) {
            slots.put(field, new Slot(value, src));
            return;
        }
        boolean incomingEmpty = isEmpty(value);
        boolean currentEmpty = isEmpty(current.value());
        if (incomingEmpty || currentEmpty) {
            if (currentEmpty && (!incomingEmpty || FieldSource.AUTHORITY.compare(src, current.source()) < 0)) {
                slots.put(field, new Slot(value, src));
            }
            return;
        }
        if (same(value, current.value())) {
            if (FieldSource.AUTHORITY.compare(src, current.source()) < 0) {
                slots.put(field, new Slot(value, src));
            }
            return;
        }
        if (src.pageType().outranks(current.source().pageType())) {
            slots.put(field, new Slot(value, src));
            return;
        }
        if (current.source().pageType().outranks(src.pageType())) {
            return;
        }
        if (policy.prefers(src, current.source())) {
            discrepancies.add(new FieldDiscrepancy(field, render(value), render(current.value()),
                    current.source().url(), src.pageType()));
            slots.put(field, new Slot(value, src));
        } else {
            discrepancies.add(new FieldDiscrepancy(field, render(current.value()), render(value),
                    src.url(), src.pageType()));
        }
    }

    /**
     * Snapshot as an immutable canonical record. Required fields are checked
     * against the merged values, not against any single source.
     */
    CanonicalRecord toRecord() {
        String name = (String) value(NAME);
        Object rawTime = value(SCHEDULED_TIME);
        ScheduledTime time = rawTime == null ? ScheduledTime.unknown(null) : (ScheduledTime) rawTime;
        List<String> participants = list(PARTICIPANTS);
        MatchStatus status = value(STATUS) == null ? MatchStatus.UNKNOWN : (MatchStatus) value(STATUS);
        Score score = (Score) value(SCORE);

        Map<String, String> attributes = new LinkedHashMap<>();
        Map<String, FieldSource> sources = new LinkedHashMap<>();
        slots.forEach((field, slot) -> {
            if (!isEmpty(slot.value())) {
                sources.put(field, slot.source());
                if (field.startsWith(ATTRIBUTE_PREFIX)) {
                    attributes.put(field.substring(ATTRIBUTE_PREFIX.length()), (String) slot.value());
                }
            }
        });

        Set<String> missing = new TreeSet<>();
        if (name == null) {
            missing.add(RecordNormalizer.REQUIRED_NAME);
        }
        if (!time.isKnown()) {
            missing.add(RecordNormalizer.REQUIRED_TIME);
        }
        if (type == RecordType.MATCH && participants.size() < 2) {
            missing.add(RecordNormalizer.REQUIRED_PARTICIPANTS);
        }

        List<NormalizationWarning> sortedWarnings = new ArrayList<>(warnings);
        sortedWarnings.sort(WARNING_ORDER);

        return CanonicalRecord.builder()
                .id(id)
                .type(type)
                .nativeId((String) value(NATIVE_ID))
                .name(name)
                .scheduledTime(time)
                .participants(List.copyOf(participants))
                .status(status)
                .score(score)
                .maps(this.<MapScore>list(MAPS))
                .playerStats(this.<PlayerStat>list(PLAYER_STATS))
                .attributes(attributes)
                .incomplete(!missing.isEmpty() || !degradations.isEmpty())
                .missingFields(missing)
                .degradations(List.copyOf(degradations))
                .warnings(List.copyOf(sortedWarnings))
                .provenance(List.copyOf(provenance))
                .discrepancies(settledDiscrepancies())
                .lastUpdated(lastUpdated)
                .fieldSources(sources)
                .build();
    }

    /**
     * Only conflicts at the precedence level that finally won a field are
     * reported, each against the value that field ended up with.
     */
    private List<FieldDiscrepancy> settledDiscrepancies() {
        Set<FieldDiscrepancy> settled = new TreeSet<>(DISCREPANCY_ORDER);
        for (FieldDiscrepancy d : discrepancies) {
            Slot slot = slots.get(d.field());
            if (slot == null || slot.source().pageType() != d.level()) {
                continue;
            }
            String kept = render(slot.value());
            if (!kept.equals(d.rejected())) {
                settled.add(d.withKept(kept));
            }
        }
        return List.copyOf(settled);
    }

    @Nullable
    private Object value(final String field) {
        Slot slot = slots.get(field);
        return slot == null ? null : slot.value();
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> list(final String field) {
        Object v = value(field);
        return v == null ? List.of() : List.copyOf((Collection<T>) v);
    }

    static boolean isEmpty(@Nullable final Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof ScheduledTime t) {
            return !t.isKnown();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Score s) {
            return s.isEmpty();
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        return value == MatchStatus.UNKNOWN;
    }

    /**
     * Value equality for merge purposes: times compare by instant, text
     * compares case-insensitively.
     */
    static boolean same(final Object a, final Object b) {
        if (a instanceof ScheduledTime x && b instanceof ScheduledTime y) {
            return x.value().toInstant().equals(y.value().toInstant());
        }
        if (a instanceof String x && b instanceof String y) {
            return x.toLowerCase(Locale.ROOT).equals(y.toLowerCase(Locale.ROOT));
        }
        if (a instanceof List<?> x && b instanceof List<?> y && x.size() == y.size()) {
            for (int i = 0; i < x.size(); i++) {
                if (!same(x.get(i), y.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    private static String render(@Nullable final Object value) {
        return String.valueOf(value);
    }
}
