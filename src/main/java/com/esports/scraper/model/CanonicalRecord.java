package com.esports.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalized, merged output unit handed to the presentation layer.
 * <p>
 * {@code id} is unique within one run. A record missing required fields, or
 * whose detail page could not be retrieved, is still emitted with
 * {@code incomplete = true}.
 * </p>
 */
@Builder(toBuilder = true)
public record CanonicalRecord(
        String id,
        RecordType type,
        @Nullable String nativeId,
        @Nullable String name,
        ScheduledTime scheduledTime,
        List<String> participants,
        MatchStatus status,
        @Nullable Score score,
        List<MapScore> maps,
        List<PlayerStat> playerStats,
        Map<String, String> attributes,
        boolean incomplete,
        Set<String> missingFields,
        List<String> degradations,
        List<NormalizationWarning> warnings,
        List<String> provenance,
        List<FieldDiscrepancy> discrepancies,
        Instant lastUpdated,
        @JsonIgnore Map<String, FieldSource> fieldSources
) {
}
