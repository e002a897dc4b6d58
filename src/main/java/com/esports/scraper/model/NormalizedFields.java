package com.esports.scraper.model;

import lombok.Builder;
import lombok.Singular;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of one {@link PartialRecord} after field-level normalization.
 * Unresolvable required fields are listed in {@code missingRequired}; the
 * record is still passed on.
 */
@Builder(toBuilder = true)
public record NormalizedFields(
        @Nullable String nativeId,
        RecordType type,
        PageType pageType,
        String sourceUrl,
        int ordinal,
        int position,
        Instant observedAt,
        @Nullable String name,
        ScheduledTime scheduledTime,
        @Singular List<String> participants,
        MatchStatus status,
        @Nullable Score score,
        @Singular List<MapScore> maps,
        @Singular List<PlayerStat> playerStats,
        @Singular Map<String, String> attributes,
        @Singular List<NormalizationWarning> warnings,
        @Singular("missingField") Set<String> missingRequired
) {

    public boolean isIncomplete() {
        return !missingRequired.isEmpty();
    }
}
