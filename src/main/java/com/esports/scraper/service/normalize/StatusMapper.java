package com.esports.scraper.service.normalize;

import com.esports.scraper.model.MatchStatus;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps upstream status labels onto {@link MatchStatus}.
 */
final class StatusMapper {

    /** Countdown labels such as {@code 2h 15m} or {@code 1d 4h}. */
    private static final Pattern ETA = Pattern.compile("(?i)^(in\\s+)?(\\d+\\s*[dhms]\\s*)+(from now)?$");

    private StatusMapper() {
    }

    /**
     * @return the mapped status, or empty when the label is not recognised
     */
    static Optional<MatchStatus> map(final String label) {
        String s = StringUtils.normalizeSpace(label).toLowerCase(Locale.ROOT);
        if (s.contains("final") || s.contains("completed") || s.contains("finished") || s.equals("ended")) {
            return Optional.of(MatchStatus.COMPLETED);
        }
        if (s.contains("live") || s.contains("ongoing") || s.contains("in progress")) {
            return Optional.of(MatchStatus.LIVE);
        }
        if (s.contains("upcoming") || s.equals("tbd") || s.contains("scheduled") || ETA.matcher(s).matches()) {
            return Optional.of(MatchStatus.UPCOMING);
        }
        return Optional.empty();
    }

    static boolean isEta(@Nullable final String raw) {
        return StringUtils.isNotBlank(raw) && ETA.matcher(raw.trim()).matches();
    }
}
