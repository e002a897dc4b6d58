package com.esports.scraper.service.normalize;

import com.esports.scraper.config.ScraperProperties;
import com.esports.scraper.model.Fields;
import com.esports.scraper.model.MapScore;
import com.esports.scraper.model.MatchStatus;
import com.esports.scraper.model.NormalizationWarning;
import com.esports.scraper.model.NormalizedFields;
import com.esports.scraper.model.PartialRecord;
import com.esports.scraper.model.PlayerStat;
import com.esports.scraper.model.RecordType;
import com.esports.scraper.model.ScheduledTime;
import com.esports.scraper.model.Score;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>Record normalizer</h2>
 *
 * <p>Converts one {@link PartialRecord} into typed {@link NormalizedFields}:</p>
 * <ul>
 *   <li>start time resolved to UTC, or <code>unknown</code> plus a warning;</li>
 *   <li>names and participants NFC-normalized and whitespace-collapsed;</li>
 *   <li>scores parsed as non-negative integers;</li>
 *   <li>status labels mapped onto {@link MatchStatus};</li>
 *   <li>player stat lines parsed into {@link PlayerStat}s;</li>
 *   <li>everything else carried as string attributes.</li>
 * </ul>
 * <p>Nothing here throws on bad input. Problems become
 * {@link NormalizationWarning}s, and unresolvable required fields are listed
 * as missing so the record can be flagged incomplete downstream.</p>
 */
@Slf4j
@Component
public class RecordNormalizer {

    /** Required for every record type. */
    public static final String REQUIRED_NAME = "name";
    public static final String REQUIRED_TIME = "scheduledTime";
    /** Required for matches only. */
    public static final String REQUIRED_PARTICIPANTS = "participants";

    /** Raw fields consumed into typed slots rather than copied to attributes. */
    private static final Set<String> CONSUMED = Set.of(
            Fields.NAME, Fields.DATE, Fields.TIME, Fields.UTC_TIMESTAMP, Fields.DATES,
            Fields.TEAM1, Fields.TEAM2, Fields.SCORE1, Fields.SCORE2, Fields.STATUS);

    private static final Pattern STAT_KEY = Pattern.compile("^stats\\.(\\d+)\\.(\\d+)\\.(\\d+)\\.(\\w+)$");

    /** Placeholders the upstream prints for "no score yet". */
    private static final Set<String> EMPTY_SCORE = Set.of("-", "–", "—", "tbd", "?");

    private final DateTimeNormalizer dates;

    @Autowired
    public RecordNormalizer(final ScraperProperties props) {
        this(props.getUpstream().getZone());
    }

    public RecordNormalizer(final ZoneId upstreamZone) {
        this.dates = new DateTimeNormalizer(upstreamZone);
    }

    public NormalizedFields normalize(final PartialRecord partial) {
        RecordType type = partial.template().recordType();
        List<NormalizationWarning> warnings = new ArrayList<>();
        NormalizedFields.NormalizedFieldsBuilder out = NormalizedFields.builder()
                .nativeId(StringUtils.trimToNull(partial.recordId()))
                .type(type)
                .pageType(partial.pageType())
                .sourceUrl(partial.sourceUrl())
                .ordinal(partial.ordinal())
                .position(partial.position())
                .observedAt(partial.observedAt());

        String team1 = Names.display(partial.field(Fields.TEAM1));
        String team2 = Names.display(partial.field(Fields.TEAM2));
        if (team1 != null) {
            out.participant(team1);
        }
        if (team2 != null) {
            out.participant(team2);
        }

        String name = Names.display(partial.field(Fields.NAME));
        if (name == null && team1 != null && team2 != null) {
            name = team1 + " vs " + team2;
        }
        out.name(name);

        ScheduledTime time = type == RecordType.EVENT
                ? eventStart(partial, out, warnings)
                : matchStart(partial, warnings);
        out.scheduledTime(time);

        Integer s1 = score(Fields.SCORE1, partial.field(Fields.SCORE1), warnings);
        Integer s2 = score(Fields.SCORE2, partial.field(Fields.SCORE2), warnings);
        Score score = new Score(s1, s2);
        out.score(score.isEmpty() ? null : score);

        out.status(status(partial, score, warnings));
        List<MapScore> maps = maps(partial.fields(), warnings);
        out.maps(maps);
        out.playerStats(playerStats(partial.fields(), maps, warnings));

        partial.fields().forEach((k, v) -> {
            String value = Names.display(v);
            if (value != null && !CONSUMED.contains(k)
                    && !k.startsWith(Fields.MAP_PREFIX) && !k.startsWith(Fields.STATS_PREFIX)) {
                out.attribute(k, value);
            }
        });

        if (name == null) {
            out.missingField(REQUIRED_NAME);
        }
        if (!time.isKnown()) {
            out.missingField(REQUIRED_TIME);
        }
        if (type == RecordType.MATCH && (team1 == null || team2 == null)) {
            out.missingField(REQUIRED_PARTICIPANTS);
        }

        NormalizedFields result = out.warnings(warnings).build();
        if (!warnings.isEmpty()) {
            log.warn("{} normalization warning(s) for {} from {}: {}",
                    warnings.size(), result.nativeId(), result.sourceUrl(), warnings);
        }
        return result;
    }

    /**
     * Prefers the machine UTC timestamp, then the printed date and time.
     */
    private ScheduledTime matchStart(final PartialRecord p, final List<NormalizationWarning> warnings) {
        String utc = p.field(Fields.UTC_TIMESTAMP);
        Optional<OffsetDateTime> fromUtc = dates.parseUtcTimestamp(utc);
        if (fromUtc.isPresent()) {
            return ScheduledTime.of(fromUtc.get(), utc);
        }
        String date = p.field(Fields.DATE);
        String time = p.field(Fields.TIME);
        String raw = StringUtils.trimToNull(StringUtils.joinWith(" ",
                StringUtils.defaultString(date), StringUtils.defaultString(time)));
        Optional<OffsetDateTime> local = dates.parseLocal(date, time);
        if (local.isPresent()) {
            return ScheduledTime.of(local.get(), raw);
        }
        if (utc != null) {
            warnings.add(new NormalizationWarning(Fields.UTC_TIMESTAMP, utc, "unrecognised timestamp"));
        }
        warnings.add(new NormalizationWarning(Fields.DATE, raw,
                date == null ? "no date on page" : "unrecognised date format"));
        return ScheduledTime.unknown(raw);
    }

    private ScheduledTime eventStart(final PartialRecord p,
                                     final NormalizedFields.NormalizedFieldsBuilder out,
                                     final List<NormalizationWarning> warnings) {
        String raw = Names.display(p.field(Fields.DATES));
        DateTimeNormalizer.DateRange range = dates.parseRange(raw);
        range.end().ifPresent(end -> out.attribute("endDate", end.toString()));
        if (raw != null) {
            out.attribute(Fields.DATES, raw);
        }
        if (range.start().isPresent()) {
            return ScheduledTime.of(range.start().get(), raw);
        }
        warnings.add(new NormalizationWarning(Fields.DATES, raw,
                raw == null ? "no dates on page" : "unrecognised date range"));
        return ScheduledTime.unknown(raw);
    }

    @Nullable
    private static Integer score(final String field, @Nullable final String raw,
                                 final List<NormalizationWarning> warnings) {
        String s = StringUtils.trimToNull(raw);
        if (s == null || EMPTY_SCORE.contains(s.toLowerCase(Locale.ROOT))) {
            return null;
        }
        try {
            int value = Integer.parseInt(s);
            if (value < 0) {
                warnings.add(new NormalizationWarning(field, raw, "negative score"));
                return null;
            }
            return value;
        } catch (NumberFormatException ex) {
            warnings.add(new NormalizationWarning(field, raw, "not an integer"));
            return null;
        }
    }

    private static MatchStatus status(final PartialRecord p, final Score score,
                                      final List<NormalizationWarning> warnings) {
        String raw = StringUtils.trimToNull(p.field(Fields.STATUS));
        if (raw != null) {
            Optional<MatchStatus> mapped = StatusMapper.map(raw);
            if (mapped.isPresent()) {
                return mapped.get();
            }
            warnings.add(new NormalizationWarning(Fields.STATUS, raw, "unrecognised status"));
            return MatchStatus.UNKNOWN;
        }
        if (StatusMapper.isEta(p.field(Fields.ETA))) {
            return MatchStatus.UPCOMING;
        }
        return score.isComplete() ? MatchStatus.COMPLETED : MatchStatus.UNKNOWN;
    }

    /**
     * Collects the flattened {@code map.<n>.*} fields, ordered by map number.
     */
    private static List<MapScore> maps(final Map<String, String> fields,
                                       final List<NormalizationWarning> warnings) {
        TreeMap<Integer, String> names = new TreeMap<>();
        fields.forEach((k, v) -> {
            if (k.startsWith(Fields.MAP_PREFIX) && k.endsWith(".name") && v != null) {
                String order = k.substring(Fields.MAP_PREFIX.length(), k.length() - ".name".length());
                if (StringUtils.isNumeric(order)) {
                    names.put(Integer.parseInt(order), Names.display(v));
                }
            }
        });
        List<MapScore> maps = new ArrayList<>(names.size());
        names.forEach((order, mapName) -> maps.add(new MapScore(order, mapName,
                score(Fields.mapField(order, "score1"), fields.get(Fields.mapField(order, "score1")), warnings),
                score(Fields.mapField(order, "score2"), fields.get(Fields.mapField(order, "score2")), warnings))));
        return maps;
    }

    /**
     * Groups the flattened {@code stats.<map>.<team>.<row>.*} fields into one
     * line per player, ordered by map, team and row.
     */
    private static List<PlayerStat> playerStats(final Map<String, String> fields, final List<MapScore> maps,
                                                final List<NormalizationWarning> warnings) {
        TreeMap<String, Map<String, String>> lines = new TreeMap<>();
        fields.forEach((k, v) -> {
            Matcher m = STAT_KEY.matcher(k);
            if (m.matches() && v != null) {
                String line = String.format(Locale.ROOT, "%04d.%d.%04d",
                        Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
                lines.computeIfAbsent(line, x -> new HashMap<>()).put(m.group(4), v);
            }
        });

        Map<Integer, String> mapNames = new TreeMap<>();
        maps.forEach(m -> mapNames.put(m.order(), m.name()));

        List<PlayerStat> stats = new ArrayList<>(lines.size());
        lines.forEach((line, leaves) -> {
            String player = Names.display(leaves.get(Fields.STAT_PLAYER));
            if (player == null) {
                return;
            }
            String[] parts = line.split("\\.");
            int mapOrder = Integer.parseInt(parts[0]);
            Function<String, Integer> count = leaf -> statInt(leaf, leaves.get(leaf), warnings);
            stats.add(PlayerStat.builder()
                    .mapOrder(mapOrder)
                    .map(mapNames.get(mapOrder))
                    .team(Integer.parseInt(parts[1]))
                    .player(player)
                    .agent(Names.display(leaves.get(Fields.STAT_AGENT)))
                    .rating(statDecimal(leaves.get(Fields.STAT_RATING), warnings))
                    .acs(count.apply(Fields.STAT_ACS))
                    .kills(count.apply(Fields.STAT_KILLS))
                    .deaths(count.apply(Fields.STAT_DEATHS))
                    .assists(count.apply(Fields.STAT_ASSISTS))
                    .kast(count.apply(Fields.STAT_KAST))
                    .adr(count.apply(Fields.STAT_ADR))
                    .headshotPercent(count.apply(Fields.STAT_HS))
                    .firstKills(count.apply(Fields.STAT_FK))
                    .firstDeaths(count.apply(Fields.STAT_FD))
                    .build());
        });
        return stats;
    }

    /**
     * Whole-number stat cell; a trailing {@code %} is dropped.
     */
    @Nullable
    private static Integer statInt(final String leaf, @Nullable final String raw,
                                   final List<NormalizationWarning> warnings) {
        String s = StringUtils.removeEnd(StringUtils.trimToNull(raw), "%");
        if (s == null || EMPTY_SCORE.contains(s)) {
            return null;
        }
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException ex) {
            warnings.add(new NormalizationWarning(Fields.STATS_PREFIX + leaf, raw, "not an integer"));
            return null;
        }
    }

    @Nullable
    private static Double statDecimal(@Nullable final String raw, final List<NormalizationWarning> warnings) {
        String s = StringUtils.trimToNull(raw);
        if (s == null || EMPTY_SCORE.contains(s)) {
            return null;
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException ex) {
            warnings.add(new NormalizationWarning(Fields.STATS_PREFIX + Fields.STAT_RATING, raw, "not a number"));
            return null;
        }
    }
}
