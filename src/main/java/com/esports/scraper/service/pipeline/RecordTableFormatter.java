package com.esports.scraper.service.pipeline;

import com.esports.scraper.model.CanonicalRecord;
import com.esports.scraper.model.Fields;
import com.esports.scraper.model.MapScore;
import com.esports.scraper.model.RecordType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flattens canonical records into dashboard rows with a fixed column order.
 * Match rows and event rows share the leading columns.
 */
@Component
public class RecordTableFormatter {

    public List<Map<String, Object>> toRows(final List<CanonicalRecord> records) {
        return records.stream().map(this::toRow).toList();
    }

    public Map<String, Object> toRow(final CanonicalRecord r) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", r.id());
        row.put("type", r.type().name());
        row.put("name", r.name());
        row.put("scheduledTime", r.scheduledTime().toString());
        row.put("status", r.status().name());

        Map<String, String> attrs = r.attributes();
        if (r.type() == RecordType.MATCH) {
            row.put("team1", participant(r, 0));
            row.put("team2", participant(r, 1));
            row.put("score", r.score() == null ? null : r.score().toString());
            row.put("event", attrs.get(Fields.EVENT));
            row.put("stage", attrs.get(Fields.STAGE));
            row.put("format", attrs.get(Fields.FORMAT));
            row.put("patch", attrs.get(Fields.PATCH));
            row.put("maps", maps(r.maps()));
            row.put("playerLines", r.playerStats().size());
        } else {
            row.put("dates", attrs.get(Fields.DATES));
            row.put("endDate", attrs.get("endDate"));
            row.put("location", attrs.get(Fields.LOCATION));
            row.put("region", attrs.get(Fields.REGION));
            row.put("prizePool", attrs.get(Fields.PRIZE_POOL));
        }

        row.put("incomplete", r.incomplete());
        row.put("missing", String.join(",", r.missingFields()));
        row.put("warnings", r.warnings().size());
        row.put("sources", r.provenance().size());
        row.put("lastUpdated", r.lastUpdated() == null ? null : r.lastUpdated().toString());
        return row;
    }

    private static String participant(final CanonicalRecord r, final int index) {
        return index < r.participants().size() ? r.participants().get(index) : null;
    }

    /** {@code Bind 13-7; Lotus 9-13} */
    private static String maps(final List<MapScore> maps) {
        if (maps.isEmpty()) {
            return null;
        }
        return maps.stream()
                .map(m -> m.name() + " " + side(m.score1()) + "-" + side(m.score2()))
                .collect(Collectors.joining("; "));
    }

    private static String side(final Integer score) {
        return score == null ? "?" : score.toString();
    }
}
