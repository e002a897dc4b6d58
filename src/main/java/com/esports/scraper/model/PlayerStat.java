package com.esports.scraper.model;

import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * One player's line in a match stats table.
 * <p>
 * {@code mapOrder} is the map number the line belongs to, or {@code 0} for the
 * all-maps overview. {@code team} is 1 or 2, following header order.
 * Percentages are whole numbers; unparseable cells are {@code null}.
 * </p>
 */
@Builder
public record PlayerStat(
        int mapOrder,
        @Nullable String map,
        int team,
        String player,
        @Nullable String agent,
        @Nullable Double rating,
        @Nullable Integer acs,
        @Nullable Integer kills,
        @Nullable Integer deaths,
        @Nullable Integer assists,
        @Nullable Integer kast,
        @Nullable Integer adr,
        @Nullable Integer headshotPercent,
        @Nullable Integer firstKills,
        @Nullable Integer firstDeaths
) {

    /** Map order used for the all-maps overview table. */
    public static final int ALL_MAPS = 0;
}
