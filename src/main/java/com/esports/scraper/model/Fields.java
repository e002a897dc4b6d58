package com.esports.scraper.model;

/**
 * Raw field names shared between the parsers and the normalizer.
 */
public final class Fields {

    public static final String NAME = "name";
    public static final String SUBTITLE = "subtitle";
    public static final String DATE = "date";
    public static final String TIME = "time";
    public static final String UTC_TIMESTAMP = "utcTimestamp";
    public static final String DATES = "dates";
    public static final String TEAM1 = "team1";
    public static final String TEAM2 = "team2";
    public static final String SCORE1 = "score1";
    public static final String SCORE2 = "score2";
    public static final String STATUS = "status";
    public static final String ETA = "eta";
    public static final String STAGE = "stage";
    public static final String EVENT = "event";
    public static final String FORMAT = "format";
    public static final String PATCH = "patch";
    public static final String LOCATION = "location";
    public static final String REGION = "region";
    public static final String PRIZE_POOL = "prizePool";
    public static final String DETAIL_URL = "detailUrl";

    /** Map entries are flattened as {@code map.<n>.name}, {@code map.<n>.score1}, ... */
    public static final String MAP_PREFIX = "map.";

    /** Player stat lines are flattened as {@code stats.<map>.<team>.<row>.<leaf>}; map 0 is the overview. */
    public static final String STATS_PREFIX = "stats.";

    public static final String STAT_PLAYER = "player";
    public static final String STAT_AGENT = "agent";
    public static final String STAT_RATING = "rating";
    public static final String STAT_ACS = "acs";
    public static final String STAT_KILLS = "kills";
    public static final String STAT_DEATHS = "deaths";
    public static final String STAT_ASSISTS = "assists";
    public static final String STAT_KAST = "kast";
    public static final String STAT_ADR = "adr";
    public static final String STAT_HS = "hs";
    public static final String STAT_FK = "fk";
    public static final String STAT_FD = "fd";

    private Fields() {
    }

    public static String mapField(final int order, final String leaf) {
        return MAP_PREFIX + order + "." + leaf;
    }

    public static String statField(final int mapOrder, final int team, final int row, final String leaf) {
        return STATS_PREFIX + mapOrder + "." + team + "." + row + "." + leaf;
    }
}
