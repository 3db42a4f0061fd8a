package nexus.data;

/** Canonical column names shared by every stage. */
public final class Columns {

    public static final String DATE = "date";

    public static final String CASE_COUNT = "case_count";
    public static final String CUMULATIVE_DEATHS = "cumulative_deaths";
    public static final String POPULATION_ESTIMATE = "population_estimate";
    public static final String TEMPERATURE = "temperature";
    public static final String HUMIDITY = "humidity";
    public static final String RAINFALL = "rainfall";
    public static final String RADIANCE = "radiance";
    public static final String GDP_GROWTH_RATE = "gdp_growth_rate";
    public static final String INFLATION_RATE = "inflation_rate";
    public static final String YEAR = "year";

    /** Incidence per 100k, the modelled target. */
    public static final String TARGET = "cases_per_100k";

    public static final String DAY_OF_YEAR = "day_of_year";
    public static final String IS_MONSOON = "is_monsoon";

    private Columns() {
    }

    public static String rollingMean(String column, int window) {
        return column + "_rolling_mean_" + window;
    }
}
