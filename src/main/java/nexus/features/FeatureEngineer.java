package nexus.features;

import nexus.data.Columns;
import nexus.data.DailyTable;
import nexus.data.Observation;
import nexus.data.SchemaViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Adds calendar features and trailing rolling means to a unified series.
 * <p>
 * The table path ({@link #engineer}) and the single-record path ({@link #engineerNext}) share the
 * same window rule, so records synthesized during forecasting carry features computed exactly as
 * they are for history.
 */
public class FeatureEngineer {

    private static final Logger log = LoggerFactory.getLogger(FeatureEngineer.class);

    private final List<Integer> windows;
    private final List<String> rolledColumns;
    private final int longestWindow;

    public FeatureEngineer(List<Integer> windows, List<String> rolledColumns) {
        if (windows.isEmpty()) throw new IllegalArgumentException("at least one rolling window is required");
        for (int w : windows) {
            if (w < 1) throw new IllegalArgumentException("rolling windows must be >= 1, got " + w);
        }
        this.windows = List.copyOf(windows);
        this.rolledColumns = List.copyOf(rolledColumns);
        this.longestWindow = Collections.max(windows);
    }

    /** Names of every column this engineer adds. */
    public List<String> featureNames() {
        List<String> names = new ArrayList<>();
        names.add(Columns.DAY_OF_YEAR);
        names.add(Columns.IS_MONSOON);
        for (String column : rolledColumns) {
            for (int w : windows) names.add(Columns.rollingMean(column, w));
        }
        return names;
    }

    /**
     * Returns a new table with the engineered columns; the input is not modified.
     * Rows left with any unset field are dropped as a final integrity guard.
     *
     * @throws SchemaViolationException if a rolled column is absent
     */
    public DailyTable engineer(DailyTable unified) {
        List<String> missing = new ArrayList<>();
        for (String column : rolledColumns) {
            if (!unified.hasColumn(column)) missing.add(column);
        }
        if (!missing.isEmpty()) throw new SchemaViolationException("unified", missing);

        double[] dayOfYear = new double[unified.size()];
        double[] monsoon = new double[unified.size()];
        for (int i = 0; i < unified.size(); i++) {
            LocalDate date = unified.date(i);
            dayOfYear[i] = CalendarFeatures.dayOfYear(date);
            monsoon[i] = CalendarFeatures.isMonsoon(date) ? 1 : 0;
        }
        DailyTable out = unified
            .withColumn(Columns.DAY_OF_YEAR, dayOfYear)
            .withColumn(Columns.IS_MONSOON, monsoon);
        for (String column : rolledColumns) {
            double[] values = unified.column(column);
            for (int w : windows) {
                out = out.withColumn(Columns.rollingMean(column, w), RollingWindow.trailingMeans(values, w));
            }
        }

        DailyTable complete = out.dropIncompleteRows();
        if (complete.size() < out.size()) {
            log.warn("Dropped {} engineered rows with unresolved fields", out.size() - complete.size());
        }
        log.info("Engineered {} features over {} records", featureNames().size(), complete.size());
        return complete;
    }

    /**
     * Engineers the record that would follow {@code history}: calendar fields from its own date,
     * rolling means over the tail of history plus the record itself. Neither argument is modified.
     */
    public Observation engineerNext(List<Observation> history, Observation next) {
        int from = Math.max(0, history.size() - (longestWindow - 1));
        List<Observation> tail = new ArrayList<>(history.subList(from, history.size()));
        tail.add(next);

        Observation out = next
            .with(Columns.DAY_OF_YEAR, CalendarFeatures.dayOfYear(next.getDate()))
            .with(Columns.IS_MONSOON, CalendarFeatures.isMonsoon(next.getDate()) ? 1 : 0);
        for (String column : rolledColumns) {
            for (int w : windows) {
                out = out.with(Columns.rollingMean(column, w), RollingWindow.trailingMean(tail, column, w));
            }
        }
        return out;
    }
}
