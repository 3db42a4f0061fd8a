package nexus.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Outer-joins the mandatory source tables on date, closes gaps and derives the incidence target.
 * <p>
 * Gap filling per column: interior gaps are interpolated linearly in elapsed days between the
 * nearest known values on either side; leading gaps take the first known value and trailing gaps
 * the last one. A column with no known value at all becomes 0. The output covers every calendar
 * day of the analysis window, which defaults to the first and last date seen in any source.
 */
public class Unifier {

    private static final Logger log = LoggerFactory.getLogger(Unifier.class);

    private static final double PER_100K = 100_000.0;

    private final LocalDate windowStart;
    private final LocalDate windowEnd;

    public Unifier() {
        this(null, null);
    }

    /** Either bound may be null to use the data's own extent. */
    public Unifier(LocalDate windowStart, LocalDate windowEnd) {
        if (windowStart != null && windowEnd != null && windowEnd.isBefore(windowStart)) {
            throw new IllegalArgumentException("Analysis window ends before it starts: " + windowStart + ".." + windowEnd);
        }
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
    }

    /**
     * @param live optional live row, may be null
     * @throws MissingSourceException    if a mandatory table is absent
     * @throws SchemaViolationException  if a mandatory table lacks a required column
     */
    public DailyTable unify(SourceTables sources, LiveObservation live) {
        NavigableMap<LocalDate, Map<String, Double>> merged = new TreeMap<>();
        Set<String> columns = new LinkedHashSet<>();

        for (TableSchema schema : TableSchema.unified()) {
            DailyTable table = sources.require(schema);
            schema.validate(table);
            columns.addAll(table.columnNames());
            for (int i = 0; i < table.size(); i++) {
                Map<String, Double> row = merged.computeIfAbsent(table.date(i), d -> new LinkedHashMap<>());
                for (String column : table.columnNames()) {
                    double v = table.value(column, i);
                    if (!Double.isNaN(v)) row.put(column, v);
                }
            }
        }

        if (live != null) {
            Observation liveRow = live.toObservation();
            Map<String, Double> row = merged.computeIfAbsent(liveRow.getDate(), d -> new LinkedHashMap<>());
            row.putAll(liveRow.getValues());
            columns.addAll(liveRow.getValues().keySet());
            log.info("Live observation for {} supersedes historical weather on that date", liveRow.getDate());
        }

        if (merged.isEmpty()) {
            throw new MissingSourceException(TableSchema.DISEASE, "Source tables contain no dated rows");
        }

        LocalDate start = windowStart != null ? windowStart : merged.firstKey();
        LocalDate end = windowEnd != null ? windowEnd : merged.lastKey();
        List<LocalDate> calendar = calendar(start, end);
        if (calendar.isEmpty()) {
            throw new PipelineException("Analysis window " + start + ".." + end + " contains no dates");
        }

        Map<String, double[]> filled = new LinkedHashMap<>();
        for (String column : columns) {
            filled.put(column, fillColumn(column, merged, calendar));
        }
        filled.put(Columns.TARGET, incidence(calendar, filled.get(Columns.CASE_COUNT), filled.get(Columns.POPULATION_ESTIMATE)));

        log.info("Unified {} source rows into {} daily records ({} .. {})",
            merged.size(), calendar.size(), calendar.get(0), calendar.get(calendar.size() - 1));
        return new DailyTable(calendar, filled);
    }

    /** Every day from start to end inclusive. */
    static List<LocalDate> calendar(LocalDate start, LocalDate end) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) days.add(d);
        return days;
    }

    private static double[] fillColumn(String column, NavigableMap<LocalDate, Map<String, Double>> merged,
                                       List<LocalDate> calendar) {
        NavigableMap<LocalDate, Double> known = new TreeMap<>();
        for (Map.Entry<LocalDate, Map<String, Double>> e : merged.entrySet()) {
            Double v = e.getValue().get(column);
            if (v != null && !Double.isNaN(v)) known.put(e.getKey(), v);
        }
        double[] out = new double[calendar.size()];
        if (known.isEmpty()) {
            log.warn("Column '{}' has no values in any source; defaulting to 0", column);
            return out;
        }
        for (int i = 0; i < out.length; i++) {
            out[i] = interpolate(known, calendar.get(i));
        }
        return out;
    }

    /** Time-weighted linear interpolation, falling back to the nearest known value at the edges. */
    static double interpolate(NavigableMap<LocalDate, Double> known, LocalDate date) {
        Map.Entry<LocalDate, Double> before = known.floorEntry(date);
        Map.Entry<LocalDate, Double> after = known.ceilingEntry(date);
        if (before != null && before.getKey().equals(date)) return before.getValue();
        if (before == null) return after.getValue();
        if (after == null) return before.getValue();
        long span = ChronoUnit.DAYS.between(before.getKey(), after.getKey());
        long elapsed = ChronoUnit.DAYS.between(before.getKey(), date);
        double weight = (double) elapsed / span;
        return before.getValue() + weight * (after.getValue() - before.getValue());
    }

    private static double[] incidence(List<LocalDate> calendar, double[] cases, double[] population) {
        double[] target = new double[calendar.size()];
        int guarded = 0;
        for (int i = 0; i < target.length; i++) {
            double pop = population[i];
            if (Double.isNaN(pop) || pop <= 0 || Double.isNaN(cases[i])) {
                target[i] = 0;
                guarded++;
                if (guarded == 1) log.warn("No usable population estimate on {}; incidence set to 0", calendar.get(i));
            } else {
                target[i] = cases[i] / pop * PER_100K;
            }
        }
        if (guarded > 1) {
            log.warn("Incidence defaulted to 0 on {} of {} days because population was zero or missing",
                guarded, target.length);
        }
        return target;
    }
}
