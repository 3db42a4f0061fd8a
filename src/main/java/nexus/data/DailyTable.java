package nexus.data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column-oriented, date-indexed table. Dates are unique and strictly increasing.
 * Instances are immutable: column arrays are copied on the way in and on the way out,
 * and every transformation returns a new table.
 */
public final class DailyTable {

    private final List<LocalDate> dates;
    private final Map<String, double[]> columns;

    public DailyTable(List<LocalDate> dates, Map<String, double[]> columns) {
        for (int i = 1; i < dates.size(); i++) {
            if (!dates.get(i).isAfter(dates.get(i - 1))) {
                throw new IllegalArgumentException("Dates must be strictly increasing: "
                    + dates.get(i - 1) + " then " + dates.get(i));
            }
        }
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            if (e.getValue().length != dates.size()) {
                throw new IllegalArgumentException("Column '" + e.getKey() + "' has " + e.getValue().length
                    + " values for " + dates.size() + " dates");
            }
            copy.put(e.getKey(), e.getValue().clone());
        }
        this.dates = List.copyOf(dates);
        this.columns = copy;
    }

    /** Builds a table from observations already sorted by date; columns are the union of all fields. */
    public static DailyTable fromObservations(List<Observation> observations) {
        Set<String> names = new LinkedHashSet<>();
        List<LocalDate> dates = new ArrayList<>(observations.size());
        for (Observation o : observations) {
            dates.add(o.getDate());
            names.addAll(o.getValues().keySet());
        }
        Map<String, double[]> cols = new LinkedHashMap<>();
        for (String name : names) {
            double[] values = new double[observations.size()];
            for (int i = 0; i < values.length; i++) values[i] = observations.get(i).get(name);
            cols.put(name, values);
        }
        return new DailyTable(dates, cols);
    }

    public int size() { return dates.size(); }
    public boolean isEmpty() { return dates.isEmpty(); }

    public List<LocalDate> dates() { return dates; }
    public LocalDate date(int i) { return dates.get(i); }
    public LocalDate firstDate() { return dates.get(0); }
    public LocalDate lastDate() { return dates.get(dates.size() - 1); }

    public Set<String> columnNames() {
        return Collections.unmodifiableSet(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /** Copy of the column values. */
    public double[] column(String name) {
        return requireColumn(name).clone();
    }

    public double value(String column, int row) {
        return requireColumn(column)[row];
    }

    /** Row index for the date, or -1. */
    public int indexOf(LocalDate date) {
        int i = Collections.binarySearch(dates, date);
        return i >= 0 ? i : -1;
    }

    public Observation row(int i) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) values.put(e.getKey(), e.getValue()[i]);
        return new Observation(dates.get(i), values);
    }

    public List<Observation> observations() {
        List<Observation> rows = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) rows.add(row(i));
        return rows;
    }

    public DailyTable withColumn(String name, double[] values) {
        Map<String, double[]> cols = new LinkedHashMap<>(columns);
        cols.put(name, values);
        return new DailyTable(dates, cols);
    }

    /** Rows [from, to). */
    public DailyTable slice(int from, int to) {
        Map<String, double[]> cols = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            cols.put(e.getKey(), Arrays.copyOfRange(e.getValue(), from, to));
        }
        return new DailyTable(dates.subList(from, to), cols);
    }

    /** Keeps only rows where every listed column is set. */
    public DailyTable dropRowsMissing(Iterable<String> required) {
        List<Integer> keep = new ArrayList<>();
        for (int i = 0; i < size(); i++) {
            boolean complete = true;
            for (String c : required) {
                if (!hasColumn(c) || Double.isNaN(columns.get(c)[i])) {
                    complete = false;
                    break;
                }
            }
            if (complete) keep.add(i);
        }
        if (keep.size() == size()) return this;
        List<LocalDate> keptDates = new ArrayList<>(keep.size());
        for (int i : keep) keptDates.add(dates.get(i));
        Map<String, double[]> cols = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] src = e.getValue();
            double[] dst = new double[keep.size()];
            for (int k = 0; k < dst.length; k++) dst[k] = src[keep.get(k)];
            cols.put(e.getKey(), dst);
        }
        return new DailyTable(keptDates, cols);
    }

    /** Keeps only rows where every column is set. */
    public DailyTable dropIncompleteRows() {
        return dropRowsMissing(columns.keySet());
    }

    private double[] requireColumn(String name) {
        double[] values = columns.get(name);
        if (values == null) throw new IllegalArgumentException("No column '" + name + "'");
        return values;
    }
}
