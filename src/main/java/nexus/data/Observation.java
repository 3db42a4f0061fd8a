package nexus.data;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One calendar date and its numeric fields. Immutable; the {@code with*} methods return copies.
 * An absent field reads as {@link Double#NaN}.
 */
public final class Observation {

    private final LocalDate date;
    private final Map<String, Double> values;

    public Observation(LocalDate date, Map<String, Double> values) {
        this.date = Objects.requireNonNull(date, "date");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public LocalDate getDate() { return date; }

    /** Field names in insertion order. */
    public Map<String, Double> getValues() { return values; }

    public double get(String column) {
        Double v = values.get(column);
        return v == null ? Double.NaN : v;
    }

    public boolean has(String column) {
        return !Double.isNaN(get(column));
    }

    public Observation with(String column, double value) {
        Map<String, Double> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new Observation(date, copy);
    }

    public Observation withDate(LocalDate newDate) {
        return new Observation(newDate, values);
    }

    @Override
    public String toString() {
        return "Observation{" + date + ", " + values + "}";
    }
}
