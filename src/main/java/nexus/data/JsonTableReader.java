package nexus.data;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads tables posted as JSON arrays of row objects, e.g.
 * {@code [{"date": "2024-01-01", "dhaka_cases": 12}, ...]}. Headers, aliases and cell parsing
 * follow {@link CsvTableReader}.
 */
public final class JsonTableReader {

    private JsonTableReader() {
    }

    /** @throws SchemaViolationException if a row has no {@code date} key */
    public static DailyTable read(JsonArray rows, TableSchema schema) {
        TreeMap<LocalDate, Map<String, Double>> byDate = new TreeMap<>();
        Set<String> seen = new LinkedHashSet<>();
        for (JsonElement element : rows) {
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException("Rows of '" + schema.getTableName() + "' must be JSON objects");
            }
            Map<String, String> cells = canonicalCells(element.getAsJsonObject(), schema);
            if (!cells.containsKey(Columns.DATE)) {
                throw new SchemaViolationException(schema.getTableName(), List.of(Columns.DATE));
            }
            LocalDate date = CsvTableReader.parseDate(cells.remove(Columns.DATE));
            if (date == null) continue;
            Map<String, Double> values = new LinkedHashMap<>();
            for (Map.Entry<String, String> cell : cells.entrySet()) {
                values.put(cell.getKey(), CsvTableReader.parseNumber(cell.getValue()));
                seen.add(cell.getKey());
            }
            byDate.put(date, values);
        }
        List<Observation> observations = new ArrayList<>(byDate.size());
        for (Map.Entry<LocalDate, Map<String, Double>> e : byDate.entrySet()) {
            observations.add(new Observation(e.getKey(), e.getValue()));
        }
        if (observations.isEmpty()) {
            Map<String, double[]> cols = new LinkedHashMap<>();
            for (String column : seen) cols.put(column, new double[0]);
            return new DailyTable(List.of(), cols);
        }
        return DailyTable.fromObservations(observations);
    }

    /** Latest row by year, then date, then position. Null or empty yields {@link MacroContext#ZERO}. */
    public static MacroContext readMacroContext(JsonArray rows) {
        if (rows == null) return MacroContext.ZERO;
        Map<String, String> latest = null;
        double latestKey = Double.NEGATIVE_INFINITY;
        int position = 0;
        for (JsonElement element : rows) {
            position++;
            if (!element.isJsonObject()) continue;
            Map<String, String> cells = canonicalCells(element.getAsJsonObject(), TableSchema.ECONOMIC);
            double key;
            if (cells.containsKey(Columns.YEAR)) {
                key = CsvTableReader.parseNumber(cells.get(Columns.YEAR));
            } else if (cells.containsKey(Columns.DATE)) {
                LocalDate date = CsvTableReader.parseDate(cells.get(Columns.DATE));
                key = date == null ? Double.NaN : date.toEpochDay();
            } else {
                key = position;
            }
            if (!Double.isNaN(key) && key >= latestKey) {
                latest = cells;
                latestKey = key;
            }
        }
        if (latest == null) return MacroContext.ZERO;
        return new MacroContext(orZero(latest.get(Columns.GDP_GROWTH_RATE)), orZero(latest.get(Columns.INFLATION_RATE)));
    }

    private static Map<String, String> canonicalCells(JsonObject row, TableSchema schema) {
        Map<String, String> cells = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> e : row.entrySet()) {
            cells.putIfAbsent(schema.canonicalColumn(e.getKey()), text(e.getValue()));
        }
        return cells;
    }

    private static String text(JsonElement value) {
        if (value == null || value.isJsonNull()) return null;
        if (value.isJsonPrimitive()) {
            JsonPrimitive p = value.getAsJsonPrimitive();
            return p.getAsString();
        }
        return null;
    }

    private static double orZero(String raw) {
        double v = CsvTableReader.parseNumber(raw);
        return Double.isNaN(v) ? 0 : v;
    }
}
