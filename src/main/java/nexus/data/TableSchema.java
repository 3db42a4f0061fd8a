package nexus.data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Column contract for each date-keyed input table.
 * <p>
 * Aliases cover the column names used by the upstream collectors; they are rewritten to the
 * canonical name at ingestion so later stages only ever see {@link Columns} names.
 */
public enum TableSchema {

    DISEASE("disease", true,
        List.of(Columns.CASE_COUNT),
        Map.of("dhaka_cases", Columns.CASE_COUNT, "cases", Columns.CASE_COUNT)),

    WEATHER("weather", true,
        List.of(Columns.TEMPERATURE, Columns.HUMIDITY, Columns.RAINFALL),
        Map.of("temp", Columns.TEMPERATURE)),

    POPULATION("population", true,
        List.of(Columns.POPULATION_ESTIMATE),
        Map.of("dhaka_population_estimated", Columns.POPULATION_ESTIMATE, "population", Columns.POPULATION_ESTIMATE)),

    NIGHTLIGHT("nightlight", true,
        List.of(Columns.RADIANCE),
        Map.of("nightlight_radiance", Columns.RADIANCE, "avg_rad", Columns.RADIANCE)),

    ECONOMIC("economic", false,
        List.of(),
        Map.of("gdp_growth", Columns.GDP_GROWTH_RATE, "inflation", Columns.INFLATION_RATE));

    private final String tableName;
    private final boolean mandatory;
    private final List<String> requiredColumns;
    private final Map<String, String> aliases;

    TableSchema(String tableName, boolean mandatory, List<String> requiredColumns,
                Map<String, String> aliases) {
        this.tableName = tableName;
        this.mandatory = mandatory;
        this.requiredColumns = requiredColumns;
        this.aliases = aliases;
    }

    public String getTableName() { return tableName; }
    public boolean isMandatory() { return mandatory; }
    public List<String> getRequiredColumns() { return requiredColumns; }

    /** Mandatory tables merged by the Unifier, in declaration order. */
    public static List<TableSchema> unified() {
        List<TableSchema> out = new ArrayList<>();
        for (TableSchema schema : values()) {
            if (schema.isMandatory()) out.add(schema);
        }
        return out;
    }

    /** Canonical name for a raw header: trimmed, lower-cased, alias resolved. */
    public String canonicalColumn(String header) {
        String key = header.trim().toLowerCase(Locale.ROOT);
        return aliases.getOrDefault(key, key);
    }

    /** @throws SchemaViolationException if any required column is absent */
    public void validate(DailyTable table) {
        List<String> missing = new ArrayList<>();
        for (String column : requiredColumns) {
            if (!table.hasColumn(column)) missing.add(column);
        }
        if (!missing.isEmpty()) {
            throw new SchemaViolationException(tableName, missing);
        }
    }

    /** Canonicalizes every key of a raw header map, keeping first occurrence order. */
    public Map<String, Integer> canonicalHeaderIndex(List<String> headers) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            index.putIfAbsent(canonicalColumn(headers.get(i)), i);
        }
        return index;
    }
}
