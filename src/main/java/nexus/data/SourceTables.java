package nexus.data;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** The date-keyed input tables handed to the Unifier, keyed by schema. */
public final class SourceTables {

    private final Map<TableSchema, DailyTable> tables;

    private SourceTables(Map<TableSchema, DailyTable> tables) {
        this.tables = tables;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<DailyTable> get(TableSchema schema) {
        return Optional.ofNullable(tables.get(schema));
    }

    /** @throws MissingSourceException if the table was never supplied */
    public DailyTable require(TableSchema schema) {
        DailyTable table = tables.get(schema);
        if (table == null) {
            throw new MissingSourceException(schema, "Required source table '" + schema.getTableName() + "' is missing");
        }
        return table;
    }

    public static final class Builder {
        private final Map<TableSchema, DailyTable> tables = new EnumMap<>(TableSchema.class);

        public Builder put(TableSchema schema, DailyTable table) {
            tables.put(schema, table);
            return this;
        }

        public SourceTables build() {
            return new SourceTables(new EnumMap<>(tables));
        }
    }
}
