package nexus.data;

import java.util.List;

/** A table is missing columns its schema declares as required. */
public class SchemaViolationException extends PipelineException {

    private final String table;
    private final List<String> missingColumns;

    public SchemaViolationException(String table, List<String> missingColumns) {
        super("Table '" + table + "' is missing required columns " + missingColumns);
        this.table = table;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String getTable() { return table; }
    public List<String> getMissingColumns() { return missingColumns; }
}
