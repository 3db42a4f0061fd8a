package nexus.data;

/** A mandatory input table could not be located or parsed. Aborts the whole run. */
public class MissingSourceException extends PipelineException {

    private final TableSchema schema;

    public MissingSourceException(TableSchema schema, String message) {
        super(message);
        this.schema = schema;
    }

    public MissingSourceException(TableSchema schema, String message, Throwable cause) {
        super(message, cause);
        this.schema = schema;
    }

    public TableSchema getSchema() { return schema; }
}
