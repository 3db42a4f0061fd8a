package nexus.data;

/**
 * Base type for failures raised by the analysis stages.
 * Stages that can degrade instead of failing report that in their results, not through this type.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
