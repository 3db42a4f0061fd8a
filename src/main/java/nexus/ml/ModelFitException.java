package nexus.ml;

import nexus.data.PipelineException;

/** Numerical failure while fitting a model. Fatal to the forecasting stage only. */
public class ModelFitException extends PipelineException {

    public ModelFitException(String message) {
        super(message);
    }

    public ModelFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
