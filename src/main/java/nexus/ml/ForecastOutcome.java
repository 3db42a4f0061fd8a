package nexus.ml;

import java.util.List;
import java.util.Optional;

/** Result of the forecasting stage. Anything but {@link Status#COMPLETED} carries no points. */
public final class ForecastOutcome {

    public enum Status { COMPLETED, INSUFFICIENT_DATA, FIT_FAILED }

    private final Status status;
    private final List<ForecastPoint> points;
    private final ValidationResult validation;
    private final List<String> features;
    private final String message;

    private ForecastOutcome(Status status, List<ForecastPoint> points, ValidationResult validation,
                            List<String> features, String message) {
        this.status = status;
        this.points = List.copyOf(points);
        this.validation = validation;
        this.features = List.copyOf(features);
        this.message = message;
    }

    public static ForecastOutcome completed(List<ForecastPoint> points, ValidationResult validation, List<String> features) {
        return new ForecastOutcome(Status.COMPLETED, points, validation, features, null);
    }

    public static ForecastOutcome insufficientData(String message) {
        return new ForecastOutcome(Status.INSUFFICIENT_DATA, List.of(), null, List.of(), message);
    }

    public static ForecastOutcome fitFailed(String message) {
        return new ForecastOutcome(Status.FIT_FAILED, List.of(), null, List.of(), message);
    }

    public Status getStatus() { return status; }
    public boolean isAvailable() { return status == Status.COMPLETED; }
    public List<ForecastPoint> getPoints() { return points; }
    /** Absent when validation was skipped or the forecast did not complete. */
    public Optional<ValidationResult> getValidation() { return Optional.ofNullable(validation); }
    public List<String> getFeatures() { return features; }
    public Optional<String> getMessage() { return Optional.ofNullable(message); }
}
