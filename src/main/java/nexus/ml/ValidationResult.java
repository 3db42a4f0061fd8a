package nexus.ml;

import java.time.LocalDate;
import java.util.List;

/** Predictions on the held-out recent slice from a model fitted on the earlier rows. */
public final class ValidationResult {

    private final List<LocalDate> dates;
    private final double[] actual;
    private final double[] predicted;
    private final double[] std;
    private final int trainingRows;

    public ValidationResult(List<LocalDate> dates, double[] actual, double[] predicted, double[] std, int trainingRows) {
        if (dates.size() != actual.length || actual.length != predicted.length || predicted.length != std.length) {
            throw new IllegalArgumentException("validation arrays differ in length");
        }
        this.dates = List.copyOf(dates);
        this.actual = actual.clone();
        this.predicted = predicted.clone();
        this.std = std.clone();
        this.trainingRows = trainingRows;
    }

    public List<LocalDate> getDates() { return dates; }
    public double[] getActual() { return actual.clone(); }
    public double[] getPredicted() { return predicted.clone(); }
    public double[] getStd() { return std.clone(); }
    public int getTrainingRows() { return trainingRows; }
    public int size() { return actual.length; }

    public double meanAbsoluteError() {
        if (actual.length == 0) return 0;
        double sum = 0;
        for (int i = 0; i < actual.length; i++) sum += Math.abs(actual[i] - predicted[i]);
        return sum / actual.length;
    }

    /** Coefficient of determination on the held-out slice; 0 when the slice is constant. */
    public double rSquared() {
        if (actual.length == 0) return 0;
        double mean = 0;
        for (double a : actual) mean += a;
        mean /= actual.length;
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < actual.length; i++) {
            ssTot += (actual[i] - mean) * (actual[i] - mean);
            ssRes += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
        }
        return ssTot > 0 ? 1.0 - ssRes / ssTot : 0;
    }
}
