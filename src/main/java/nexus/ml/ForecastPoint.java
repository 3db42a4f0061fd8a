package nexus.ml;

import java.time.LocalDate;

/** One forecast day. Always lower <= point <= upper and point >= 0. */
public final class ForecastPoint {

    /** Two-sided 95% under a Gaussian assumption. */
    public static final double Z_95 = 1.96;

    private final LocalDate date;
    private final double point;
    private final double lower;
    private final double upper;

    private ForecastPoint(LocalDate date, double point, double lower, double upper) {
        this.date = date;
        this.point = point;
        this.lower = lower;
        this.upper = upper;
    }

    /** Builds the interval mean ± 1.96σ, clamping every bound at zero independently. */
    public static ForecastPoint of(LocalDate date, double mean, double sigma) {
        double s = Math.abs(sigma);
        return new ForecastPoint(date,
            Math.max(0, mean),
            Math.max(0, mean - Z_95 * s),
            Math.max(0, mean + Z_95 * s));
    }

    public LocalDate getDate() { return date; }
    public double getPoint() { return point; }
    public double getLower() { return lower; }
    public double getUpper() { return upper; }
}
