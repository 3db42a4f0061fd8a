package nexus.burden;

/**
 * Two-point short-term trend: mean of the last 7 days against the mean of the 7 days before.
 * Only a strictly greater recent mean counts as increasing.
 */
public enum TrendLabel {
    INCREASING("increasing"),
    STABLE_OR_DECREASING("stable/decreasing");

    public static final int WINDOW = 7;

    private final String label;

    TrendLabel(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /**
     * With fewer than 14 values the prior window is taken to equal the recent one,
     * which yields {@link #STABLE_OR_DECREASING}.
     */
    public static TrendLabel of(double[] series) {
        if (series.length == 0) return STABLE_OR_DECREASING;
        int n = series.length;
        double recent = mean(series, Math.max(0, n - WINDOW), n);
        double prior = n >= 2 * WINDOW ? mean(series, n - 2 * WINDOW, n - WINDOW) : recent;
        return recent > prior ? INCREASING : STABLE_OR_DECREASING;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }

    @Override
    public String toString() {
        return label;
    }
}
