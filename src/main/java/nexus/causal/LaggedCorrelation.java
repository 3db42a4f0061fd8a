package nexus.causal;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.Arrays;

/** Pearson correlation between target(t) and cause(t - lag) over the overlapping range. */
public final class LaggedCorrelation {

    private static final int MIN_PAIRS = 3;

    private LaggedCorrelation() {
    }

    /**
     * Pairs with an unset value on either side are ignored. Too few pairs or a constant side
     * gives 0 rather than an undefined coefficient.
     */
    public static double at(double[] target, double[] cause, int lag) {
        if (lag < 0) throw new IllegalArgumentException("lag must be >= 0, got " + lag);
        int n = Math.min(target.length, cause.length);
        double[] x = new double[Math.max(0, n - lag)];
        double[] y = new double[x.length];
        int pairs = 0;
        for (int t = lag; t < n; t++) {
            double a = target[t];
            double b = cause[t - lag];
            if (Double.isNaN(a) || Double.isNaN(b)) continue;
            x[pairs] = a;
            y[pairs] = b;
            pairs++;
        }
        if (pairs < MIN_PAIRS) return 0;
        double r = new PearsonsCorrelation().correlation(Arrays.copyOf(x, pairs), Arrays.copyOf(y, pairs));
        return Double.isNaN(r) ? 0 : r;
    }

    /** Correlations for lags 1..maxLag; element i holds lag i + 1. */
    public static double[] profile(double[] target, double[] cause, int maxLag) {
        double[] out = new double[maxLag];
        for (int lag = 1; lag <= maxLag; lag++) out[lag - 1] = at(target, cause, lag);
        return out;
    }
}
