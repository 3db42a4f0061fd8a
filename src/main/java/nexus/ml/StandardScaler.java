package nexus.ml;

/**
 * Zero-mean, unit-variance scaling with statistics from the fitting data only.
 * Uses the population standard deviation; a constant column keeps a scale of 1.
 */
public final class StandardScaler {

    private final double[] means;
    private final double[] scales;

    private StandardScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static StandardScaler fit(double[][] X) {
        if (X.length == 0) throw new IllegalArgumentException("cannot fit a scaler on no rows");
        int k = X[0].length;
        double[] means = new double[k];
        double[] scales = new double[k];
        for (int j = 0; j < k; j++) {
            double sum = 0;
            for (double[] row : X) sum += row[j];
            double mean = sum / X.length;
            double ss = 0;
            for (double[] row : X) ss += (row[j] - mean) * (row[j] - mean);
            double std = Math.sqrt(ss / X.length);
            means[j] = mean;
            scales[j] = std > 1e-12 ? std : 1.0;
        }
        return new StandardScaler(means, scales);
    }

    public static StandardScaler fit(double[] y) {
        double[][] column = new double[y.length][1];
        for (int i = 0; i < y.length; i++) column[i][0] = y[i];
        return fit(column);
    }

    public double[] transform(double[] row) {
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) out[j] = (row[j] - means[j]) / scales[j];
        return out;
    }

    public double[][] transform(double[][] X) {
        double[][] out = new double[X.length][];
        for (int i = 0; i < X.length; i++) out[i] = transform(X[i]);
        return out;
    }

    /** Scales a single-column vector. */
    public double[] transformColumn(double[] y) {
        double[] out = new double[y.length];
        for (int i = 0; i < y.length; i++) out[i] = (y[i] - means[0]) / scales[0];
        return out;
    }

    /** Back to original units for column 0. */
    public double inverse(double scaled) {
        return scaled * scales[0] + means[0];
    }

    public double getMean(int column) { return means[column]; }
    public double getScale(int column) { return scales[column]; }
}
