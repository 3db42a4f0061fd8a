package nexus.ml;

/** Point estimate with its predictive standard deviation. */
public final class Prediction {

    private final double mean;
    private final double std;

    public Prediction(double mean, double std) {
        this.mean = mean;
        this.std = std;
    }

    public double getMean() { return mean; }
    public double getStd() { return std; }
}
