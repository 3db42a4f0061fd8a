package nexus.ml;

import org.apache.commons.math3.linear.*;

/**
 * Linear regression with a Gaussian prior on the slopes (ridge), returning a predictive
 * standard deviation with every point estimate.
 * <p>
 * Model: y = β₀ + β₁x₁ + ... + βₙxₙ + ε, ε ~ N(0, σ²)
 * <p>
 * Posterior mean (normal equation with penalty): β = (X'X + λD)⁻¹X'y, where D is the identity
 * with a zero for the intercept so the intercept is not shrunk.
 * Predictive variance for a new row x̃ = (1, x): σ²(1 + x̃'(X'X + λD)⁻¹x̃).
 * σ² is the mean squared residual, never below {@code noiseFloor}.
 */
public class BayesianLinearRegression {

    private final double[] coefficients;  // β₀, β₁, ..., βₙ
    private final RealMatrix precisionInverse; // (X'X + λD)⁻¹
    private final double noiseVariance;
    private final double rSquared;
    private final int n;
    private final int p;

    /**
     * @param X          design matrix (rows = observations, columns = features; no intercept column)
     * @param y          response vector
     * @param ridge      prior precision λ on the slopes, >= 0
     * @param noiseFloor lower bound for σ², > 0
     * @throws ModelFitException if the penalized system is singular
     */
    public BayesianLinearRegression(double[][] X, double[] y, double ridge, double noiseFloor) {
        if (X == null || y == null || X.length != y.length || X.length == 0) {
            throw new IllegalArgumentException("X and y must be non-null, same length, and non-empty");
        }
        if (ridge < 0) throw new IllegalArgumentException("ridge must be >= 0");
        if (!(noiseFloor > 0)) throw new IllegalArgumentException("noiseFloor must be > 0");
        n = X.length;
        int features = X[0].length;
        p = features + 1; // +1 for intercept

        double[][] design = new double[n][p];
        for (int i = 0; i < n; i++) {
            if (X[i].length != features) throw new IllegalArgumentException("ragged design matrix at row " + i);
            design[i][0] = 1.0;
            for (int j = 0; j < features; j++) {
                design[i][j + 1] = X[i][j];
            }
        }

        RealMatrix Xm = MatrixUtils.createRealMatrix(design);
        RealVector yv = MatrixUtils.createRealVector(y);

        RealMatrix Xt = Xm.transpose();
        RealMatrix A = Xt.multiply(Xm);
        for (int j = 1; j < p; j++) {
            A.addToEntry(j, j, ridge);
        }
        DecompositionSolver solver = new LUDecomposition(A).getSolver();
        if (!solver.isNonSingular()) {
            throw new ModelFitException("X'X + λI is singular; increase the ridge penalty or remove constant features");
        }
        RealVector beta = solver.solve(Xt.operate(yv));
        coefficients = beta.toArray();
        precisionInverse = solver.getInverse();
        for (double c : coefficients) {
            if (!Double.isFinite(c)) throw new ModelFitException("regression produced a non-finite coefficient");
        }

        double meanY = 0;
        for (double v : y) meanY += v;
        meanY /= n;
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < n; i++) {
            double fitted = predictMean(X[i]);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
            ssRes += (y[i] - fitted) * (y[i] - fitted);
        }
        rSquared = (ssTot > 0) ? 1.0 - (ssRes / ssTot) : 0;
        noiseVariance = Math.max(ssRes / n, noiseFloor);
    }

    public double getIntercept() {
        return coefficients[0];
    }

    /** Coefficient for feature i (0-based). */
    public double getCoefficient(int i) {
        return coefficients[i + 1];
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getRSquared() { return rSquared; }
    public double getNoiseVariance() { return noiseVariance; }
    public int getFeatureCount() { return p - 1; }

    public double predictMean(double[] x) {
        double y = coefficients[0];
        for (int i = 0; i < x.length; i++) {
            y += coefficients[i + 1] * x[i];
        }
        return y;
    }

    public Prediction predict(double[] x) {
        if (x.length != p - 1) {
            throw new IllegalArgumentException("expected " + (p - 1) + " features, got " + x.length);
        }
        double[] augmented = new double[p];
        augmented[0] = 1.0;
        System.arraycopy(x, 0, augmented, 1, x.length);
        RealVector xv = MatrixUtils.createRealVector(augmented);
        double leverage = xv.dotProduct(precisionInverse.operate(xv));
        double variance = noiseVariance * (1.0 + Math.max(0, leverage));
        return new Prediction(predictMean(x), Math.sqrt(variance));
    }

    public Prediction[] predict(double[][] X) {
        Prediction[] out = new Prediction[X.length];
        for (int i = 0; i < X.length; i++) {
            out[i] = predict(X[i]);
        }
        return out;
    }
}
