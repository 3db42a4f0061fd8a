package nexus.ml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BayesianLinearRegressionTest {

    @Test
    void recoversExactLinearRelation() {
        double[][] X = new double[20][2];
        double[] y = new double[20];
        for (int i = 0; i < 20; i++) {
            X[i][0] = i;
            X[i][1] = (i * 7) % 5;
            y[i] = 3 + 2 * X[i][0] - 0.5 * X[i][1];
        }

        BayesianLinearRegression model = new BayesianLinearRegression(X, y, 0, 1e-5);

        assertEquals(3, model.getIntercept(), 1e-8);
        assertEquals(2, model.getCoefficient(0), 1e-8);
        assertEquals(-0.5, model.getCoefficient(1), 1e-8);
        assertEquals(1.0, model.getRSquared(), 1e-12);
        assertEquals(1e-5, model.getNoiseVariance(), 0.0);
        assertEquals(2, model.getFeatureCount());
    }

    @Test
    void predictiveSpreadGrowsAwayFromTheData() {
        double[][] X = new double[30][1];
        double[] y = new double[30];
        for (int i = 0; i < 30; i++) {
            X[i][0] = i / 10.0;
            y[i] = X[i][0] + ((i % 3) - 1) * 0.1;
        }
        BayesianLinearRegression model = new BayesianLinearRegression(X, y, 1e-6, 1e-5);

        Prediction inside = model.predict(new double[] {1.5});
        Prediction outside = model.predict(new double[] {20});

        assertTrue(outside.getStd() > inside.getStd());
        assertTrue(inside.getStd() >= Math.sqrt(model.getNoiseVariance()));
        assertEquals(model.predictMean(new double[] {20}), outside.getMean(), 0.0);
    }

    @Test
    void ridgeKeepsConstantFeatureSolvable() {
        double[][] X = {{1, 0}, {2, 0}, {3, 0}, {4, 0}};
        double[] y = {2, 4, 6, 8};

        BayesianLinearRegression model = new BayesianLinearRegression(X, y, 1e-6, 1e-5);

        assertEquals(0, model.getCoefficient(1), 1e-9);
        assertEquals(10, model.predictMean(new double[] {5, 0}), 1e-4);
    }

    @Test
    void singularSystemWithoutRidgeFails() {
        double[][] X = {{1, 2}, {2, 4}, {3, 6}};
        double[] y = {1, 2, 3};

        assertThrows(ModelFitException.class, () -> new BayesianLinearRegression(X, y, 0, 1e-5));
    }

    @Test
    void rejectsMismatchedInput() {
        assertThrows(IllegalArgumentException.class,
            () -> new BayesianLinearRegression(new double[][] {{1}}, new double[] {1, 2}, 0, 1e-5));
    }
}
