package nexus.ml;

import nexus.data.DailyTable;
import nexus.data.Observation;
import nexus.features.FeatureEngineer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fits a {@link BayesianLinearRegression} on engineered features and projects the target forward.
 * <p>
 * A validation pass fits on the earliest rows and predicts the held-out recent slice; it is
 * reported but never reused. The final model is refitted on all rows. Each future day is built
 * from the previous record: calendar fields come from the new date, exogenous values are carried
 * forward unchanged, and rolling means are recomputed over history plus the days already
 * projected, whose targets are the earlier predictions.
 */
public class Forecaster {

    private static final Logger log = LoggerFactory.getLogger(Forecaster.class);

    private final FeatureEngineer featureEngineer;
    private final List<String> features;
    private final String target;
    private final int horizon;
    private final double validationFraction;
    private final int minRows;
    private final int minValidationTrainRows;
    private final double ridge;
    private final double noiseFloor;

    private Forecaster(Builder b) {
        if (b.horizon < 1) throw new IllegalArgumentException("horizon must be >= 1");
        if (b.validationFraction < 0 || b.validationFraction >= 1) {
            throw new IllegalArgumentException("validationFraction must be in [0, 1)");
        }
        this.featureEngineer = b.featureEngineer;
        this.features = List.copyOf(b.features);
        this.target = b.target;
        this.horizon = b.horizon;
        this.validationFraction = b.validationFraction;
        this.minRows = b.minRows;
        this.minValidationTrainRows = b.minValidationTrainRows;
        this.ridge = b.ridge;
        this.noiseFloor = b.noiseFloor;
    }

    public static Builder builder(FeatureEngineer featureEngineer) {
        return new Builder(featureEngineer);
    }

    /**
     * @throws ModelFitException on numerical failure; insufficient data is reported in the outcome
     */
    public ForecastOutcome forecast(DailyTable engineered) {
        List<String> usableFeatures = new ArrayList<>();
        for (String f : features) {
            if (engineered.hasColumn(f)) usableFeatures.add(f);
            else log.warn("Forecast feature '{}' not present; continuing without it", f);
        }
        if (usableFeatures.isEmpty() || !engineered.hasColumn(target)) {
            log.warn("No usable forecast features or target column; forecast omitted");
            return ForecastOutcome.insufficientData("no usable features or target column");
        }

        List<String> required = new ArrayList<>(usableFeatures);
        required.add(target);
        DailyTable rows = engineered.dropRowsMissing(required);
        if (rows.size() < minRows) {
            log.warn("Insufficient data for forecasting: {} rows, need {}", rows.size(), minRows);
            return ForecastOutcome.insufficientData(rows.size() + " usable rows, need at least " + minRows);
        }

        double[][] X = matrix(rows, usableFeatures);
        double[] y = rows.column(target);

        ValidationResult validation = validate(rows, X, y);

        log.info("Fitting final model on {} rows", X.length);
        StandardScaler scalerX = StandardScaler.fit(X);
        StandardScaler scalerY = StandardScaler.fit(y);
        BayesianLinearRegression model =
            new BayesianLinearRegression(scalerX.transform(X), scalerY.transformColumn(y), ridge, noiseFloor);

        List<ForecastPoint> points = project(rows, usableFeatures, model, scalerX, scalerY);
        log.info("Generated {}-day forecast from {} to {}", horizon,
            points.get(0).getDate(), points.get(points.size() - 1).getDate());
        return ForecastOutcome.completed(points, validation, usableFeatures);
    }

    private ValidationResult validate(DailyTable rows, double[][] X, double[] y) {
        int split = (int) Math.floor(X.length * (1.0 - validationFraction));
        if (split < minValidationTrainRows || split >= X.length) {
            log.warn("Insufficient data for validation ({} training rows); skipping validation", split);
            return null;
        }
        log.info("Validating on the latest {} of {} rows", X.length - split, X.length);
        double[][] trainX = slice(X, 0, split);
        double[] trainY = Arrays.copyOfRange(y, 0, split);
        StandardScaler scalerX = StandardScaler.fit(trainX);
        StandardScaler scalerY = StandardScaler.fit(trainY);
        BayesianLinearRegression model =
            new BayesianLinearRegression(scalerX.transform(trainX), scalerY.transformColumn(trainY), ridge, noiseFloor);

        int held = X.length - split;
        double[] actual = new double[held];
        double[] predicted = new double[held];
        double[] std = new double[held];
        List<LocalDate> dates = new ArrayList<>(held);
        for (int i = 0; i < held; i++) {
            Prediction p = model.predict(scalerX.transform(X[split + i]));
            actual[i] = y[split + i];
            predicted[i] = scalerY.inverse(p.getMean());
            std[i] = p.getStd() * scalerY.getScale(0);
            dates.add(rows.date(split + i));
        }
        ValidationResult result = new ValidationResult(dates, actual, predicted, std, split);
        log.info("Validation MAE={} R²={}", String.format("%.3f", result.meanAbsoluteError()),
            String.format("%.3f", result.rSquared()));
        return result;
    }

    private List<ForecastPoint> project(DailyTable rows, List<String> usableFeatures, BayesianLinearRegression model,
                                        StandardScaler scalerX, StandardScaler scalerY) {
        List<Observation> history = new ArrayList<>(rows.observations());
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            Observation last = history.get(history.size() - 1);
            Observation next = featureEngineer.engineerNext(history, last.withDate(last.getDate().plusDays(1)));

            double[] x = new double[usableFeatures.size()];
            for (int j = 0; j < x.length; j++) x[j] = next.get(usableFeatures.get(j));
            Prediction p = model.predict(scalerX.transform(x));
            ForecastPoint point = ForecastPoint.of(next.getDate(),
                scalerY.inverse(p.getMean()), p.getStd() * scalerY.getScale(0));
            points.add(point);

            // later windows see the prediction, not the carried-forward value
            history.add(featureEngineer.engineerNext(history, next.with(target, point.getPoint())));
        }
        return points;
    }

    private static double[][] matrix(DailyTable table, List<String> columns) {
        double[][] X = new double[table.size()][columns.size()];
        for (int j = 0; j < columns.size(); j++) {
            double[] col = table.column(columns.get(j));
            for (int i = 0; i < col.length; i++) X[i][j] = col[i];
        }
        return X;
    }

    private static double[][] slice(double[][] X, int from, int to) {
        double[][] out = new double[to - from][];
        for (int i = from; i < to; i++) out[i - from] = X[i];
        return out;
    }

    public static final class Builder {
        private final FeatureEngineer featureEngineer;
        private List<String> features = List.of();
        private String target;
        private int horizon = 14;
        private double validationFraction = 0.2;
        private int minRows = 10;
        private int minValidationTrainRows = 5;
        private double ridge = 1e-6;
        private double noiseFloor = 1e-5;

        private Builder(FeatureEngineer featureEngineer) {
            this.featureEngineer = featureEngineer;
        }

        public Builder features(List<String> features) { this.features = features; return this; }
        public Builder target(String target) { this.target = target; return this; }
        public Builder horizon(int horizon) { this.horizon = horizon; return this; }
        public Builder validationFraction(double fraction) { this.validationFraction = fraction; return this; }
        public Builder minRows(int minRows) { this.minRows = minRows; return this; }
        public Builder minValidationTrainRows(int rows) { this.minValidationTrainRows = rows; return this; }
        public Builder ridge(double ridge) { this.ridge = ridge; return this; }
        public Builder noiseFloor(double noiseFloor) { this.noiseFloor = noiseFloor; return this; }

        public Forecaster build() {
            if (target == null) throw new IllegalStateException("target is required");
            return new Forecaster(this);
        }
    }
}
