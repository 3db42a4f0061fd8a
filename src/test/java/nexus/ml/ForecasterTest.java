package nexus.ml;

import nexus.data.Columns;
import nexus.data.DailyTable;
import nexus.data.Unifier;
import nexus.features.FeatureEngineer;
import nexus.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static nexus.support.Fixtures.constant;
import static nexus.support.Fixtures.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForecasterTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private static final FeatureEngineer ENGINEER = new FeatureEngineer(List.of(7, 14),
        List.of(Columns.TARGET, Columns.TEMPERATURE, Columns.HUMIDITY));

    private static final List<String> FEATURES = List.of(
        Columns.DAY_OF_YEAR,
        Columns.IS_MONSOON,
        Columns.rollingMean(Columns.TEMPERATURE, 14),
        Columns.rollingMean(Columns.HUMIDITY, 14),
        Columns.rollingMean(Columns.TARGET, 7));

    private static DailyTable engineered(double[] cases) {
        DailyTable unified = new Unifier().unify(Fixtures.sources(START, cases, constant(cases.length, 100_000)), null);
        return ENGINEER.engineer(unified);
    }

    private static Forecaster.Builder forecaster() {
        return Forecaster.builder(ENGINEER).features(FEATURES).target(Columns.TARGET);
    }

    @Test
    void risingSeriesPeaksOnTheLastForecastDay() {
        DailyTable data = engineered(series(60, t -> 100 + 5 * t));

        ForecastOutcome outcome = forecaster().build().forecast(data);

        assertEquals(ForecastOutcome.Status.COMPLETED, outcome.getStatus());
        List<ForecastPoint> points = outcome.getPoints();
        assertEquals(14, points.size());
        for (int i = 1; i < points.size(); i++) {
            assertTrue(points.get(i).getPoint() > points.get(i - 1).getPoint(), "day " + i);
        }
        assertEquals(395 + 5 * 14, points.get(13).getPoint(), 1.0);
    }

    @Test
    void heldOutActualsFallInsideTheInterval() {
        DailyTable data = engineered(series(60, t -> 100 + 5 * t));

        ValidationResult validation = forecaster().build().forecast(data).getValidation().orElseThrow();

        assertEquals(48, validation.getTrainingRows());
        assertEquals(12, validation.size());
        double[] actual = validation.getActual();
        double[] predicted = validation.getPredicted();
        double[] std = validation.getStd();
        for (int i = 0; i < actual.length; i++) {
            double lower = predicted[i] - ForecastPoint.Z_95 * std[i];
            double upper = predicted[i] + ForecastPoint.Z_95 * std[i];
            assertTrue(actual[i] >= lower && actual[i] <= upper, "row " + i);
        }
        assertTrue(validation.rSquared() > 0.99);
    }

    @Test
    void forecastStartsTheDayAfterHistoryAndKeepsBoundsOrdered() {
        DailyTable data = engineered(series(40, t -> 20 + 10 * Math.sin(t / 5.0)));

        List<ForecastPoint> points = forecaster().horizon(10).build().forecast(data).getPoints();

        assertEquals(10, points.size());
        for (int i = 0; i < points.size(); i++) {
            ForecastPoint p = points.get(i);
            assertEquals(data.lastDate().plusDays(i + 1), p.getDate());
            assertTrue(p.getLower() >= 0);
            assertTrue(p.getLower() <= p.getPoint() && p.getPoint() <= p.getUpper());
        }
    }

    @Test
    void decliningSeriesIsClampedAtZero() {
        DailyTable data = engineered(series(60, t -> 300 - 5 * t));

        List<ForecastPoint> points = forecaster().build().forecast(data).getPoints();

        for (ForecastPoint p : points) {
            assertTrue(p.getPoint() >= 0 && p.getLower() >= 0 && p.getUpper() >= 0);
        }
        assertEquals(0, points.get(13).getPoint(), 0.0);
    }

    @Test
    void tooFewRowsIsReportedNotThrown() {
        DailyTable data = engineered(constant(8, 10));

        ForecastOutcome outcome = forecaster().build().forecast(data);

        assertEquals(ForecastOutcome.Status.INSUFFICIENT_DATA, outcome.getStatus());
        assertFalse(outcome.isAvailable());
        assertTrue(outcome.getPoints().isEmpty());
        assertTrue(outcome.getMessage().isPresent());
    }

    @Test
    void validationIsSkippedWhenTrainingSliceIsTooSmall() {
        DailyTable data = engineered(series(10, t -> 10 + t));

        ForecastOutcome outcome = forecaster().validationFraction(0.6).build().forecast(data);

        assertEquals(ForecastOutcome.Status.COMPLETED, outcome.getStatus());
        assertFalse(outcome.getValidation().isPresent());
        assertEquals(14, outcome.getPoints().size());
    }

    @Test
    void absentFeatureIsDroppedWithoutFailing() {
        DailyTable data = engineered(series(30, t -> 50 + t));

        ForecastOutcome outcome = forecaster()
            .features(List.of(Columns.DAY_OF_YEAR, "not_a_feature"))
            .build()
            .forecast(data);

        assertEquals(List.of(Columns.DAY_OF_YEAR), outcome.getFeatures());
        assertTrue(outcome.isAvailable());
    }
}
