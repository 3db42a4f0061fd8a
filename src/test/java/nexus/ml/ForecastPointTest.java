package nexus.ml;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ForecastPointTest {

    private static final LocalDate DAY = LocalDate.of(2025, 8, 1);

    @Test
    void intervalIsSymmetricAtNinetyFivePercent() {
        ForecastPoint p = ForecastPoint.of(DAY, 50, 10);

        assertEquals(50, p.getPoint(), 0.0);
        assertEquals(50 - 19.6, p.getLower(), 1e-12);
        assertEquals(50 + 19.6, p.getUpper(), 1e-12);
    }

    @Test
    void negativeValuesAreClampedToZero() {
        ForecastPoint p = ForecastPoint.of(DAY, -3, 1);

        assertEquals(0, p.getPoint(), 0.0);
        assertEquals(0, p.getLower(), 0.0);
        assertEquals(0, p.getUpper(), 0.0);
        assertEquals(DAY, p.getDate());
    }

    @Test
    void validationMetrics() {
        ValidationResult v = new ValidationResult(java.util.List.of(DAY, DAY.plusDays(1)),
            new double[] {1, 3}, new double[] {2, 3}, new double[] {0.1, 0.1}, 8);

        assertEquals(0.5, v.meanAbsoluteError(), 1e-12);
        assertEquals(0.5, v.rSquared(), 1e-12);
        assertEquals(2, v.size());
    }
}
