package nexus.burden;

import org.junit.jupiter.api.Test;

import static nexus.support.Fixtures.constant;
import static nexus.support.Fixtures.series;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TrendLabelTest {

    @Test
    void risingRecentWeekIsIncreasing() {
        assertEquals(TrendLabel.INCREASING, TrendLabel.of(series(21, i -> i)));
    }

    @Test
    void equalWeeksAreNotIncreasing() {
        assertEquals(TrendLabel.STABLE_OR_DECREASING, TrendLabel.of(constant(14, 4)));
        assertEquals(TrendLabel.STABLE_OR_DECREASING, TrendLabel.of(series(14, i -> 14 - i)));
    }

    @Test
    void shortSeriesIsStable() {
        assertEquals(TrendLabel.STABLE_OR_DECREASING, TrendLabel.of(series(13, i -> i * i)));
        assertEquals(TrendLabel.STABLE_OR_DECREASING, TrendLabel.of(new double[0]));
        assertEquals("stable/decreasing", TrendLabel.STABLE_OR_DECREASING.toString());
    }
}
