package nexus.data;

import nexus.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

import static nexus.support.Fixtures.constant;
import static nexus.support.Fixtures.days;
import static nexus.support.Fixtures.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnifierTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Test
    void fillsEveryCalendarDayAndInterpolatesMonthlySources() {
        List<LocalDate> daily = days(START, 31);
        SourceTables sources = SourceTables.builder()
            .put(TableSchema.DISEASE, table(daily, Columns.CASE_COUNT, constant(31, 50)))
            .put(TableSchema.WEATHER, table(daily,
                Columns.TEMPERATURE, constant(31, 27),
                Columns.HUMIDITY, constant(31, 80),
                Columns.RAINFALL, constant(31, 1)))
            .put(TableSchema.POPULATION, table(List.of(START, START.plusDays(30)),
                Columns.POPULATION_ESTIMATE, new double[] {100_000, 130_000}))
            .put(TableSchema.NIGHTLIGHT, table(List.of(START.plusDays(15)), Columns.RADIANCE, new double[] {42}))
            .build();

        DailyTable unified = new Unifier().unify(sources, null);

        assertEquals(31, unified.size());
        for (int i = 1; i < unified.size(); i++) {
            assertEquals(unified.date(i - 1).plusDays(1), unified.date(i));
        }
        int jan11 = unified.indexOf(LocalDate.of(2024, 1, 11));
        assertEquals(110_000, unified.value(Columns.POPULATION_ESTIMATE, jan11), 1e-9);
        assertEquals(42, unified.value(Columns.RADIANCE, 0), 1e-9);
        assertEquals(42, unified.value(Columns.RADIANCE, 30), 1e-9);
        for (String column : unified.columnNames()) {
            for (double v : unified.column(column)) assertFalse(Double.isNaN(v), column);
        }
    }

    @Test
    void interpolationIsWeightedByElapsedDays() {
        NavigableMap<LocalDate, Double> known = new TreeMap<>();
        known.put(START, 10.0);
        known.put(START.plusDays(4), 30.0);
        known.put(START.plusDays(5), 0.0);

        assertEquals(15.0, Unifier.interpolate(known, START.plusDays(1)), 1e-12);
        assertEquals(25.0, Unifier.interpolate(known, START.plusDays(3)), 1e-12);
        assertEquals(10.0, Unifier.interpolate(known, START.minusDays(3)), 1e-12);
        assertEquals(0.0, Unifier.interpolate(known, START.plusDays(9)), 1e-12);
    }

    @Test
    void derivesIncidencePer100k() {
        SourceTables sources = Fixtures.sources(START, constant(10, 25), constant(10, 50_000));

        DailyTable unified = new Unifier().unify(sources, null);

        for (double v : unified.column(Columns.TARGET)) assertEquals(50.0, v, 1e-9);
    }

    @Test
    void zeroPopulationGivesZeroIncidenceWithoutFailing() {
        double[] population = constant(10, 100_000);
        population[4] = 0;
        SourceTables sources = Fixtures.sources(START, constant(10, 30), population);

        DailyTable unified = new Unifier().unify(sources, null);

        assertEquals(0.0, unified.value(Columns.TARGET, 4), 0.0);
        assertEquals(30.0, unified.value(Columns.TARGET, 3), 1e-9);
    }

    @Test
    void liveObservationSupersedesHistoricalWeather() {
        SourceTables sources = Fixtures.sources(START, constant(5, 10), constant(5, 100_000));
        LiveObservation live = new LiveObservation(START.plusDays(4), 31.5, 88, null);

        DailyTable unified = new Unifier().unify(sources, live);

        assertEquals(5, unified.size());
        assertEquals(31.5, unified.value(Columns.TEMPERATURE, 4), 0.0);
        assertEquals(88, unified.value(Columns.HUMIDITY, 4), 0.0);
        assertEquals(0.0, unified.value(Columns.RAINFALL, 4), 0.0);
        assertEquals(28, unified.value(Columns.TEMPERATURE, 3), 0.0);
    }

    @Test
    void liveObservationAfterHistoryExtendsTheSeries() {
        SourceTables sources = Fixtures.sources(START, constant(5, 10), constant(5, 100_000));
        LiveObservation live = new LiveObservation(START.plusDays(6), 30, 70, 3.0);

        DailyTable unified = new Unifier().unify(sources, live);

        assertEquals(7, unified.size());
        assertEquals(10, unified.value(Columns.CASE_COUNT, 6), 0.0);
        assertEquals(29, unified.value(Columns.TEMPERATURE, 5), 1e-9);
    }

    @Test
    void analysisWindowClipsAndExtends() {
        SourceTables sources = Fixtures.sources(START, Fixtures.series(10, i -> i), constant(10, 100_000));

        DailyTable unified = new Unifier(START.plusDays(2), START.plusDays(12)).unify(sources, null);

        assertEquals(11, unified.size());
        assertEquals(START.plusDays(2), unified.firstDate());
        assertEquals(2, unified.value(Columns.CASE_COUNT, 0), 0.0);
        assertEquals(9, unified.value(Columns.CASE_COUNT, 10), 0.0);
    }

    @Test
    void columnWithoutAnyValueDefaultsToZero() {
        List<LocalDate> dates = days(START, 4);
        SourceTables base = Fixtures.sources(START, constant(4, 5), constant(4, 100_000));
        SourceTables sources = SourceTables.builder()
            .put(TableSchema.DISEASE, table(dates,
                Columns.CASE_COUNT, constant(4, 5),
                Columns.CUMULATIVE_DEATHS, constant(4, Double.NaN)))
            .put(TableSchema.WEATHER, base.require(TableSchema.WEATHER))
            .put(TableSchema.POPULATION, base.require(TableSchema.POPULATION))
            .put(TableSchema.NIGHTLIGHT, base.require(TableSchema.NIGHTLIGHT))
            .build();

        DailyTable unified = new Unifier().unify(sources, null);

        for (double v : unified.column(Columns.CUMULATIVE_DEATHS)) assertEquals(0.0, v, 0.0);
    }

    @Test
    void mergesOnlyMandatoryTables() {
        assertEquals(List.of(TableSchema.DISEASE, TableSchema.WEATHER, TableSchema.POPULATION, TableSchema.NIGHTLIGHT),
            TableSchema.unified());
        assertFalse(TableSchema.ECONOMIC.isMandatory());
    }

    @Test
    void missingMandatoryTableIsFatal() {
        SourceTables full = Fixtures.sources(START, constant(5, 1), constant(5, 1000));
        SourceTables sources = SourceTables.builder()
            .put(TableSchema.DISEASE, full.require(TableSchema.DISEASE))
            .put(TableSchema.WEATHER, full.require(TableSchema.WEATHER))
            .put(TableSchema.POPULATION, full.require(TableSchema.POPULATION))
            .build();

        MissingSourceException e = assertThrows(MissingSourceException.class, () -> new Unifier().unify(sources, null));
        assertEquals(TableSchema.NIGHTLIGHT, e.getSchema());
    }

    @Test
    void missingRequiredColumnNamesTableAndColumn() {
        List<LocalDate> dates = days(START, 3);
        SourceTables full = Fixtures.sources(START, constant(3, 1), constant(3, 1000));
        SourceTables sources = SourceTables.builder()
            .put(TableSchema.DISEASE, full.require(TableSchema.DISEASE))
            .put(TableSchema.WEATHER, table(dates,
                Columns.TEMPERATURE, constant(3, 27),
                Columns.RAINFALL, constant(3, 0)))
            .put(TableSchema.POPULATION, full.require(TableSchema.POPULATION))
            .put(TableSchema.NIGHTLIGHT, full.require(TableSchema.NIGHTLIGHT))
            .build();

        SchemaViolationException e =
            assertThrows(SchemaViolationException.class, () -> new Unifier().unify(sources, null));
        assertEquals("weather", e.getTable());
        assertTrue(e.getMissingColumns().contains(Columns.HUMIDITY));
    }
}
