package nexus.support;

import nexus.data.Columns;
import nexus.data.DailyTable;
import nexus.data.SourceTables;
import nexus.data.TableSchema;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

/** Small builders for daily tables used across the test packages. */
public final class Fixtures {

    private Fixtures() {
    }

    public static List<LocalDate> days(LocalDate start, int n) {
        List<LocalDate> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(start.plusDays(i));
        return out;
    }

    public static double[] series(int n, IntToDoubleFunction f) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = f.applyAsDouble(i);
        return out;
    }

    public static double[] constant(int n, double value) {
        return series(n, i -> value);
    }

    public static DailyTable table(List<LocalDate> dates, Object... columnsAndValues) {
        Map<String, double[]> cols = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            cols.put((String) columnsAndValues[i], (double[]) columnsAndValues[i + 1]);
        }
        return new DailyTable(dates, cols);
    }

    /** All four mandatory tables over the same days; weather and radiance are constant. */
    public static SourceTables sources(LocalDate start, double[] cases, double[] population) {
        int n = cases.length;
        List<LocalDate> dates = days(start, n);
        return SourceTables.builder()
            .put(TableSchema.DISEASE, table(dates, Columns.CASE_COUNT, cases))
            .put(TableSchema.WEATHER, table(dates,
                Columns.TEMPERATURE, constant(n, 28),
                Columns.HUMIDITY, constant(n, 75),
                Columns.RAINFALL, constant(n, 2)))
            .put(TableSchema.POPULATION, table(dates, Columns.POPULATION_ESTIMATE, population))
            .put(TableSchema.NIGHTLIGHT, table(dates, Columns.RADIANCE, constant(n, 40)))
            .build();
    }
}
