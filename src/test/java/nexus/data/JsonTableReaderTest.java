package nexus.data;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonTableReaderTest {

    private static JsonArray rows(String json) {
        return JsonParser.parseString(json).getAsJsonArray();
    }

    @Test
    void readsNumbersAndNumericStrings() {
        DailyTable table = JsonTableReader.read(rows("""
                [{"date": "2024-05-02", "cases": "14"},
                 {"date": "2024-05-01", "dhaka_cases": 9, "cumulative_deaths": null}]
                """), TableSchema.DISEASE);

        assertEquals(2, table.size());
        assertEquals(9, table.value(Columns.CASE_COUNT, 0), 0.0);
        assertEquals(14, table.value(Columns.CASE_COUNT, 1), 0.0);
        assertTrue(Double.isNaN(table.value(Columns.CUMULATIVE_DEATHS, 0)));
    }

    @Test
    void rowWithoutDateIsSchemaViolation() {
        assertThrows(SchemaViolationException.class,
            () -> JsonTableReader.read(rows("[{\"temperature\": 20}]"), TableSchema.WEATHER));
    }

    @Test
    void emptyArrayGivesEmptyTable() {
        DailyTable table = JsonTableReader.read(new JsonArray(), TableSchema.NIGHTLIGHT);

        assertTrue(table.isEmpty());
    }

    @Test
    void macroContextFromLatestRow() {
        MacroContext macro = JsonTableReader.readMacroContext(rows("""
                [{"year": 2023, "gdp_growth": 6.0, "inflation": 9.0},
                 {"year": 2024, "gdp_growth": 5.1, "inflation": 9.5}]
                """));

        assertEquals(5.1, macro.getGdpGrowthRate(), 0.0);
        assertEquals(9.5, macro.getInflationRate(), 0.0);
        assertSame(MacroContext.ZERO, JsonTableReader.readMacroContext(new JsonArray()));
    }
}
