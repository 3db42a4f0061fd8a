package nexus.data;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads header-first CSV files into {@link DailyTable}s.
 * <p>
 * The {@code date} column is parsed as ISO {@code yyyy-MM-dd}; anything after the first ten
 * characters (a time of day) is ignored. Blank or non-numeric cells become NaN. When a date
 * repeats, the later row wins.
 */
public final class CsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setTrim(true)
        .setIgnoreEmptyLines(true)
        .setAllowMissingColumnNames(true)
        .build();

    private CsvTableReader() {
    }

    /** @throws MissingSourceException if the file is absent or unreadable */
    public static DailyTable read(Path path, TableSchema schema) {
        if (!Files.isRegularFile(path)) {
            throw new MissingSourceException(schema, "Source file for '" + schema.getTableName() + "' not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            DailyTable table = read(reader, schema);
            log.info("Loaded {} table: {} records from {}", schema.getTableName(), table.size(), path);
            return table;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new MissingSourceException(schema, "Could not parse '" + schema.getTableName() + "' from " + path, e);
        }
    }

    public static DailyTable read(Reader reader, TableSchema schema) throws IOException {
        try (CSVParser parser = FORMAT.parse(reader)) {
            Map<String, Integer> header = schema.canonicalHeaderIndex(parser.getHeaderNames());
            Integer dateIndex = header.remove(Columns.DATE);
            if (dateIndex == null) {
                throw new SchemaViolationException(schema.getTableName(), List.of(Columns.DATE));
            }
            TreeMap<LocalDate, Map<String, Double>> rows = new TreeMap<>();
            int skipped = 0;
            for (CSVRecord record : parser) {
                LocalDate date = parseDate(cell(record, dateIndex));
                if (date == null) {
                    skipped++;
                    continue;
                }
                Map<String, Double> values = new LinkedHashMap<>();
                for (Map.Entry<String, Integer> column : header.entrySet()) {
                    values.put(column.getKey(), parseNumber(cell(record, column.getValue())));
                }
                rows.put(date, values);
            }
            if (skipped > 0) {
                log.warn("Skipped {} rows without a valid date in {} table", skipped, schema.getTableName());
            }
            List<Observation> observations = new ArrayList<>(rows.size());
            for (Map.Entry<LocalDate, Map<String, Double>> e : rows.entrySet()) {
                observations.add(new Observation(e.getKey(), e.getValue()));
            }
            DailyTable table = DailyTable.fromObservations(observations);
            if (table.isEmpty()) {
                // keep declared columns visible so schema validation reports on content, not shape
                Map<String, double[]> cols = new LinkedHashMap<>();
                for (String column : header.keySet()) cols.put(column, new double[0]);
                table = new DailyTable(List.of(), cols);
            }
            return table;
        }
    }

    static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.trim();
        if (s.length() > 10) s = s.substring(0, 10);
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static double parseNumber(String raw) {
        if (raw == null || raw.isBlank()) return Double.NaN;
        try {
            return Double.parseDouble(raw.trim().replace(",", ""));
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static String cell(CSVRecord record, int index) {
        return record.isSet(index) ? record.get(index) : null;
    }
}
