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
import java.util.List;
import java.util.Map;

/**
 * Reads the optional economic indicators table, annual ({@code year}) or dated ({@code date}),
 * and keeps only the latest row. Any failure degrades to {@link MacroContext#ZERO}.
 */
public final class EconomicIndicatorsReader {

    private static final Logger log = LoggerFactory.getLogger(EconomicIndicatorsReader.class);

    private EconomicIndicatorsReader() {
    }

    /** First existing path wins; none existing yields {@link MacroContext#ZERO}. */
    public static MacroContext read(List<Path> candidates) {
        for (Path path : candidates) {
            if (Files.isRegularFile(path)) {
                try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                    MacroContext context = read(reader);
                    log.info("Loaded economic indicators from {}", path);
                    return context;
                } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
                    log.warn("Could not read economic indicators from {}: {}", path, e.getMessage());
                }
            }
        }
        log.warn("No economic indicators available; macro context defaults to zero growth and inflation");
        return MacroContext.ZERO;
    }

    public static MacroContext read(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();
        try (CSVParser parser = format.parse(reader)) {
            Map<String, Integer> header = TableSchema.ECONOMIC.canonicalHeaderIndex(parser.getHeaderNames());
            Integer yearIndex = header.get(Columns.YEAR);
            Integer dateIndex = header.get(Columns.DATE);

            CSVRecord latest = null;
            double latestKey = Double.NEGATIVE_INFINITY;
            for (CSVRecord record : parser) {
                double key;
                if (yearIndex != null) {
                    key = CsvTableReader.parseNumber(value(record, yearIndex));
                } else if (dateIndex != null) {
                    LocalDate date = CsvTableReader.parseDate(value(record, dateIndex));
                    key = date == null ? Double.NaN : date.toEpochDay();
                } else {
                    key = record.getRecordNumber();
                }
                if (!Double.isNaN(key) && key >= latestKey) {
                    latest = record;
                    latestKey = key;
                }
            }
            if (latest == null) {
                return MacroContext.ZERO;
            }
            return new MacroContext(
                orZero(latest, header.get(Columns.GDP_GROWTH_RATE)),
                orZero(latest, header.get(Columns.INFLATION_RATE)));
        }
    }

    private static double orZero(CSVRecord record, Integer index) {
        if (index == null) return 0;
        double v = CsvTableReader.parseNumber(value(record, index));
        return Double.isNaN(v) ? 0 : v;
    }

    private static String value(CSVRecord record, int index) {
        return record.isSet(index) ? record.get(index) : null;
    }
}
