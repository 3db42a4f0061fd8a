package nexus.pipeline;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import nexus.causal.CausalLink;
import nexus.ml.ForecastPoint;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

/** Writes the forecast and causal-link tables, the briefing and the JSON report to one directory. */
public final class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public static final String FORECAST_FILE = "forecast_table.csv";
    public static final String CAUSAL_LINKS_FILE = "causal_links.csv";
    public static final String BRIEFING_FILE = "executive_briefing.txt";
    public static final String REPORT_FILE = "analysis_report.json";

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .serializeSpecialFloatingPointValues()
        .create();

    private final Path outputDir;

    public ReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public void writeAll(AnalysisResult result, AnalysisConfig config, LocalDateTime generatedAt) throws IOException {
        Files.createDirectories(outputDir);
        writeForecast(result);
        writeCausalLinks(result);
        Files.writeString(outputDir.resolve(BRIEFING_FILE),
            ExecutiveBriefing.render(result, config, generatedAt), StandardCharsets.UTF_8);
        try (Writer w = Files.newBufferedWriter(outputDir.resolve(REPORT_FILE), StandardCharsets.UTF_8)) {
            GSON.toJson(ReportAssembler.toReport(result, generatedAt), w);
        }
        log.info("Outputs written to {}", outputDir.toAbsolutePath());
    }

    void writeForecast(AnalysisResult result) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader("date", "forecast", "lower_ci", "upper_ci").build();
        try (Writer w = Files.newBufferedWriter(outputDir.resolve(FORECAST_FILE), StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, format)) {
            for (ForecastPoint p : result.getForecast().getPoints()) {
                printer.printRecord(p.getDate(), p.getPoint(), p.getLower(), p.getUpper());
            }
        }
    }

    void writeCausalLinks(AnalysisResult result) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader("cause", "effect", "lag_days", "correlation").build();
        try (Writer w = Files.newBufferedWriter(outputDir.resolve(CAUSAL_LINKS_FILE), StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, format)) {
            for (CausalLink link : result.getCausal().getLinks()) {
                printer.printRecord(link.getCause(), link.getEffect(), link.getLagDays(), link.getCorrelation());
            }
        }
    }
}
