package nexus;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import nexus.data.JsonTableReader;
import nexus.data.MacroContext;
import nexus.data.PipelineException;
import nexus.data.SourceTables;
import nexus.data.TableSchema;
import nexus.pipeline.AnalysisConfig;
import nexus.pipeline.AnalysisPipeline;
import nexus.pipeline.AnalysisResult;
import nexus.pipeline.ReportAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code POST /api/analyze}: one JSON array of rows per table plus optional
 * {@code config} overrides ({@code forecastHorizon}, {@code causalMaxLag},
 * {@code correlationThreshold}). Errors come back as an {@code error} field.
 */
public class AnalyzeHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeHandler.class);

    static final int MAX_HORIZON = 60;

    private final AnalysisConfig baseConfig;

    public AnalyzeHandler(AnalysisConfig baseConfig) {
        this.baseConfig = baseConfig;
    }

    public Map<String, Object> handle(String body, LocalDateTime now) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (body == null || body.isBlank()) {
            out.put("error", "Missing request body");
            return out;
        }
        JsonObject req;
        try {
            JsonElement parsed = JsonParser.parseString(body);
            if (!parsed.isJsonObject()) {
                out.put("error", "Request body must be a JSON object");
                return out;
            }
            req = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            out.put("error", "Invalid JSON");
            return out;
        }

        try {
            AnalysisConfig config = applyOverrides(req.get("config"));
            SourceTables.Builder sources = SourceTables.builder();
            for (TableSchema schema : TableSchema.unified()) {
                JsonElement rows = req.get(schema.getTableName());
                if (rows != null && rows.isJsonArray()) {
                    sources.put(schema, JsonTableReader.read(rows.getAsJsonArray(), schema));
                }
            }
            JsonElement economic = req.get(TableSchema.ECONOMIC.getTableName());
            MacroContext macro = economic != null && economic.isJsonArray()
                ? JsonTableReader.readMacroContext(economic.getAsJsonArray())
                : MacroContext.ZERO;

            AnalysisResult result = new AnalysisPipeline(config).run(sources.build(), macro, null);
            return ReportAssembler.toReport(result, now);
        } catch (PipelineException | IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
            log.warn("Analysis request rejected: {}", e.getMessage());
            out.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return out;
        }
    }

    AnalysisConfig applyOverrides(JsonElement overrides) {
        AnalysisConfig.Builder builder = baseConfig.toBuilder().liveWeatherEnabled(false);
        if (overrides == null || !overrides.isJsonObject()) {
            return builder.build();
        }
        JsonObject o = overrides.getAsJsonObject();
        if (o.has("forecastHorizon")) {
            int horizon = o.get("forecastHorizon").getAsInt();
            builder.forecastHorizon(Math.max(1, Math.min(horizon, MAX_HORIZON)));
        }
        if (o.has("causalMaxLag")) {
            builder.causalMaxLag(o.get("causalMaxLag").getAsInt());
        }
        if (o.has("correlationThreshold")) {
            builder.correlationThreshold(o.get("correlationThreshold").getAsDouble());
        }
        return builder.build();
    }
}
