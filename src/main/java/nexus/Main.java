package nexus;

import nexus.data.MacroContext;
import nexus.data.PipelineException;
import nexus.data.SourceTables;
import nexus.pipeline.AnalysisConfig;
import nexus.pipeline.AnalysisPipeline;
import nexus.pipeline.AnalysisResult;
import nexus.pipeline.ConfigLoader;
import nexus.pipeline.ReportWriter;
import nexus.pipeline.SourceLoader;
import nexus.weather.LiveWeather;
import nexus.weather.LiveWeatherProvider;
import nexus.weather.OpenWeatherClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Batch run: load the four source tables and the economic indicators, fetch live weather when
 * enabled, run the pipeline and write the reports.
 * <p>
 * Usage: {@code Main [config.json]}. Without an argument the built-in defaults are used.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            run(args.length > 0 && !args[0].isBlank() ? Path.of(args[0].trim()) : null);
        } catch (PipelineException e) {
            log.error("Analysis failed: {}", e.getMessage(), e);
            System.exit(1);
        } catch (IOException e) {
            log.error("Could not write reports: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static void run(Path configPath) throws IOException {
        AnalysisConfig config = configPath == null ? AnalysisConfig.defaults() : ConfigLoader.load(configPath);
        log.info("Dengue nexus analysis starting");

        SourceTables sources = SourceLoader.load(config);
        MacroContext macro = SourceLoader.loadMacroContext(config);
        LiveWeather live = fetchLiveWeather(config);

        AnalysisResult result = new AnalysisPipeline(config).run(sources, macro, live);
        new ReportWriter(config.outputPath()).writeAll(result, config, LocalDateTime.now());
        log.info("Analysis complete");
    }

    private static LiveWeather fetchLiveWeather(AnalysisConfig config) {
        LiveWeatherProvider provider = config.isLiveWeatherEnabled()
            ? OpenWeatherClient.create(config.getLiveWeatherUrl(), System.getenv(config.getApiKeyEnv()),
                config.getLatitude(), config.getLongitude(), config.getLiveWeatherTimeout())
            : LiveWeatherProvider.unavailable();
        return provider.current().orElse(null);
    }
}
