package nexus.pipeline;

import nexus.data.CsvTableReader;
import nexus.data.EconomicIndicatorsReader;
import nexus.data.MacroContext;
import nexus.data.SourceTables;
import nexus.data.TableSchema;

import java.nio.file.Path;
import java.util.List;

/** Locates the input CSVs named by the config. */
public final class SourceLoader {

    private SourceLoader() {
    }

    /** @throws nexus.data.MissingSourceException if any mandatory table is absent or unreadable */
    public static SourceTables load(AnalysisConfig config) {
        Path dir = config.processedPath();
        return SourceTables.builder()
            .put(TableSchema.DISEASE, CsvTableReader.read(dir.resolve(config.getDiseaseFile()), TableSchema.DISEASE))
            .put(TableSchema.WEATHER, CsvTableReader.read(dir.resolve(config.getWeatherFile()), TableSchema.WEATHER))
            .put(TableSchema.POPULATION, CsvTableReader.read(dir.resolve(config.getPopulationFile()), TableSchema.POPULATION))
            .put(TableSchema.NIGHTLIGHT, CsvTableReader.read(dir.resolve(config.getNightlightFile()), TableSchema.NIGHTLIGHT))
            .build();
    }

    /** Processed directory first, then raw/economic. Never fails. */
    public static MacroContext loadMacroContext(AnalysisConfig config) {
        return EconomicIndicatorsReader.read(List.of(
            config.processedPath().resolve(config.getEconomicFile()),
            config.rawPath().resolve("economic").resolve(config.getEconomicFile())));
    }
}
