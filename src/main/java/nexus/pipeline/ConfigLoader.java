package nexus.pipeline;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import nexus.data.PipelineException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {

    private static final Gson GSON = new Gson();

    private ConfigLoader() {
    }

    /** @throws PipelineException if the file is missing, malformed or holds invalid settings */
    public static AnalysisConfig load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new PipelineException("Failed loading config from " + path, e);
        }
    }

    public static AnalysisConfig parse(Reader reader) {
        try {
            AnalysisConfig config = GSON.fromJson(reader, AnalysisConfig.class);
            if (config == null) config = AnalysisConfig.defaults();
            return config.validate();
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new PipelineException("Invalid configuration: " + e.getMessage(), e);
        }
    }
}
