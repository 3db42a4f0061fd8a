package nexus.pipeline;

import com.google.gson.Gson;
import nexus.data.Columns;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Every tunable constant of a run. Field initializers are the defaults; a JSON config file only
 * needs the keys it overrides. API keys are never stored here, only the name of the environment
 * variable holding one.
 */
public final class AnalysisConfig {

    private static final Gson GSON = new Gson();

    // --- Files ---
    private String dataDir = "./data";
    private String processedDir = "processed";
    private String rawDir = "raw";
    private String outputDir = "./reports";
    private String diseaseFile = "bangladesh_dengue_cases_2022_2025.csv";
    private String weatherFile = "dhaka_weather_2022_2025.csv";
    private String populationFile = "bangladesh_population_monthly_2022_2025.csv";
    private String nightlightFile = "dhaka_nightlights_2022_2025.csv";
    private String economicFile = "bangladesh_economic_indicators_2022_2025.csv";

    /** ISO dates; null means the extent of the data. */
    private String analysisStart;
    private String analysisEnd;

    // --- Live weather ---
    private boolean liveWeatherEnabled = true;
    private String liveWeatherUrl = "https://api.openweathermap.org/data/2.5/weather";
    private String apiKeyEnv = "OPENWEATHER_API_KEY";
    private int liveWeatherTimeoutSeconds = 10;
    private double latitude = 23.8103;
    private double longitude = 90.4125;

    // --- Model ---
    private int forecastHorizon = 14;
    private int causalMaxLag = 7;
    private double correlationThreshold = 0.25;
    private double validationFraction = 0.2;
    private int minForecastRows = 10;
    private int minValidationTrainRows = 5;
    private double ridgePenalty = 1e-6;
    private double noiseFloor = 1e-5;
    private List<Integer> rollingWindows = List.of(7, 14);
    private List<String> rolledColumns = List.of(Columns.TARGET, Columns.TEMPERATURE, Columns.HUMIDITY);
    private List<String> causalCandidates = List.of(Columns.TEMPERATURE, Columns.HUMIDITY, Columns.RAINFALL, Columns.RADIANCE);
    private List<String> forecastFeatures = List.of(
        Columns.DAY_OF_YEAR,
        Columns.IS_MONSOON,
        Columns.rollingMean(Columns.TEMPERATURE, 14),
        Columns.rollingMean(Columns.HUMIDITY, 14),
        Columns.rollingMean(Columns.TARGET, 7));

    // --- Economics (USD) ---
    private double costPerCase = 150;
    private double productivityLossPerCase = 500;
    private double preventionCostPerPerson = 5;
    private double preventionEffectiveness = 0.5;

    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    public static Builder builder() {
        return new Builder(new AnalysisConfig());
    }

    public Builder toBuilder() {
        return new Builder(GSON.fromJson(GSON.toJson(this), AnalysisConfig.class));
    }

    /** @throws IllegalArgumentException naming the first invalid setting */
    public AnalysisConfig validate() {
        require(forecastHorizon >= 1, "forecastHorizon must be >= 1");
        require(causalMaxLag >= 1, "causalMaxLag must be >= 1");
        require(correlationThreshold >= 0 && correlationThreshold < 1, "correlationThreshold must be in [0, 1)");
        require(validationFraction >= 0 && validationFraction < 1, "validationFraction must be in [0, 1)");
        require(minForecastRows >= 2, "minForecastRows must be >= 2");
        require(ridgePenalty >= 0, "ridgePenalty must be >= 0");
        require(noiseFloor > 0, "noiseFloor must be > 0");
        require(rollingWindows != null && !rollingWindows.isEmpty(), "rollingWindows must not be empty");
        for (int w : rollingWindows) require(w >= 1, "rolling windows must be >= 1");
        require(costPerCase >= 0 && productivityLossPerCase >= 0, "per-case costs must be >= 0");
        require(liveWeatherTimeoutSeconds >= 1, "liveWeatherTimeoutSeconds must be >= 1");
        LocalDate start = getAnalysisStart();
        LocalDate end = getAnalysisEnd();
        require(start == null || end == null || !end.isBefore(start), "analysisEnd is before analysisStart");
        return this;
    }

    private static void require(boolean ok, String message) {
        if (!ok) throw new IllegalArgumentException(message);
    }

    public Path processedPath() { return Path.of(dataDir, processedDir); }
    public Path rawPath() { return Path.of(dataDir, rawDir); }
    public Path outputPath() { return Path.of(outputDir); }

    public String getDiseaseFile() { return diseaseFile; }
    public String getWeatherFile() { return weatherFile; }
    public String getPopulationFile() { return populationFile; }
    public String getNightlightFile() { return nightlightFile; }
    public String getEconomicFile() { return economicFile; }

    public LocalDate getAnalysisStart() { return analysisStart == null ? null : LocalDate.parse(analysisStart); }
    public LocalDate getAnalysisEnd() { return analysisEnd == null ? null : LocalDate.parse(analysisEnd); }

    public boolean isLiveWeatherEnabled() { return liveWeatherEnabled; }
    public String getLiveWeatherUrl() { return liveWeatherUrl; }
    public String getApiKeyEnv() { return apiKeyEnv; }
    public Duration getLiveWeatherTimeout() { return Duration.ofSeconds(liveWeatherTimeoutSeconds); }
    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }

    public int getForecastHorizon() { return forecastHorizon; }
    public int getCausalMaxLag() { return causalMaxLag; }
    public double getCorrelationThreshold() { return correlationThreshold; }
    public double getValidationFraction() { return validationFraction; }
    public int getMinForecastRows() { return minForecastRows; }
    public int getMinValidationTrainRows() { return minValidationTrainRows; }
    public double getRidgePenalty() { return ridgePenalty; }
    public double getNoiseFloor() { return noiseFloor; }
    public List<Integer> getRollingWindows() { return rollingWindows; }
    public List<String> getRolledColumns() { return rolledColumns; }
    public List<String> getCausalCandidates() { return causalCandidates; }
    public List<String> getForecastFeatures() { return forecastFeatures; }

    public double getCostPerCase() { return costPerCase; }
    public double getProductivityLossPerCase() { return productivityLossPerCase; }
    public double getPreventionCostPerPerson() { return preventionCostPerPerson; }
    public double getPreventionEffectiveness() { return preventionEffectiveness; }

    /** Sets fields on a private copy; {@link #build()} validates it. */
    public static final class Builder {
        private final AnalysisConfig c;

        private Builder(AnalysisConfig c) {
            this.c = c;
        }

        public Builder dataDir(String v) { c.dataDir = v; return this; }
        public Builder outputDir(String v) { c.outputDir = v; return this; }
        public Builder analysisWindow(LocalDate start, LocalDate end) {
            c.analysisStart = start == null ? null : start.toString();
            c.analysisEnd = end == null ? null : end.toString();
            return this;
        }
        public Builder liveWeatherEnabled(boolean v) { c.liveWeatherEnabled = v; return this; }
        public Builder forecastHorizon(int v) { c.forecastHorizon = v; return this; }
        public Builder causalMaxLag(int v) { c.causalMaxLag = v; return this; }
        public Builder correlationThreshold(double v) { c.correlationThreshold = v; return this; }
        public Builder validationFraction(double v) { c.validationFraction = v; return this; }
        public Builder minForecastRows(int v) { c.minForecastRows = v; return this; }
        public Builder minValidationTrainRows(int v) { c.minValidationTrainRows = v; return this; }
        public Builder ridgePenalty(double v) { c.ridgePenalty = v; return this; }
        public Builder noiseFloor(double v) { c.noiseFloor = v; return this; }
        public Builder rollingWindows(List<Integer> v) { c.rollingWindows = List.copyOf(v); return this; }
        public Builder rolledColumns(List<String> v) { c.rolledColumns = List.copyOf(v); return this; }
        public Builder causalCandidates(List<String> v) { c.causalCandidates = List.copyOf(v); return this; }
        public Builder forecastFeatures(List<String> v) { c.forecastFeatures = List.copyOf(v); return this; }
        public Builder costPerCase(double v) { c.costPerCase = v; return this; }
        public Builder productivityLossPerCase(double v) { c.productivityLossPerCase = v; return this; }
        public Builder preventionCostPerPerson(double v) { c.preventionCostPerPerson = v; return this; }
        public Builder preventionEffectiveness(double v) { c.preventionEffectiveness = v; return this; }

        public AnalysisConfig build() {
            return c.validate();
        }
    }
}
