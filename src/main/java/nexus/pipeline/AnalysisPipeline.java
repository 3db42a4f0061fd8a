package nexus.pipeline;

import nexus.burden.BurdenEstimator;
import nexus.burden.BurdenReport;
import nexus.causal.ConsensusCausalDiscoverer;
import nexus.data.Columns;
import nexus.data.DailyTable;
import nexus.data.MacroContext;
import nexus.data.SourceTables;
import nexus.data.Unifier;
import nexus.features.FeatureEngineer;
import nexus.ml.ForecastOutcome;
import nexus.ml.Forecaster;
import nexus.ml.ModelFitException;
import nexus.weather.LiveWeather;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential batch run: Unifier, Feature Engineer, then Causal Discoverer and Forecaster on the
 * same engineered table, then the Burden Estimator. Each stage returns a new table or result and
 * leaves its input untouched.
 */
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final AnalysisConfig config;
    private final Unifier unifier;
    private final FeatureEngineer featureEngineer;
    private final ConsensusCausalDiscoverer discoverer;
    private final Forecaster forecaster;
    private final BurdenEstimator burdenEstimator;

    public AnalysisPipeline(AnalysisConfig config) {
        this.config = config.validate();
        this.unifier = new Unifier(config.getAnalysisStart(), config.getAnalysisEnd());
        this.featureEngineer = new FeatureEngineer(config.getRollingWindows(), config.getRolledColumns());
        this.discoverer = new ConsensusCausalDiscoverer(config.getCausalMaxLag(), config.getCorrelationThreshold());
        this.forecaster = Forecaster.builder(featureEngineer)
            .features(config.getForecastFeatures())
            .target(Columns.TARGET)
            .horizon(config.getForecastHorizon())
            .validationFraction(config.getValidationFraction())
            .minRows(config.getMinForecastRows())
            .minValidationTrainRows(config.getMinValidationTrainRows())
            .ridge(config.getRidgePenalty())
            .noiseFloor(config.getNoiseFloor())
            .build();
        this.burdenEstimator = new BurdenEstimator(config.getCostPerCase(), config.getProductivityLossPerCase(),
            config.getPreventionCostPerPerson(), config.getPreventionEffectiveness());
    }

    /**
     * @param liveWeather current conditions, or null when unavailable
     * @throws nexus.data.MissingSourceException   if a mandatory table is absent
     * @throws nexus.data.SchemaViolationException if a table breaks its schema
     */
    public AnalysisResult run(SourceTables sources, MacroContext macroContext, LiveWeather liveWeather) {
        log.info("[1/5] Unifying source tables");
        DailyTable unified = unifier.unify(sources, liveWeather == null ? null : liveWeather.toObservation());

        log.info("[2/5] Engineering features");
        DailyTable engineered = featureEngineer.engineer(unified);

        log.info("[3/5] Discovering causal links (consensus method)");
        ConsensusCausalDiscoverer.Result causal =
            discoverer.discover(engineered, Columns.TARGET, config.getCausalCandidates());

        log.info("[4/5] Forecasting {} days", config.getForecastHorizon());
        ForecastOutcome forecast;
        try {
            forecast = forecaster.forecast(engineered);
        } catch (ModelFitException e) {
            log.error("Forecast model fitting failed; continuing without a forecast", e);
            forecast = ForecastOutcome.fitFailed(e.getMessage());
        }

        log.info("[5/5] Estimating burden and trend");
        BurdenReport burden = burdenEstimator.estimate(unified, forecast.getPoints());

        return new AnalysisResult(unified, engineered, causal, forecast, burden,
            macroContext == null ? MacroContext.ZERO : macroContext, liveWeather);
    }
}
