package nexus.pipeline;

import nexus.burden.BurdenReport;
import nexus.causal.ConsensusCausalDiscoverer;
import nexus.data.DailyTable;
import nexus.data.MacroContext;
import nexus.ml.ForecastOutcome;
import nexus.weather.LiveWeather;
import nexus.weather.MosquitoRisk;

import java.util.Optional;

/** Everything one run produced, stage by stage. */
public final class AnalysisResult {

    private final DailyTable unified;
    private final DailyTable engineered;
    private final ConsensusCausalDiscoverer.Result causal;
    private final ForecastOutcome forecast;
    private final BurdenReport burden;
    private final MacroContext macroContext;
    private final LiveWeather liveWeather;

    AnalysisResult(DailyTable unified, DailyTable engineered, ConsensusCausalDiscoverer.Result causal,
                   ForecastOutcome forecast, BurdenReport burden, MacroContext macroContext, LiveWeather liveWeather) {
        this.unified = unified;
        this.engineered = engineered;
        this.causal = causal;
        this.forecast = forecast;
        this.burden = burden;
        this.macroContext = macroContext;
        this.liveWeather = liveWeather;
    }

    public DailyTable getUnified() { return unified; }
    public DailyTable getEngineered() { return engineered; }
    public ConsensusCausalDiscoverer.Result getCausal() { return causal; }
    public ForecastOutcome getForecast() { return forecast; }
    public BurdenReport getBurden() { return burden; }
    public MacroContext getMacroContext() { return macroContext; }
    public Optional<LiveWeather> getLiveWeather() { return Optional.ofNullable(liveWeather); }

    public MosquitoRisk getRisk() {
        return liveWeather == null ? MosquitoRisk.UNKNOWN : liveWeather.risk();
    }
}
