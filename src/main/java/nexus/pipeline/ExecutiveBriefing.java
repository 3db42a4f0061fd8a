package nexus.pipeline;

import nexus.burden.BurdenReport;
import nexus.data.Columns;
import nexus.data.MacroContext;
import nexus.data.Severity;
import nexus.ml.ForecastPoint;
import nexus.weather.LiveWeather;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/** Plain-text summary of a run for non-technical readers. */
public final class ExecutiveBriefing {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(70);

    private ExecutiveBriefing() {
    }

    public static String render(AnalysisResult result, AnalysisConfig config, LocalDateTime generatedAt) {
        BurdenReport burden = result.getBurden();
        MacroContext macro = result.getMacroContext();
        StringBuilder sb = new StringBuilder();

        sb.append("DENGUE NEXUS - EXECUTIVE BRIEFING\n");
        sb.append("Report Generated: ").append(TIMESTAMP.format(generatedAt)).append('\n');
        sb.append(RULE).append("\n\n");

        sb.append("--- CURRENT RISK DASHBOARD ---\n");
        sb.append("  - Live Mosquito Risk Index: ").append(result.getRisk()).append('\n');
        Optional<LiveWeather> live = result.getLiveWeather();
        if (live.isPresent()) {
            sb.append(format("    (Based on Temp: %.1f°C, Humidity: %.0f%%)%n",
                live.get().getTemperature(), live.get().getHumidity()));
        } else {
            sb.append("    (Live weather unavailable)\n");
        }
        if (!result.getUnified().isEmpty()) {
            double latest = result.getUnified().value(Columns.TARGET, result.getUnified().size() - 1);
            sb.append(format("  - Latest Incidence: %.2f cases/100k (%s)%n", latest, Severity.classify(latest)));
        }
        sb.append("  - Recent Case Trend (7-day avg): ").append(burden.getTrend().getLabel()).append('\n');
        Optional<ForecastPoint> peak = burden.getPeak();
        if (peak.isPresent()) {
            sb.append(format("  - Forecasted Peak: %.1f cases/100k around %s%n",
                peak.get().getPoint(), peak.get().getDate()));
        } else {
            sb.append("  - Forecasted Peak: forecast unavailable (")
                .append(result.getForecast().getStatus())
                .append(")\n");
        }
        sb.append('\n');

        sb.append("--- HISTORICAL ANALYSIS & ECONOMIC BURDEN ---\n");
        sb.append(format("  - Total Cases Analyzed: %,d%n", burden.getTotalHistoricalCases()));
        sb.append("  - High-Confidence Causal Links Found: ").append(result.getCausal().getGraph().size()).append('\n');
        sb.append(format("  - Estimated Economic Burden to Date: $%,.0f USD%n", burden.getTotalBurden()));
        sb.append(format("    (NOTE: Estimate based on $%.0f/case treatment & $%.0f/case productivity loss)%n",
            config.getCostPerCase(), config.getProductivityLossPerCase()));
        sb.append(format("  - Prevention ROI: %.1f%%%n", burden.getPreventionRoi().getRoiPercentage()));
        sb.append('\n');

        sb.append("--- MACROECONOMIC CONTEXT ---\n");
        sb.append(format("  - Latest Annual GDP Growth Rate: %.2f%%%n", macro.getGdpGrowthRate()));
        sb.append(format("  - Latest Annual Inflation Rate: %.2f%%%n", macro.getInflationRate()));
        if (!macro.isAvailable()) {
            sb.append("    (Economic indicators unavailable; defaults shown)\n");
        }
        return sb.toString();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
