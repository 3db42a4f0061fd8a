package nexus.pipeline;

import nexus.burden.BurdenReport;
import nexus.burden.CaseStatistics;
import nexus.causal.CausalLink;
import nexus.data.DailyTable;
import nexus.ml.ForecastOutcome;
import nexus.ml.ForecastPoint;
import nexus.ml.ValidationResult;
import nexus.weather.LiveWeather;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Flattens an {@link AnalysisResult} into maps and lists ready for Gson. */
public final class ReportAssembler {

    private ReportAssembler() {
    }

    public static Map<String, Object> toReport(AnalysisResult result, LocalDateTime generatedAt) {
        Map<String, Object> out = new LinkedHashMap<>();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("system", "dengue-nexus");
        metadata.put("timestamp", generatedAt.toString());
        out.put("metadata", metadata);

        DailyTable unified = result.getUnified();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("recordsAnalyzed", unified.size());
        summary.put("start", unified.isEmpty() ? null : unified.firstDate().toString());
        summary.put("end", unified.isEmpty() ? null : unified.lastDate().toString());
        summary.put("features", result.getEngineered().columnNames().size());
        out.put("dataSummary", summary);

        Map<String, Object> live = new LinkedHashMap<>();
        live.put("riskIndex", result.getRisk().name());
        if (result.getLiveWeather().isPresent()) {
            LiveWeather w = result.getLiveWeather().get();
            live.put("temperature", w.getTemperature());
            live.put("humidity", w.getHumidity());
            live.put("rainfallLastHour", w.getRainfallLastHour());
            live.put("description", w.getDescription());
        }
        out.put("liveWeather", live);

        out.put("causalLinks", causalLinks(result.getCausal().getLinks()));
        out.put("forecast", forecast(result.getForecast()));
        out.put("burden", burden(result.getBurden()));

        Map<String, Object> macro = new LinkedHashMap<>();
        macro.put("gdpGrowthRate", result.getMacroContext().getGdpGrowthRate());
        macro.put("inflationRate", result.getMacroContext().getInflationRate());
        macro.put("available", result.getMacroContext().isAvailable());
        out.put("macroContext", macro);
        return out;
    }

    static List<Map<String, Object>> causalLinks(List<CausalLink> links) {
        List<Map<String, Object>> rows = new ArrayList<>(links.size());
        for (CausalLink link : links) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("cause", link.getCause());
            row.put("effect", link.getEffect());
            row.put("lagDays", link.getLagDays());
            row.put("correlation", link.getCorrelation());
            rows.add(row);
        }
        return rows;
    }

    static Map<String, Object> forecast(ForecastOutcome outcome) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", outcome.getStatus().name());
        outcome.getMessage().ifPresent(m -> out.put("message", m));
        out.put("features", outcome.getFeatures());
        List<Map<String, Object>> points = new ArrayList<>();
        for (ForecastPoint p : outcome.getPoints()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", p.getDate().toString());
            row.put("forecast", p.getPoint());
            row.put("lowerCi", p.getLower());
            row.put("upperCi", p.getUpper());
            points.add(row);
        }
        out.put("points", points);
        if (outcome.getValidation().isPresent()) {
            ValidationResult v = outcome.getValidation().get();
            Map<String, Object> validation = new LinkedHashMap<>();
            validation.put("trainingRows", v.getTrainingRows());
            validation.put("heldOutRows", v.size());
            validation.put("meanAbsoluteError", v.meanAbsoluteError());
            validation.put("rSquared", v.rSquared());
            out.put("validation", validation);
        }
        return out;
    }

    static Map<String, Object> burden(BurdenReport burden) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("totalHistoricalCases", burden.getTotalHistoricalCases());
        out.put("healthcareCost", burden.getHealthcareCost());
        out.put("productivityLoss", burden.getProductivityLoss());
        out.put("totalBurden", burden.getTotalBurden());
        out.put("preventionCost", burden.getPreventionRoi().getPreventionCost());
        out.put("potentialSavings", burden.getPreventionRoi().getPotentialSavings());
        out.put("roiPercentage", burden.getPreventionRoi().getRoiPercentage());
        out.put("trend", burden.getTrend().getLabel());
        burden.getPeak().ifPresent(p -> {
            Map<String, Object> peak = new LinkedHashMap<>();
            peak.put("date", p.getDate().toString());
            peak.put("value", p.getPoint());
            out.put("forecastPeak", peak);
        });
        CaseStatistics stats = burden.getCaseStatistics();
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("totalCases", stats.getTotal());
        statistics.put("dailyAverage", stats.getDailyMean());
        statistics.put("dailyMax", stats.getDailyMax());
        statistics.put("dailyMin", stats.getDailyMin());
        statistics.put("standardDeviation", stats.getStandardDeviation());
        out.put("caseStatistics", statistics);
        return out;
    }
}
