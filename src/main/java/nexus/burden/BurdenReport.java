package nexus.burden;

import nexus.ml.ForecastPoint;

import java.util.Optional;

/** Burden estimate, short-term trend and forecast peak for one run. */
public final class BurdenReport {

    private final long totalHistoricalCases;
    private final double healthcareCost;
    private final double productivityLoss;
    private final double totalBurden;
    private final PreventionRoi preventionRoi;
    private final TrendLabel trend;
    private final ForecastPoint peak;
    private final CaseStatistics caseStatistics;

    BurdenReport(long totalHistoricalCases, double healthcareCost, double productivityLoss, double totalBurden,
                 PreventionRoi preventionRoi, TrendLabel trend, ForecastPoint peak, CaseStatistics caseStatistics) {
        this.totalHistoricalCases = totalHistoricalCases;
        this.healthcareCost = healthcareCost;
        this.productivityLoss = productivityLoss;
        this.totalBurden = totalBurden;
        this.preventionRoi = preventionRoi;
        this.trend = trend;
        this.peak = peak;
        this.caseStatistics = caseStatistics;
    }

    public long getTotalHistoricalCases() { return totalHistoricalCases; }
    public double getHealthcareCost() { return healthcareCost; }
    public double getProductivityLoss() { return productivityLoss; }
    public double getTotalBurden() { return totalBurden; }
    public PreventionRoi getPreventionRoi() { return preventionRoi; }
    public TrendLabel getTrend() { return trend; }
    /** Forecast day with the highest point estimate; empty without a forecast. */
    public Optional<ForecastPoint> getPeak() { return Optional.ofNullable(peak); }
    public CaseStatistics getCaseStatistics() { return caseStatistics; }
}
