package nexus.burden;

import nexus.data.Columns;
import nexus.data.DailyTable;
import nexus.ml.ForecastPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Converts historical case totals and the forecast into an economic burden and a trend label.
 * <p>
 * total burden = total historical cases × (cost per case + productivity loss per case)
 */
public class BurdenEstimator {

    private static final Logger log = LoggerFactory.getLogger(BurdenEstimator.class);

    private final double costPerCase;
    private final double productivityLossPerCase;
    private final double preventionCostPerPerson;
    private final double preventionEffectiveness;

    public BurdenEstimator(double costPerCase, double productivityLossPerCase,
                           double preventionCostPerPerson, double preventionEffectiveness) {
        this.costPerCase = costPerCase;
        this.productivityLossPerCase = productivityLossPerCase;
        this.preventionCostPerPerson = preventionCostPerPerson;
        this.preventionEffectiveness = preventionEffectiveness;
    }

    public static double totalBurden(long totalCases, double costPerCase, double productivityLossPerCase) {
        return totalCases * (costPerCase + productivityLossPerCase);
    }

    /** @param forecast may be empty when the forecast stage was skipped */
    public BurdenReport estimate(DailyTable unified, List<ForecastPoint> forecast) {
        double[] cases = unified.column(Columns.CASE_COUNT);
        CaseStatistics stats = CaseStatistics.of(cases);
        long totalCases = (long) Math.floor(Math.max(0, stats.getTotal()));

        double healthcare = totalCases * costPerCase;
        double productivity = totalCases * productivityLossPerCase;
        double total = totalBurden(totalCases, costPerCase, productivityLossPerCase);

        double population = unified.isEmpty() || !unified.hasColumn(Columns.POPULATION_ESTIMATE)
            ? 0 : unified.value(Columns.POPULATION_ESTIMATE, unified.size() - 1);
        double preventionCost = population > 0 ? population * preventionCostPerPerson : 0;
        double savings = totalCases * preventionEffectiveness * (costPerCase + productivityLossPerCase);
        PreventionRoi roi = new PreventionRoi(preventionCost, savings);

        TrendLabel trend = TrendLabel.of(cases);
        ForecastPoint peak = peak(forecast);

        log.info("Estimated burden ${} over {} cases; trend {}", String.format("%,.0f", total), totalCases, trend);
        return new BurdenReport(totalCases, healthcare, productivity, total, roi, trend, peak, stats);
    }

    /** First forecast day with the maximum point estimate, or null. */
    static ForecastPoint peak(List<ForecastPoint> forecast) {
        ForecastPoint best = null;
        for (ForecastPoint p : forecast) {
            if (best == null || p.getPoint() > best.getPoint()) best = p;
        }
        return best;
    }
}
