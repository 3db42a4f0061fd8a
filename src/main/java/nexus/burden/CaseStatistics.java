package nexus.burden;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/** Summary of historical daily case counts. */
public final class CaseStatistics {

    private final double total;
    private final double dailyMean;
    private final double dailyMax;
    private final double dailyMin;
    private final double standardDeviation;
    private final long days;

    private CaseStatistics(DescriptiveStatistics stats) {
        this.days = stats.getN();
        this.total = days == 0 ? 0 : stats.getSum();
        this.dailyMean = days == 0 ? 0 : stats.getMean();
        this.dailyMax = days == 0 ? 0 : stats.getMax();
        this.dailyMin = days == 0 ? 0 : stats.getMin();
        this.standardDeviation = days < 2 ? 0 : stats.getStandardDeviation();
    }

    public static CaseStatistics of(double[] dailyCases) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (double v : dailyCases) {
            if (!Double.isNaN(v)) stats.addValue(v);
        }
        return new CaseStatistics(stats);
    }

    public double getTotal() { return total; }
    public double getDailyMean() { return dailyMean; }
    public double getDailyMax() { return dailyMax; }
    public double getDailyMin() { return dailyMin; }
    public double getStandardDeviation() { return standardDeviation; }
    public long getDays() { return days; }
}
