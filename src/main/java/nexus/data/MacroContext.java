package nexus.data;

/** Latest macroeconomic indicators, in percent. Zero when no economic table was available. */
public final class MacroContext {

    public static final MacroContext ZERO = new MacroContext(0, 0, false);

    private final double gdpGrowthRate;
    private final double inflationRate;
    private final boolean available;

    public MacroContext(double gdpGrowthRate, double inflationRate) {
        this(gdpGrowthRate, inflationRate, true);
    }

    private MacroContext(double gdpGrowthRate, double inflationRate, boolean available) {
        this.gdpGrowthRate = gdpGrowthRate;
        this.inflationRate = inflationRate;
        this.available = available;
    }

    public double getGdpGrowthRate() { return gdpGrowthRate; }
    public double getInflationRate() { return inflationRate; }
    public boolean isAvailable() { return available; }
}
