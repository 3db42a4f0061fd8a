package nexus.burden;

/** Return on a per-person prevention programme that averts a fixed share of cases. */
public final class PreventionRoi {

    private final double preventionCost;
    private final double potentialSavings;
    private final double roiPercentage;

    public PreventionRoi(double preventionCost, double potentialSavings) {
        this.preventionCost = preventionCost;
        this.potentialSavings = potentialSavings;
        this.roiPercentage = preventionCost > 0 ? (potentialSavings - preventionCost) / preventionCost * 100 : 0;
    }

    public double getPreventionCost() { return preventionCost; }
    public double getPotentialSavings() { return potentialSavings; }
    /** 0 when the prevention cost is 0. */
    public double getRoiPercentage() { return roiPercentage; }
}
