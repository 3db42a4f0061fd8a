package nexus.data;

/** Incidence severity bands, cases per 100k. */
public enum Severity {
    LOW, MODERATE, HIGH, CRITICAL;

    public static Severity classify(double casesPer100k) {
        if (Double.isNaN(casesPer100k) || casesPer100k < 10) return LOW;
        if (casesPer100k < 50) return MODERATE;
        if (casesPer100k < 100) return HIGH;
        return CRITICAL;
    }
}
