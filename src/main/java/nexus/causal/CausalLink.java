package nexus.causal;

import java.util.Objects;

/** Directed relation cause -> effect at a lag in days, with the signed correlation at that lag. */
public final class CausalLink {

    private final String cause;
    private final String effect;
    private final int lagDays;
    private final double correlation;

    public CausalLink(String cause, String effect, int lagDays, double correlation) {
        if (lagDays < 1) throw new IllegalArgumentException("lag must be >= 1, got " + lagDays);
        this.cause = Objects.requireNonNull(cause, "cause");
        this.effect = Objects.requireNonNull(effect, "effect");
        this.lagDays = lagDays;
        this.correlation = correlation;
    }

    public String getCause() { return cause; }
    public String getEffect() { return effect; }
    public int getLagDays() { return lagDays; }
    public double getCorrelation() { return correlation; }

    @Override
    public String toString() {
        return String.format("%s -> %s (lag %d days, r=%.3f)", cause, effect, lagDays, correlation);
    }
}
