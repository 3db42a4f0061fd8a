package nexus.weather;

/** Transmission risk from current temperature (°C) and relative humidity (%). */
public enum MosquitoRisk {
    LOW, MODERATE, HIGH, CRITICAL, UNKNOWN;

    public static MosquitoRisk classify(double temperature, double humidity) {
        if (Double.isNaN(temperature) || Double.isNaN(humidity)) return UNKNOWN;
        if (temperature > 32 || temperature < 20) return LOW;
        if (temperature >= 28 && temperature <= 32 && humidity > 80) return CRITICAL;
        if (temperature >= 25 && temperature <= 30 && humidity > 70) return HIGH;
        return MODERATE;
    }
}
