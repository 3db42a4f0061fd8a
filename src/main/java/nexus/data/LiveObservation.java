package nexus.data;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single weather row taken "now". Its fields supersede historical values on the same date.
 * A missing rain reading is recorded as 0.0, matching how the provider reports dry hours.
 */
public final class LiveObservation {

    private final LocalDate date;
    private final double temperature;
    private final double humidity;
    private final Double rainfallLastHour;

    public LiveObservation(LocalDate date, double temperature, double humidity, Double rainfallLastHour) {
        this.date = date;
        this.temperature = temperature;
        this.humidity = humidity;
        this.rainfallLastHour = rainfallLastHour;
    }

    public LocalDate getDate() { return date; }
    public double getTemperature() { return temperature; }
    public double getHumidity() { return humidity; }
    /** Null when the provider did not report rain. */
    public Double getRainfallLastHour() { return rainfallLastHour; }

    public Observation toObservation() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(Columns.TEMPERATURE, temperature);
        values.put(Columns.HUMIDITY, humidity);
        values.put(Columns.RAINFALL, rainfallLastHour != null ? rainfallLastHour : 0.0);
        return new Observation(date, values);
    }
}
