package nexus.weather;

import nexus.data.LiveObservation;

import java.time.LocalDate;

/** Current conditions as reported by a live provider. */
public final class LiveWeather {

    private final LocalDate observedOn;
    private final double temperature;
    private final double humidity;
    private final Double rainfallLastHour;
    private final String description;

    public LiveWeather(LocalDate observedOn, double temperature, double humidity, Double rainfallLastHour, String description) {
        this.observedOn = observedOn;
        this.temperature = temperature;
        this.humidity = humidity;
        this.rainfallLastHour = rainfallLastHour;
        this.description = description;
    }

    public LocalDate getObservedOn() { return observedOn; }
    public double getTemperature() { return temperature; }
    public double getHumidity() { return humidity; }
    /** Null when the provider reported no rain figure. */
    public Double getRainfallLastHour() { return rainfallLastHour; }
    public String getDescription() { return description; }

    public MosquitoRisk risk() {
        return MosquitoRisk.classify(temperature, humidity);
    }

    public LiveObservation toObservation() {
        return new LiveObservation(observedOn, temperature, humidity, rainfallLastHour);
    }
}
