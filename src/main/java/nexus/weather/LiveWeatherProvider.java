package nexus.weather;

import java.util.Optional;

/** Source of current conditions. Unavailability is an empty result, never a zero reading. */
public interface LiveWeatherProvider {

    Optional<LiveWeather> current();

    static LiveWeatherProvider unavailable() {
        return Optional::empty;
    }
}
