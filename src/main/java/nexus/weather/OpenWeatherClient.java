package nexus.weather;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

/**
 * OpenWeather current-weather client. Every failure (no key, timeout, bad status, malformed body)
 * is logged and reported as unavailable so the batch run never stalls on it.
 */
public final class OpenWeatherClient implements LiveWeatherProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenWeatherClient.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final double latitude;
    private final double longitude;
    private final Duration timeout;
    private final Clock clock;

    public OpenWeatherClient(HttpClient httpClient, String baseUrl, String apiKey,
                             double latitude, double longitude, Duration timeout, Clock clock) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.latitude = latitude;
        this.longitude = longitude;
        this.timeout = timeout;
        this.clock = clock;
    }

    public static OpenWeatherClient create(String baseUrl, String apiKey, double latitude, double longitude, Duration timeout) {
        HttpClient client = HttpClient.newBuilder().connectTimeout(timeout).build();
        return new OpenWeatherClient(client, baseUrl, apiKey, latitude, longitude, timeout, Clock.systemDefaultZone());
    }

    @Override
    public Optional<LiveWeather> current() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No OpenWeather API key configured; live weather unavailable");
            return Optional.empty();
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(requestUri())
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.warn("Live weather request failed with status {}; proceeding with historical data only",
                    response.statusCode());
                return Optional.empty();
            }
            LiveWeather weather = parse(response.body(), LocalDate.now(clock));
            log.info("Live weather: {}°C, {}% humidity, mosquito risk {}",
                weather.getTemperature(), weather.getHumidity(), weather.risk());
            return Optional.of(weather);
        } catch (IOException | IllegalArgumentException | IllegalStateException | JsonParseException
                 | UnsupportedOperationException | ClassCastException e) {
            log.warn("Could not fetch live weather: {}; proceeding with historical data only", e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Live weather fetch interrupted; proceeding with historical data only");
            return Optional.empty();
        }
    }

    URI requestUri() {
        return URI.create(baseUrl
            + "?lat=" + latitude
            + "&lon=" + longitude
            + "&units=metric"
            + "&appid=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalStateException if temperature or humidity is missing
     * @throws UnsupportedOperationException if temperature or humidity is null or not a number
     */
    static LiveWeather parse(String body, LocalDate observedOn) {
        JsonObject root = JsonParser.parseString(body).getAsJsonObject();
        JsonElement mainElement = root.get("main");
        if (mainElement == null || !mainElement.isJsonObject()
            || !mainElement.getAsJsonObject().has("temp") || !mainElement.getAsJsonObject().has("humidity")) {
            throw new IllegalStateException("OpenWeather response missing main.temp or main.humidity");
        }
        JsonObject main = mainElement.getAsJsonObject();
        double temperature = main.get("temp").getAsDouble();
        double humidity = main.get("humidity").getAsDouble();

        Double rain = null;
        JsonElement rainElement = root.get("rain");
        if (rainElement != null && rainElement.isJsonObject() && rainElement.getAsJsonObject().has("1h")) {
            rain = rainElement.getAsJsonObject().get("1h").getAsDouble();
        }

        String description = "";
        JsonElement weather = root.get("weather");
        if (weather != null && weather.isJsonArray() && weather.getAsJsonArray().size() > 0) {
            JsonElement first = weather.getAsJsonArray().get(0);
            if (first.isJsonObject() && first.getAsJsonObject().has("description")) {
                description = first.getAsJsonObject().get("description").getAsString();
            }
        }
        return new LiveWeather(observedOn, temperature, humidity, rain, description);
    }
}
