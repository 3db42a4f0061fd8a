package nexus.weather;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenWeatherClientTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-08-15T06:00:00Z"), ZoneOffset.UTC);

    private HttpServer server;

    @AfterEach
    void stop() {
        if (server != null) server.stop(0);
    }

    private static String fixture() throws IOException {
        try (InputStream in = OpenWeatherClientTest.class.getResourceAsStream("/fixtures/openweather-current.json")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String serve(int status, String body, AtomicReference<String> query) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/weather", exchange -> {
            query.set(exchange.getRequestURI().getRawQuery());
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/weather";
    }

    private static OpenWeatherClient client(String url, String key) {
        return new OpenWeatherClient(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
            url, key, 23.8103, 90.4125, Duration.ofSeconds(2), CLOCK);
    }

    @Test
    void parsesCurrentConditions() throws Exception {
        LiveWeather weather = OpenWeatherClient.parse(fixture(), LocalDate.of(2025, 8, 15));

        assertEquals(29.4, weather.getTemperature(), 0.0);
        assertEquals(84, weather.getHumidity(), 0.0);
        assertEquals(0.6, weather.getRainfallLastHour(), 0.0);
        assertEquals("light rain", weather.getDescription());
        assertEquals(MosquitoRisk.CRITICAL, weather.risk());
    }

    @Test
    void absentRainIsNullAndRecordedAsZero() {
        LiveWeather weather = OpenWeatherClient.parse("{\"main\":{\"temp\":24,\"humidity\":60}}", LocalDate.of(2025, 1, 2));

        assertNull(weather.getRainfallLastHour());
        assertEquals(0.0, weather.toObservation().toObservation().get("rainfall"), 0.0);
    }

    @Test
    void missingMainBlockIsRejected() {
        assertThrows(IllegalStateException.class,
            () -> OpenWeatherClient.parse("{\"main\":\"oops\"}", LocalDate.of(2025, 1, 2)));
    }

    @Test
    void fetchesWithCoordinatesAndKey() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        String url = serve(200, fixture(), query);

        Optional<LiveWeather> weather = client(url, "secret").current();

        assertTrue(weather.isPresent());
        assertEquals(LocalDate.of(2025, 8, 15), weather.get().getObservedOn());
        assertTrue(query.get().contains("lat=23.8103"));
        assertTrue(query.get().contains("units=metric"));
        assertTrue(query.get().contains("appid=secret"));
    }

    @Test
    void errorStatusDegradesToEmpty() throws Exception {
        String url = serve(401, "{\"cod\":401}", new AtomicReference<>());

        assertFalse(client(url, "bad").current().isPresent());
    }

    @Test
    void malformedBodyDegradesToEmpty() throws Exception {
        String url = serve(200, "not json at all {", new AtomicReference<>());

        assertFalse(client(url, "secret").current().isPresent());
    }

    @Test
    void nullTemperatureDegradesToEmpty() throws Exception {
        String url = serve(200, "{\"main\":{\"temp\":null,\"humidity\":80}}", new AtomicReference<>());

        assertTrue(client(url, "secret").current().isEmpty());
    }

    @Test
    void nonNumericReadingsDegradeToEmpty() throws Exception {
        String url = serve(200, "{\"main\":{\"temp\":{\"value\":30},\"humidity\":[80]}}", new AtomicReference<>());

        assertTrue(client(url, "secret").current().isEmpty());
    }

    @Test
    void nonObjectMainBlockDegradesToEmpty() throws Exception {
        String url = serve(200, "{\"main\":[29.4,84]}", new AtomicReference<>());

        assertTrue(client(url, "secret").current().isEmpty());
    }

    @Test
    void malformedBaseUrlDegradesToEmpty() {
        assertTrue(client("http://127.0.0.1:1/not a path", "secret").current().isEmpty());
        assertTrue(client("ftp://127.0.0.1/weather", "secret").current().isEmpty());
    }

    @Test
    void blankKeySkipsTheCall() {
        assertFalse(client("http://127.0.0.1:1/weather", " ").current().isPresent());
        assertFalse(client("http://127.0.0.1:1/weather", null).current().isPresent());
    }
}
