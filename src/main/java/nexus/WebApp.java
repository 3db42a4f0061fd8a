package nexus;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.javalin.Javalin;
import io.javalin.http.Context;
import nexus.pipeline.AnalysisConfig;
import nexus.pipeline.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP front end for the analysis pipeline.
 * Run with: mvn exec:java -Dexec.mainClass="nexus.WebApp" [-Dexec.args="config.json"]
 */
public class WebApp {

    private static final Logger log = LoggerFactory.getLogger(WebApp.class);

    private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid PORT '{}'", env);
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        AnalysisConfig config = args.length > 0 ? ConfigLoader.load(Path.of(args[0])) : AnalysisConfig.defaults();
        AnalyzeHandler handler = new AnalyzeHandler(config);
        int port = getPort();
        Javalin app = Javalin.create().start("0.0.0.0", port);

        app.post("/api/analyze", ctx -> sendJson(ctx, 200, handler.handle(ctx.body(), LocalDateTime.now())));

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("status", "ok");
            h.put("port", port);
            sendJson(ctx, 200, h);
        });

        log.info("Dengue nexus web app: http://localhost:{}", port);
    }

    private static void sendJson(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(GSON.toJson(body));
    }
}
