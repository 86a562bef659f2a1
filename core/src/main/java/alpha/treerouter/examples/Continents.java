package alpha.treerouter.examples;

import alpha.treerouter.Router;
import alpha.treerouter.core.JdkHttpServerAdapter;
import alpha.treerouter.core.StaticAssets;
import com.google.gson.Gson;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.List;

import static alpha.treerouter.handler.RequestHandlers.accept;
import static alpha.treerouter.handler.RequestHandlers.respond;
import static alpha.treerouter.message.Responses.html;
import static alpha.treerouter.message.Responses.json;
import static alpha.treerouter.message.Responses.text;
import static java.lang.System.Logger.Level.INFO;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * An application composed of several routers.<p>
 *
 * A page is served at "/", an API router is nested under "/api" and, if a
 * directory is given as the first program argument, its files are served as
 * static assets. Every request is logged by a before-action and failures are
 * answered by a custom error handler.
 *
 * @author TreeRouter authors
 */
public final class Continents
{
    private static final System.Logger LOG
            = System.getLogger(Continents.class.getPackageName());

    private static final int PORT = 5000;

    static final List<String> CONTINENTS = List.of(
            "Africa", "Antarctica", "Asia", "Australia",
            "Europe", "North America", "South America");

    private Continents() {
        // Empty
    }

    /**
     * Builds the API router.
     *
     * @return the API router
     */
    static Router api() {
        String all = new Gson().toJson(CONTINENTS);
        return Router.create()
                .get("/continents", respond(json(all)))
                .get("/continents/:index", accept((req, ch) -> {
                    int i = Integer.parseInt(req.parameters().path("index"));
                    ch.write(text(CONTINENTS.get(i)));
                }));
    }

    /**
     * Builds the application's router.
     *
     * @param assets directory of static assets (may be {@code null})
     *
     * @return the router
     *
     * @throws IOException
     *             if the assets directory could not be walked
     */
    static Router router(Path assets) throws IOException {
        Router app = Router.create()
                .before((req, ch) -> {
                    LOG.log(INFO, () -> req.method() + " " + req.target());
                    return completedStage(null);
                })
                .get("/", respond(html(
                        "<h1>Continents</h1><p>Server says hello to Client!</p>")))
                .nest("/api", api())
                .onError((thr, req, ch) -> {
                    ch.write(text(thr instanceof IndexOutOfBoundsException ||
                                  thr instanceof NumberFormatException ?
                                      404 : 500,
                                  "Failed: " + thr.getClass().getSimpleName()));
                    return completedStage(null);
                });
        if (assets != null) {
            new StaticAssets(assets).serve(app);
        }
        return app;
    }

    /**
     * Application's entry point.
     *
     * @param args optional directory of static assets
     *
     * @throws IOException
     *             if the server could not be started
     */
    public static void main(String... args) throws IOException {
        Router app = router(args.length > 0 ? Path.of(args[0]) : null);
        LOG.log(INFO, () -> "Routes:\n" + app.describe());
        JdkHttpServerAdapter.start(app, new InetSocketAddress(PORT));
    }
}
