package alpha.treerouter.examples;

import alpha.treerouter.Router;
import alpha.treerouter.core.JdkHttpServerAdapter;

import java.io.IOException;
import java.net.InetSocketAddress;

import static alpha.treerouter.handler.RequestHandlers.respond;
import static alpha.treerouter.message.Responses.text;
import static java.lang.System.Logger.Level.INFO;

/**
 * Responds "Hello World!" to GET requests for "/".
 *
 * @author TreeRouter authors
 */
public final class HelloWorld
{
    private static final System.Logger LOG
            = System.getLogger(HelloWorld.class.getPackageName());

    private static final int PORT = 8080;

    private HelloWorld() {
        // Empty
    }

    /**
     * Builds the application's router.
     *
     * @return the router
     */
    static Router router() {
        return Router.create().get("/", respond(text("Hello World!")));
    }

    /**
     * Application's entry point.
     *
     * @param args ignored
     *
     * @throws IOException
     *             if the server could not be started
     */
    public static void main(String... args) throws IOException {
        Router app = router();
        LOG.log(INFO, () -> "Routes:\n" + app.describe());
        JdkHttpServerAdapter.start(app, new InetSocketAddress(PORT));
    }
}
