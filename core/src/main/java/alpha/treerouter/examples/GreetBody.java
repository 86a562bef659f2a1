package alpha.treerouter.examples;

import alpha.treerouter.Router;
import alpha.treerouter.core.JdkHttpServerAdapter;

import java.io.IOException;
import java.net.InetSocketAddress;

import static alpha.treerouter.HttpConstants.Method.POST;
import static alpha.treerouter.handler.RequestHandlers.acceptBody;
import static alpha.treerouter.message.Responses.text;

/**
 * Responds a greeting using a name taken from a JSON request body.
 *
 * <pre>
 *   curl -H "Content-Type: application/json" -d '{"name":"John"}' localhost:8080/greet
 *   Hello John!
 * </pre>
 *
 * @author TreeRouter authors
 */
public final class GreetBody
{
    private static final int PORT = 8080;

    /**
     * The request body.
     *
     * @param name to greet
     */
    record Greeting(String name) {
        // Empty
    }

    private GreetBody() {
        // Empty
    }

    /**
     * Builds the application's router.<p>
     *
     * The body may be at most 1 KiB.
     *
     * @return the router
     */
    static Router router() {
        return Router.create().payload(POST, "/greet", Greeting.class, 1_024,
                acceptBody((req, ch, body) -> ch.write(body.name() == null ?
                        text(400, "Missing name") :
                        text("Hello " + body.name() + "!"))));
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
        JdkHttpServerAdapter.start(router(), new InetSocketAddress(PORT));
    }
}
