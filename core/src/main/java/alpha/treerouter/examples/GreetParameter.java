package alpha.treerouter.examples;

import alpha.treerouter.Router;
import alpha.treerouter.core.JdkHttpServerAdapter;

import java.io.IOException;
import java.net.InetSocketAddress;

import static alpha.treerouter.handler.RequestHandlers.accept;
import static alpha.treerouter.message.Responses.text;

/**
 * Responds a greeting using a name taken from a path- or query parameter.
 *
 * @author TreeRouter authors
 */
public final class GreetParameter
{
    private static final int PORT = 8080;

    private GreetParameter() {
        // Empty
    }

    /**
     * Builds the application's router.<p>
     *
     * Example requests:
     * <pre>
     *   "/hello/John"         Hello John!
     *   "/hello?name=John"    Hello John!
     *   "/hello"              400 Bad Request
     * </pre>
     *
     * @return the router
     */
    static Router router() {
        return Router.create()
                // Name given by path
                .get("/hello/:name", accept((req, ch) ->
                        ch.write(text("Hello " + req.parameters().path("name") + "!"))))
                // Name given by query
                .get("/hello", accept((req, ch) ->
                        ch.write(req.parameters()
                                    .queryFirst("name")
                                    .map(name -> text("Hello " + name + "!"))
                                    .orElse(text(400, "Missing name")))));
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
