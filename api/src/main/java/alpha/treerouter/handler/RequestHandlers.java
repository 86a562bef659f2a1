package alpha.treerouter.handler;

import alpha.treerouter.message.Request;
import alpha.treerouter.message.Response;
import alpha.treerouter.util.Throwing;

import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Utility methods for building {@link RequestHandler}s and
 * {@link PayloadHandler}s out of synchronous logic.
 *
 * <pre>
 *   router.get("/", respond(Responses.text("Hello")))
 *         .get("/:name", accept((req, ch) -{@literal >}
 *                 ch.write(Responses.text("Hello " + req.parameters().path("name")))));
 * </pre>
 *
 * @author TreeRouter authors
 */
public final class RequestHandlers
{
    private static final CompletionStage<Void> COMPLETED = completedStage(null);

    private RequestHandlers() {
        // Empty
    }

    /**
     * Returns a handler that does nothing; it writes no response.<p>
     *
     * Useful for tests of the routing itself.
     *
     * @return a handler
     */
    public static RequestHandler noop() {
        return (req, ch) -> COMPLETED;
    }

    /**
     * Returns a handler that writes the given response.
     *
     * @param response to write
     * @return a handler
     * @throws NullPointerException if {@code response} is {@code null}
     */
    public static RequestHandler respond(Response response) {
        requireNonNull(response);
        return (req, ch) -> {
            ch.write(response);
            return COMPLETED;
        };
    }

    /**
     * Returns a handler that executes the given logic synchronously.
     *
     * @param logic of handler
     * @return a handler
     * @throws NullPointerException if {@code logic} is {@code null}
     */
    public static RequestHandler accept(
            Throwing.BiConsumer<Request, ClientChannel, ? extends Exception> logic)
    {
        requireNonNull(logic);
        return (req, ch) -> {
            logic.accept(req, ch);
            return COMPLETED;
        };
    }

    /**
     * Returns a payload handler that executes the given logic synchronously.
     *
     * @param logic of handler
     * @param <T> type of body
     * @return a payload handler
     * @throws NullPointerException if {@code logic} is {@code null}
     */
    public static <T> PayloadHandler<T> acceptBody(
            Throwing.TriConsumer<Request, ClientChannel, T, ? extends Exception> logic)
    {
        requireNonNull(logic);
        return (req, ch, body) -> {
            logic.accept(req, ch, body);
            return COMPLETED;
        };
    }
}
