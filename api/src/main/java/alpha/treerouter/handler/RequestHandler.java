package alpha.treerouter.handler;

import alpha.treerouter.Router;
import alpha.treerouter.message.Request;

import java.util.concurrent.CompletionStage;

/**
 * A request-processing function.<p>
 *
 * The handler is registered with a method token and a path pattern, see
 * {@link Router#add(String, String, RequestHandler)}. When invoked, the
 * handler must write exactly one response to the given channel, either before
 * returning or at some later point in time, and return a stage that completes
 * when the handler is done:
 *
 * <pre>
 *   RequestHandler greet = (request, channel) -{@literal >} {
 *       String name = request.parameters().path("name");
 *       channel.write(Responses.text("Hello " + name + "!"));
 *       return completedStage(null);
 *   };
 *   router.get("/hello/:name", greet);
 * </pre>
 *
 * A handler that performs asynchronous work returns the stage of that work.
 * The router awaits the stage before it considers the exchange complete.<p>
 *
 * Exceptions thrown by the handler, as well as a returned stage that completes
 * exceptionally, are delivered to the router's {@link ErrorHandler}. If no
 * error handler has been registered, a 500 (Internal Server Error) response is
 * written, unless the handler already wrote a response.<p>
 *
 * For simple, synchronous handlers, see {@link RequestHandlers}.<p>
 *
 * The handler may be called concurrently and must be thread-safe.
 *
 * @author TreeRouter authors
 */
@FunctionalInterface
public interface RequestHandler
{
    /**
     * Handles a request.
     *
     * @param request the request (never {@code null})
     * @param channel the channel to write the response to (never {@code null})
     *
     * @return a stage that completes when the handler is done
     *         (must not be {@code null})
     *
     * @throws Exception if the handler fails
     */
    CompletionStage<Void> handle(Request request, ClientChannel channel) throws Exception;
}
