package alpha.treerouter.handler;

import alpha.treerouter.Router;
import alpha.treerouter.action.BeforeAction;
import alpha.treerouter.message.Request;
import alpha.treerouter.message.Responses;

import java.util.concurrent.CompletionStage;

/**
 * Handles a failure that occurred while processing a request.<p>
 *
 * The router invokes the error handler exactly once per failed exchange, for
 * exceptions thrown by a {@link BeforeAction}, a {@link RequestHandler}, a
 * {@link PayloadHandler} or the not-found handler, and for stages returned
 * from these entities that complete exceptionally. A {@code
 * CompletionException} is unwrapped before the throwable is passed to the
 * handler.<p>
 *
 * Failures to accept a request body (wrong media type, too large, malformed
 * JSON) are handled by the payload route itself and are not delivered to the
 * error handler.<p>
 *
 * The error handler should write a response, unless the channel already
 * {@link ClientChannel#wroteFinal() wrote} one:
 *
 * <pre>
 *   router.onError((thr, request, channel) -{@literal >} {
 *       if (!channel.wroteFinal()) {
 *           channel.write(thr instanceof NoSuchElementException ?
 *                   Responses.text(404, "No such item") :
 *                   Responses.internalServerError());
 *       }
 *       return completedStage(null);
 *   });
 * </pre>
 *
 * If no error handler is registered, the router writes
 * {@link Responses#internalServerError()}. An exception thrown from the error
 * handler itself is logged and then the same default response is written,
 * if no response has been written yet.
 *
 * @author TreeRouter authors
 *
 * @see Router#onError(ErrorHandler)
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles a failure.
     *
     * @param thr the failure (never {@code null})
     * @param request the request (never {@code null})
     * @param channel the channel (never {@code null})
     *
     * @return a stage that completes when the handler is done
     *         (must not be {@code null})
     *
     * @throws Exception if the handler fails
     */
    CompletionStage<Void> apply(Throwable thr, Request request, ClientChannel channel) throws Exception;
}
