package alpha.treerouter.handler;

import alpha.treerouter.Router;
import alpha.treerouter.message.Request;

import java.util.concurrent.CompletionStage;

/**
 * A request-processing function that receives a parsed request body.<p>
 *
 * A payload handler is registered using one of the payload registrars of the
 * router, e.g. {@link Router#post(String, PayloadHandler)}. The router wraps
 * the handler in a {@link RequestHandler} that validates the Content-Type
 * header, enforces a size limit, collects the body and parses it as JSON.
 * Only when all of that succeeded will the payload handler be invoked:
 *
 * <pre>
 *   router.post("/greet", (request, channel, json) -{@literal >} {
 *       String name = json.getAsJsonObject().get("name").getAsString();
 *       channel.write(Responses.text("Hello " + name + "!"));
 *       return completedStage(null);
 *   });
 * </pre>
 *
 * If the body can not be accepted, the router responds on behalf of the
 * application; 415 (Unsupported Media Type), 413 (Request Entity Too Large),
 * or 400 (Bad Request). Exceptions thrown by the payload handler are delivered
 * to the {@link ErrorHandler}, same as exceptions from a {@link
 * RequestHandler}.
 *
 * @param <T> type of parsed body
 *
 * @author TreeRouter authors
 */
@FunctionalInterface
public interface PayloadHandler<T>
{
    /**
     * Handles a request.
     *
     * @param request the request (never {@code null})
     * @param channel the channel to write the response to (never {@code null})
     * @param body the parsed request body (never {@code null}; the JSON literal
     *             {@code null} is {@code JsonNull} for a {@code JsonElement}
     *             and rejected with 400 for any other type)
     *
     * @return a stage that completes when the handler is done
     *         (must not be {@code null})
     *
     * @throws Exception if the handler fails
     */
    CompletionStage<Void> handle(Request request, ClientChannel channel, T body) throws Exception;
}
