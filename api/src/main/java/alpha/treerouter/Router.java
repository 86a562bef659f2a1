package alpha.treerouter;

import alpha.treerouter.action.ActionRegistry;
import alpha.treerouter.action.BeforeAction;
import alpha.treerouter.handler.ClientChannel;
import alpha.treerouter.handler.ErrorHandler;
import alpha.treerouter.handler.RequestHandler;
import alpha.treerouter.message.RawRequest;
import alpha.treerouter.message.Responses;
import alpha.treerouter.route.RouteRegistry;

import java.util.ServiceLoader;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Routes requests to request handlers.<p>
 *
 * A router is a {@link RouteRegistry} of request handlers and an
 * {@link ActionRegistry} of before-actions. The router is created using one of
 * the static {@code create} methods, populated with handlers, and then hooked
 * up to a transport which calls {@link #dispatch(RawRequest, ClientChannel)}
 * for each request received.
 *
 * <pre>
 *   Router app = Router.create()
 *           .get("/", respond(Responses.text("Hello")))
 *           .get("/hello/:name", accept((req, ch) -{@literal >}
 *                   ch.write(Responses.text("Hello " + req.parameters().path("name")))));
 * </pre>
 *
 * Routers compose. A router that handles a sub-domain of the application can
 * be built separately, and then {@linkplain #nest(String, Router) nested} under
 * a prefix or {@linkplain #merge(Router) merged} into the application router.
 *
 * <h2>Request processing</h2>
 *
 * For each dispatched request the router:
 * <ol>
 *   <li>invokes all {@link BeforeAction}s, in order of registration,</li>
 *   <li>resolves the request handler using the request method and path
 *       (the request-target up until the first question mark),</li>
 *   <li>if no handler is found, invokes the {@linkplain
 *       #notFound(RequestHandler) not-found handler}, or writes {@link
 *       Responses#notFound()},</li>
 *   <li>else binds path and query parameters to the request and invokes the
 *       request handler.</li>
 * </ol>
 *
 * Any failure during these steps is delivered once to the {@linkplain
 * #onError(ErrorHandler) error handler}, or results in {@link
 * Responses#internalServerError()}, and no step after the failing one is
 * executed.<p>
 *
 * The implementation is thread-safe.
 *
 * @author TreeRouter authors
 */
public interface Router extends RouteRegistry, ActionRegistry
{
    /**
     * Creates a new {@code Router} using {@link Config#DEFAULT}.
     *
     * @return a new {@code Router}
     */
    static Router create() {
        return create(Config.DEFAULT);
    }

    /**
     * Creates a new {@code Router}.
     *
     * @param config router configuration
     *
     * @return a new {@code Router}
     *
     * @throws NullPointerException
     *             if {@code config} is {@code null}
     */
    static Router create(Config config) {
        requireNonNull(config);
        var loader = ServiceLoader.load(RouterFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config);
    }

    /**
     * Returns the router's configuration.
     *
     * @return the router's configuration (never {@code null})
     */
    Config getConfig();

    /**
     * Sets the handler invoked when no route matches a request.<p>
     *
     * A subsequent call replaces the handler. The not-found handler receives a
     * request without path parameters. Exceptions from the handler are
     * delivered to the error handler.
     *
     * @param handler not-found handler
     *
     * @return this router (for chaining/fluency)
     *
     * @throws NullPointerException
     *             if {@code handler} is {@code null}
     */
    Router notFound(RequestHandler handler);

    /**
     * Sets the handler invoked when the processing of a request fails.<p>
     *
     * A subsequent call replaces the handler.
     *
     * @param handler error handler
     *
     * @return this router (for chaining/fluency)
     *
     * @throws NullPointerException
     *             if {@code handler} is {@code null}
     */
    Router onError(ErrorHandler handler);

    /**
     * Processes a request.<p>
     *
     * The returned stage completes when the processing is done, by which time
     * a response has been written or the channel has been closed. The stage
     * never completes exceptionally; all failures are handled by the error
     * handler or the router's default error response.
     *
     * @param request as received by the transport
     * @param channel to write the response to
     *
     * @return a stage that completes when the processing is done
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    CompletionStage<Void> dispatch(RawRequest request, ClientChannel channel);

    /**
     * Returns a human-readable rendering of the route tree.<p>
     *
     * For example:
     * <pre>
     *   /
     *     [GET] -{@literal >} Index
     *     ├─ items
     *         [GET] -{@literal >} ListItems
     *         ├─ :id
     *             [GET] -{@literal >} GetItem
     * </pre>
     *
     * The format is intended for debugging and may change.
     *
     * @return the route tree
     */
    String describe();
}
