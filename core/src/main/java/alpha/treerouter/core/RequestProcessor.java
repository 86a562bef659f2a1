package alpha.treerouter.core;

import alpha.treerouter.action.BeforeAction;
import alpha.treerouter.handler.ClientChannel;
import alpha.treerouter.handler.ErrorHandler;
import alpha.treerouter.handler.RequestHandler;
import alpha.treerouter.handler.ResponseRejectedException;
import alpha.treerouter.message.RawRequest;
import alpha.treerouter.message.Responses;
import alpha.treerouter.route.NoRouteFoundException;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;
import static java.util.function.Function.identity;

/**
 * Processes one request from reception until a response has been sent.<p>
 *
 * The processor runs the before-actions, looks up the route, binds the path
 * parameters and invokes the request handler. If no route is found, the
 * not-found handler is invoked, or {@link Responses#notFound()} is written.
 * Any failure along the way is delivered once to the error handler, or results
 * in {@link Responses#internalServerError()} if no response has been written
 * already.<p>
 *
 * Each state transition is logged on {@code DEBUG} level.<p>
 *
 * The processor is constructed from a snapshot of the router's state and is
 * not affected by routes registered after the request was received. The stage
 * returned from {@link #process()} never completes exceptionally.
 *
 * @author TreeRouter authors
 */
final class RequestProcessor
{
    private static final System.Logger LOG
            = System.getLogger(RequestProcessor.class.getPackageName());

    private static final CompletionStage<Void> COMPLETED = completedStage(null);

    /**
     * The lifecycle of a request.
     */
    enum State {
        /** The request has been received. */
        RECEIVED,
        /** Before-actions are executing. */
        MIDDLEWARE,
        /** The route is being looked up. */
        ROUTE_MATCH,
        /** Path parameters are being bound. */
        PARAM_BIND,
        /** A payload route reads and parses the request body. */
        BODY_PARSE,
        /** The request handler is executing. */
        HANDLER_EXEC,
        /** No route was found. */
        NOT_FOUND,
        /** Processing failed. */
        ERROR,
        /** The application's error handler is executing. */
        CUSTOM_ERROR_HANDLER,
        /** The default error response is written. */
        DEFAULT_500,
        /** Processing has ended. */
        RESPONSE_SENT
    }

    private final RouteTree tree;
    private final List<BeforeAction> actions;
    private final RequestHandler notFound;
    private final ErrorHandler onError;
    private final RawRequest raw;
    private final ClientChannel ch;
    private volatile State state;
    // The request last handed to application code
    private volatile DefaultRequest current;

    /**
     * Constructs a {@code RequestProcessor}.
     *
     * @param tree route tree (never mutated)
     * @param actions before-actions (effectively immutable)
     * @param notFound not-found handler (may be {@code null})
     * @param onError error handler (may be {@code null})
     * @param raw request
     * @param ch channel
     */
    RequestProcessor(
            RouteTree tree,
            List<BeforeAction> actions,
            RequestHandler notFound,
            ErrorHandler onError,
            RawRequest raw,
            ClientChannel ch)
    {
        this.tree     = tree;
        this.actions  = actions;
        this.notFound = notFound;
        this.onError  = onError;
        this.raw      = raw;
        this.ch       = ch;
        this.state    = null;
        this.current  = null;
    }

    /**
     * Returns the current state.
     *
     * @return the current state ({@code null} if processing has not started)
     */
    State state() {
        return state;
    }

    /**
     * Process the request.
     *
     * @return a stage that completes when processing has ended
     */
    CompletionStage<Void> process() {
        transition(State.RECEIVED);
        return COMPLETED
                .thenCompose(nil -> {
                    current = DefaultRequest.requestWithoutParams(raw);
                    transition(State.MIDDLEWARE);
                    return new InvocationChain(actions).execute(current, ch);
                })
                .thenCompose(nil -> route())
                .handle((nil, thr) -> thr == null ? COMPLETED : handleError(unwrap(thr)))
                .thenCompose(identity())
                .exceptionally(thr -> {
                    LOG.log(ERROR, "Unexpected failure while processing " + describe() + ".", thr);
                    return null;
                })
                .whenComplete((nil, thr) -> transition(State.RESPONSE_SENT));
    }

    private CompletionStage<Void> route() {
        if (ch.wroteFinal() || !ch.isOpen()) {
            LOG.log(DEBUG, () -> "Exchange ended by a before-action, " +
                                 "not looking up a route for " + describe() + ".");
            return COMPLETED;
        }
        transition(State.ROUTE_MATCH);
        final RouteMatch m;
        try {
            m = tree.find(raw.method(), current.path());
        } catch (NoRouteFoundException e) {
            transition(State.NOT_FOUND);
            if (notFound == null) {
                ch.write(Responses.notFound());
                return COMPLETED;
            }
            return invoke(notFound);
        }
        transition(State.PARAM_BIND);
        current = current.withParams(m.params());
        transition(m.handler() instanceof JsonBodyHandler ?
                State.BODY_PARSE : State.HANDLER_EXEC);
        return invoke(m.handler());
    }

    private CompletionStage<Void> invoke(RequestHandler h) {
        final CompletionStage<Void> s;
        try {
            s = h.handle(current, ch);
        } catch (Exception e) {
            return failedStage(e);
        }
        return s != null ? s : failedStage(new NullPointerException(
                "Request handler returned null: " + h));
    }

    private CompletionStage<Void> handleError(Throwable thr) {
        transition(State.ERROR);
        LOG.log(ERROR, "Internal Server Error: " + describe(), thr);
        if (onError == null || current == null) {
            transition(State.DEFAULT_500);
            writeDefault();
            return COMPLETED;
        }
        transition(State.CUSTOM_ERROR_HANDLER);
        CompletionStage<Void> s;
        try {
            s = onError.apply(thr, current, ch);
            if (s == null) {
                s = failedStage(new NullPointerException("Error handler returned null."));
            }
        } catch (Exception e) {
            s = failedStage(e);
        }
        return s.handle((nil, t) -> {
            if (t != null) {
                LOG.log(ERROR, "Error handler failed.", unwrap(t));
                transition(State.DEFAULT_500);
                writeDefault();
            }
            return null;
        });
    }

    private void writeDefault() {
        if (ch.wroteFinal() || !ch.isOpen()) {
            LOG.log(DEBUG, "Response already written or channel closed, no default response.");
            return;
        }
        try {
            ch.write(Responses.internalServerError());
        } catch (ResponseRejectedException e) {
            LOG.log(DEBUG, "Default response rejected: " + e.reason());
        }
    }

    private void transition(State next) {
        State prev = state;
        state = next;
        LOG.log(DEBUG, () -> describe() + ": " + prev + " -> " + next);
    }

    private String describe() {
        return raw.method() + " " + raw.target();
    }

    private static Throwable unwrap(Throwable thr) {
        return thr instanceof CompletionException && thr.getCause() != null ?
                thr.getCause() : thr;
    }
}
