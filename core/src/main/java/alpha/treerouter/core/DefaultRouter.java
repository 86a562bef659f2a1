package alpha.treerouter.core;

import alpha.treerouter.Config;
import alpha.treerouter.Router;
import alpha.treerouter.action.BeforeAction;
import alpha.treerouter.handler.ClientChannel;
import alpha.treerouter.handler.ErrorHandler;
import alpha.treerouter.handler.PayloadHandler;
import alpha.treerouter.handler.RequestHandler;
import alpha.treerouter.message.RawRequest;
import com.google.gson.Gson;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Router}.<p>
 *
 * The route tree is copy-on-write. A registration is serialized with other
 * registrations, applied to a private copy of the current tree, and the copy
 * is then published. A request processes against the tree that was published
 * when the request was dispatched and never observes a partially applied
 * registration. A registration that fails leaves the published tree
 * untouched.
 *
 * @author TreeRouter authors
 */
final class DefaultRouter implements Router
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouter.class.getPackageName());

    private static final Gson GSON = new Gson();

    private final Config config;
    private final Object lock;
    private volatile RouteTree tree;
    private final List<BeforeAction> actions;
    private volatile RequestHandler notFound;
    private volatile ErrorHandler onError;

    DefaultRouter(Config config) {
        this.config   = requireNonNull(config);
        this.lock     = new Object();
        this.tree     = new RouteTree();
        this.actions  = new CopyOnWriteArrayList<>();
        this.notFound = null;
        this.onError  = null;
    }

    @Override
    public Config getConfig() {
        return config;
    }

    @Override
    public Router add(String method, String pattern, RequestHandler handler) {
        requireNonNull(method);
        requireNonNull(pattern);
        requireNonNull(handler);
        mutate(t -> t.insert(method, pattern, handler));
        LOG.log(DEBUG, () -> "Added route " + method + " " + pattern + " -> " + handler);
        return this;
    }

    @Override
    public <T> Router payload(
            String method, String pattern, Class<T> type, PayloadHandler<T> handler) {
        return payload(method, pattern, type, config.maxRequestBodySize(), handler);
    }

    @Override
    public <T> Router payload(
            String method, String pattern, Class<T> type, long maxBodySize, PayloadHandler<T> handler) {
        requireNonNull(type);
        return add(method, pattern, new JsonBodyHandler<>(GSON, type, maxBodySize, handler));
    }

    @Override
    public Router merge(Router other) {
        RouteTree src = treeOf(other);
        mutate(t -> t.merge(src));
        LOG.log(DEBUG, () -> "Merged " + other);
        return this;
    }

    @Override
    public Router nest(String prefix, Router other) {
        requireNonNull(prefix);
        RouteTree src = treeOf(other);
        mutate(t -> t.nest(prefix, src));
        LOG.log(DEBUG, () -> "Nested " + other + " under \"" + prefix + "\"");
        return this;
    }

    private static RouteTree treeOf(Router other) {
        requireNonNull(other);
        if (!(other instanceof DefaultRouter r)) {
            throw new IllegalArgumentException(
                    "Router implementation not supported: " + other.getClass().getName());
        }
        // A published tree is never mutated
        return r.tree;
    }

    private void mutate(Consumer<RouteTree> op) {
        synchronized (lock) {
            RouteTree copy = tree.copy();
            op.accept(copy);
            tree = copy;
        }
    }

    @Override
    public Router before(BeforeAction action) {
        actions.add(requireNonNull(action));
        return this;
    }

    @Override
    public Router notFound(RequestHandler handler) {
        notFound = requireNonNull(handler);
        return this;
    }

    @Override
    public Router onError(ErrorHandler handler) {
        onError = requireNonNull(handler);
        return this;
    }

    @Override
    public CompletionStage<Void> dispatch(RawRequest request, ClientChannel channel) {
        requireNonNull(request);
        requireNonNull(channel);
        return new RequestProcessor(
                tree, List.copyOf(actions), notFound, onError, request, channel)
                .process();
    }

    @Override
    public String describe() {
        return tree.describe();
    }

    /**
     * Returns the currently published route tree.
     *
     * @return the currently published route tree
     */
    RouteTree tree() {
        return tree;
    }

    @Override
    public String toString() {
        return DefaultRouter.class.getSimpleName() + "{" +
                "routes=" + tree.toMap() + "}";
    }
}
