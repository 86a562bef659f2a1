package alpha.treerouter.route;

import alpha.treerouter.Router;
import alpha.treerouter.handler.RequestHandler;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by a route lookup if no handler is registered for the request's
 * method and path.<p>
 *
 * A missing path and a path registered without the request's method are not
 * distinguished. The router catches this exception and delegates to the
 * not-found handler, see {@link Router#notFound(RequestHandler)}.
 *
 * @author TreeRouter authors
 */
public class NoRouteFoundException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final String method, path;

    /**
     * Constructs a {@code NoRouteFoundException}.
     *
     * @param method of request
     * @param path of request
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public NoRouteFoundException(String method, String path) {
        super("No route found for " + method + " " + path + ".");
        this.method = requireNonNull(method);
        this.path = requireNonNull(path);
    }

    /**
     * Returns the request method.
     *
     * @return the request method (never {@code null})
     */
    public String method() {
        return method;
    }

    /**
     * Returns the request path.
     *
     * @return the request path (never {@code null})
     */
    public String path() {
        return path;
    }
}
