package alpha.treerouter.route;

import alpha.treerouter.Config;
import alpha.treerouter.Router;
import alpha.treerouter.handler.PayloadHandler;
import alpha.treerouter.handler.RequestHandler;
import com.google.gson.JsonElement;

import static alpha.treerouter.HttpConstants.Method.DELETE;
import static alpha.treerouter.HttpConstants.Method.GET;
import static alpha.treerouter.HttpConstants.Method.PATCH;
import static alpha.treerouter.HttpConstants.Method.POST;
import static alpha.treerouter.HttpConstants.Method.PUT;

/**
 * Registry of request handlers keyed by method and path pattern. Also known in
 * other corners of the internet as a "router".<p>
 *
 * <h2>Path patterns</h2>
 *
 * A pattern is a sequence of segments separated by a forward slash. The pattern
 * must start with a forward slash, and the pattern "/" denotes the root. A
 * segment that starts with a colon is a capture segment. It matches any
 * single request path segment, and binds the segment's value to the name
 * following the colon:
 *
 * <pre>
 *   router.get("/user/:id", handler);
 *   // GET /user/123 -{@literal >} request.parameters().path("id") = "123"
 * </pre>
 *
 * There is no catch-all segment.
 *
 * <h2>Matching</h2>
 *
 * The request path is matched one segment at a time. At each level, a static
 * segment always takes precedence over a capture segment, and once a branch
 * has been chosen it is never abandoned. Given the routes "/a/b/c" and
 * "/a/:x/d", the request path "/a/b/d" does not match; "b" selects the static
 * branch, which has no "d". The path "/a/z/d" does match the capture
 * branch.<p>
 *
 * A request matches only if a handler is registered for the request's exact
 * method at the matched position. A missing path and a missing method are
 * treated the same; both end up in the router's not-found handler.
 *
 * <h2>Registration</h2>
 *
 * Registering a handler for a method and pattern that already has one replaces
 * the old handler. A hierarchical position holds at most one capture segment;
 * all patterns using a capture segment at the same position must use the
 * same name, or else a {@link RouteCollisionException} is thrown.<p>
 *
 * Registration is expected to take place before the router is serving
 * requests, although the implementation is thread-safe and changes become
 * visible atomically, one registration at a time.
 *
 * @author TreeRouter authors
 */
public interface RouteRegistry
{
    /**
     * Registers a request handler.
     *
     * @param method token, e.g. "GET"
     * @param pattern path pattern
     * @param handler request handler
     *
     * @return the router (for chaining/fluency)
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RoutePatternInvalidException
     *             if the pattern does not start with a forward slash, or
     *             if a capture segment has no name
     * @throws RouteCollisionException
     *             if a capture segment clashes with an already registered
     *             capture segment of a different name
     */
    Router add(String method, String pattern, RequestHandler handler);

    /**
     * Registers a payload handler.<p>
     *
     * The given handler is wrapped in a request handler that accepts only
     * requests whose Content-Type starts with "application/json" (else 415),
     * whose declared Content-Length, if present, does not exceed the
     * {@linkplain Config#maxRequestBodySize() configured limit} (else 413), and
     * whose body is well-formed JSON (else 400). If the client sends more
     * bytes than the limit without declaring it, the connection is closed.
     * The body is bound to the given type using Gson; pass
     * {@code JsonElement.class} to receive the JSON tree as-is.
     *
     * @param method token
     * @param pattern path pattern
     * @param type of body
     * @param handler payload handler
     * @param <T> type of body
     *
     * @return the router (for chaining/fluency)
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RoutePatternInvalidException
     *             see {@link #add(String, String, RequestHandler)}
     * @throws RouteCollisionException
     *             see {@link #add(String, String, RequestHandler)}
     */
    <T> Router payload(String method, String pattern, Class<T> type, PayloadHandler<T> handler);

    /**
     * Registers a payload handler with a custom body size limit.
     *
     * @param method token
     * @param pattern path pattern
     * @param type of body
     * @param maxBodySize max number of body bytes
     * @param handler payload handler
     * @param <T> type of body
     *
     * @return the router (for chaining/fluency)
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code maxBodySize} is negative
     * @throws RoutePatternInvalidException
     *             see {@link #add(String, String, RequestHandler)}
     * @throws RouteCollisionException
     *             see {@link #add(String, String, RequestHandler)}
     *
     * @see #payload(String, String, Class, PayloadHandler)
     */
    <T> Router payload(String method, String pattern, Class<T> type, long maxBodySize, PayloadHandler<T> handler);

    /**
     * Registers a GET handler.
     *
     * @param pattern path pattern
     * @param handler request handler
     * @return the router (for chaining/fluency)
     * @see #add(String, String, RequestHandler)
     */
    default Router get(String pattern, RequestHandler handler) {
        return add(GET, pattern, handler);
    }

    /**
     * Registers a PUT handler.<p>
     *
     * The request body is not processed by the router. To have the body
     * parsed, use {@link #payload(String, String, Class, PayloadHandler)}.
     *
     * @param pattern path pattern
     * @param handler request handler
     * @return the router (for chaining/fluency)
     * @see #add(String, String, RequestHandler)
     */
    default Router put(String pattern, RequestHandler handler) {
        return add(PUT, pattern, handler);
    }

    /**
     * Registers a DELETE handler.
     *
     * @param pattern path pattern
     * @param handler request handler
     * @return the router (for chaining/fluency)
     * @see #add(String, String, RequestHandler)
     */
    default Router delete(String pattern, RequestHandler handler) {
        return add(DELETE, pattern, handler);
    }

    /**
     * Registers a PATCH handler.<p>
     *
     * The request body is not processed by the router. To have the body
     * parsed, use {@link #payload(String, String, Class, PayloadHandler)}.
     *
     * @param pattern path pattern
     * @param handler request handler
     * @return the router (for chaining/fluency)
     * @see #add(String, String, RequestHandler)
     */
    default Router patch(String pattern, RequestHandler handler) {
        return add(PATCH, pattern, handler);
    }

    /**
     * Registers a POST handler receiving the JSON body.
     *
     * @param pattern path pattern
     * @param handler payload handler
     * @return the router (for chaining/fluency)
     * @see #payload(String, String, Class, PayloadHandler)
     */
    default Router post(String pattern, PayloadHandler<JsonElement> handler) {
        return payload(POST, pattern, JsonElement.class, handler);
    }

    /**
     * Registers a POST handler receiving the JSON body, with a custom body
     * size limit.
     *
     * @param pattern path pattern
     * @param handler payload handler
     * @param maxBodySize max number of body bytes
     * @return the router (for chaining/fluency)
     * @see #payload(String, String, Class, long, PayloadHandler)
     */
    default Router post(String pattern, PayloadHandler<JsonElement> handler, long maxBodySize) {
        return payload(POST, pattern, JsonElement.class, maxBodySize, handler);
    }

    /**
     * Registers a POST handler receiving the JSON body bound to a Java type.
     *
     * @param pattern path pattern
     * @param type of body
     * @param handler payload handler
     * @param <T> type of body
     * @return the router (for chaining/fluency)
     * @see #payload(String, String, Class, PayloadHandler)
     */
    default <T> Router post(String pattern, Class<T> type, PayloadHandler<T> handler) {
        return payload(POST, pattern, type, handler);
    }

    /**
     * Merges all routes of the given router into this router.<p>
     *
     * For every method and position registered in {@code other}, the handler
     * of {@code other} replaces the handler of this router, if any. Routes of
     * this router that {@code other} does not have are left intact.<p>
     *
     * The given router is not modified and remains independently usable; the
     * two routers share no state after the merge. Only the routes are merged,
     * not before-actions, not the not-found handler, nor the error handler.
     *
     * @param other router
     *
     * @return this router (for chaining/fluency)
     *
     * @throws NullPointerException
     *             if {@code other} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code other} is not created by {@link Router#create()}
     * @throws RouteCollisionException
     *             if a capture segment of {@code other} clashes with a capture
     *             segment of this router
     */
    Router merge(Router other);

    /**
     * Registers all routes of the given router under a prefix.<p>
     *
     * For example, if {@code other} has "GET /items/:id", then after
     * {@code nest("/api", other)}, this router has "GET /api/items/:id".
     * The root route "/" of {@code other} is registered as the prefix itself.
     * A trailing forward slash of the prefix is ignored, and the prefix "/"
     * is equivalent to {@link #merge(Router)}.<p>
     *
     * The given router is not modified and remains independently usable.
     *
     * @param prefix path pattern prefix (may contain capture segments)
     * @param other router
     *
     * @return this router (for chaining/fluency)
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code other} is not created by {@link Router#create()}
     * @throws RoutePatternInvalidException
     *             if the prefix is not a valid pattern
     * @throws RouteCollisionException
     *             if a capture segment clashes
     */
    Router nest(String prefix, Router other);
}
