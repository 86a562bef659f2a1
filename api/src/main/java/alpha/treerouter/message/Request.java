package alpha.treerouter.message;

import alpha.treerouter.action.BeforeAction;
import alpha.treerouter.util.PercentDecoder;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Stream;

/**
 * An inbound HTTP request as seen by before-actions and request handlers.<p>
 *
 * The request path parameters are bound only after the route has been matched.
 * A {@link BeforeAction} executes before route resolution and will therefore
 * observe an empty path parameter map. Query parameters are always
 * available.<p>
 *
 * The request object is not shared across requests, but the
 * {@link #attributes() attributes} are shared by all request objects created
 * for the same HTTP exchange. This is how a before-action passes data to the
 * request handler:
 *
 * <pre>
 *   BeforeAction giveRole = (request, channel) -{@literal >} {
 *       request.attributes().put("user.role", myAuthLogic(request.headers()));
 *       return completedStage(null);
 *   };
 * </pre>
 *
 * @author TreeRouter authors
 */
public interface Request extends RawRequest
{
    /**
     * Returns the request path, that is the request-target up until but not
     * including the first question mark.<p>
     *
     * The path is not percent-decoded.
     *
     * @return the request path (never {@code null})
     */
    String path();

    /**
     * Returns the request's path and query parameters.
     *
     * @return the request's path and query parameters (never {@code null})
     */
    Parameters parameters();

    /**
     * Returns a mutable, thread-safe map of attributes shared by all
     * request objects of the same exchange.
     *
     * @return attributes (never {@code null})
     */
    ConcurrentMap<String, Object> attributes();

    /**
     * Path and query parameters.<p>
     *
     * A path parameter value is the request path segment matched by a capture
     * segment ({@code ":name"}) of the route pattern. Path parameter values are
     * percent-decoded using {@link PercentDecoder#decode(String)}; a plus
     * character is retained as-is.<p>
     *
     * Query parameters are parsed from the query component of the
     * request-target: key-value pairs separated by '&amp;' with the key
     * separated from the value by '='. A key that occurs more than once has
     * multiple values, kept in the order they appear. A key without '=' maps to
     * the empty string. Query keys and values are decoded using the
     * {@code application/x-www-form-urlencoded} rules of
     * {@link PercentDecoder#decodeForm(String)}, i.e. a plus character becomes
     * a space.
     */
    interface Parameters {
        /**
         * Returns a percent-decoded path parameter value.
         *
         * @param name of capture segment (without the leading colon)
         *
         * @return the value, or {@code null} if the route has no such parameter
         */
        String path(String name);

        /**
         * Returns a raw path parameter value.
         *
         * @param name of capture segment (without the leading colon)
         *
         * @return the value, or {@code null} if the route has no such parameter
         */
        String pathRaw(String name);

        /**
         * Returns all percent-decoded path parameters.
         *
         * @return an unmodifiable map (never {@code null})
         */
        Map<String, String> pathMap();

        /**
         * Returns the first decoded value of a query parameter.
         *
         * @param key decoded key
         *
         * @return the first value, if present
         */
        default Optional<String> queryFirst(String key) {
            return queryStream(key).findFirst();
        }

        /**
         * Returns all decoded values of a query parameter.
         *
         * @param key decoded key
         *
         * @return all values (never {@code null})
         */
        default Stream<String> queryStream(String key) {
            return queryList(key).stream();
        }

        /**
         * Returns all decoded values of a query parameter.
         *
         * @param key decoded key
         *
         * @return an unmodifiable list (never {@code null})
         */
        default List<String> queryList(String key) {
            return queryMap().getOrDefault(key, List.of());
        }

        /**
         * Returns all decoded query parameters.<p>
         *
         * The iteration order of the map is the order in which the keys first
         * appeared in the query.
         *
         * @return an unmodifiable map (never {@code null})
         */
        Map<String, List<String>> queryMap();
    }
}
