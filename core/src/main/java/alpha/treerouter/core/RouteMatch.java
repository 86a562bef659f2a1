package alpha.treerouter.core;

import alpha.treerouter.handler.RequestHandler;

import java.util.Map;

/**
 * The result of a successful route lookup.
 *
 * @param handler matched
 * @param params capture name to raw request path segment (unmodifiable)
 *
 * @author TreeRouter authors
 */
record RouteMatch(RequestHandler handler, Map<String, String> params) {
    // Empty
}
