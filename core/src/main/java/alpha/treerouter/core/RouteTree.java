package alpha.treerouter.core;

import alpha.treerouter.handler.RequestHandler;
import alpha.treerouter.route.NoRouteFoundException;
import alpha.treerouter.route.RouteCollisionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static alpha.treerouter.core.Segments.COLON_STR;
import static java.util.Objects.requireNonNull;

/**
 * A tree of request handlers keyed by path pattern and method.<p>
 *
 * Static segment values are keyed as-is in the parent node. A capture segment
 * lives in a dedicated child slot of the parent, and its name is stored in that
 * child. The user-provided capture names are used only when constructing the
 * {@link RouteMatch}. For example, route "/user/:id/file" with GET is stored
 * as:
 *
 * <pre>
 *   root -{@literal >} "user" -{@literal >} capture(id) -{@literal >} "file" -{@literal >} {GET: handler}
 * </pre>
 *
 * Lookup walks the tree one request path segment at a time, preferring a
 * static child over the capture child. Once a static child has been entered,
 * the lookup does not backtrack into the capture child of the same parent.
 * Consequently, given "/users/new" (GET) and "/users/:id/edit" (GET), the
 * request "GET /users/new/edit" finds no route.<p>
 *
 * This class is not thread-safe. {@link DefaultRouter} publishes copies of the
 * tree and never mutates a tree that has been published.
 *
 * @author TreeRouter authors
 */
final class RouteTree
{
    /**
     * A flattened route.
     *
     * @param method token
     * @param pattern reconstructed path pattern
     * @param handler request handler
     */
    record Entry(String method, String pattern, RequestHandler handler) {
        // Empty
    }

    private final RouteNode root;

    RouteTree() {
        this(new RouteNode());
    }

    private RouteTree(RouteNode root) {
        this.root = root;
    }

    /**
     * Registers a handler.<p>
     *
     * A handler already registered for the same method and pattern is
     * replaced.
     *
     * @param method token
     * @param pattern path pattern
     * @param handler request handler
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws alpha.treerouter.route.RoutePatternInvalidException
     *             if the pattern is invalid
     * @throws RouteCollisionException
     *             if a capture segment binds a different name than an already
     *             registered capture segment at the same position
     */
    void insert(String method, String pattern, RequestHandler handler) {
        requireNonNull(method);
        requireNonNull(handler);
        RouteNode n = root;
        for (String s : Segments.ofPattern(pattern)) {
            n = Segments.isCapture(s) ?
                    n.captureOrCreate(Segments.captureName(s)) :
                    n.nextOrCreate(s);
        }
        n.setHandler(method, handler);
    }

    /**
     * Finds the handler of a request.<p>
     *
     * The returned match binds each capture name walked to the raw (not
     * decoded) request path segment.
     *
     * @param method token
     * @param path request path (no query)
     *
     * @return the match (never {@code null})
     *
     * @throws NoRouteFoundException
     *             if no handler is registered for the method and path
     */
    RouteMatch find(String method, String path) {
        List<String> segments = Segments.ofPath(path);
        if (segments == null) {
            throw new NoRouteFoundException(method, path);
        }
        Map<String, String> params = null;
        RouteNode n = root;
        for (String s : segments) {
            RouteNode c = n.next(s);
            if (c == null) {
                c = n.capture();
                if (c == null) {
                    throw new NoRouteFoundException(method, path);
                }
                if (params == null) {
                    params = new HashMap<>();
                }
                params.put(c.captureName(), s);
            }
            n = c;
        }
        RequestHandler h = n.handler(method);
        if (h == null) {
            throw new NoRouteFoundException(method, path);
        }
        return new RouteMatch(h, params == null ? Map.of() : Map.copyOf(params));
    }

    /**
     * Merges all routes of another tree into this tree.<p>
     *
     * Where both trees register a handler for the same method and pattern, the
     * handler of the other tree wins. The other tree is not modified and no
     * node is shared between the two trees afterwards.<p>
     *
     * This method is not atomic. If it throws, this tree may be partially
     * merged.
     *
     * @param other tree
     *
     * @throws RouteCollisionException
     *             if the trees bind different capture names at the same
     *             position
     */
    void merge(RouteTree other) {
        merge(root, other.root);
    }

    private static void merge(RouteNode into, RouteNode from) {
        from.handlers().forEach(into::setHandler);
        from.children().forEach((k, v) -> merge(into.nextOrCreate(k), v));
        RouteNode c = from.capture();
        if (c != null) {
            merge(into.captureOrCreate(c.captureName()), c);
        }
    }

    /**
     * Merges all routes of another tree into this tree, under a prefix.<p>
     *
     * A handler of the other tree registered at pattern P is registered in
     * this tree at {@code prefix + P}. The root of the other tree lands on the
     * prefix itself. A trailing slash of the prefix is ignored, so "/api" and
     * "/api/" are equivalent. The prefix may contain capture segments.
     *
     * @param prefix path pattern
     * @param other tree
     *
     * @throws alpha.treerouter.route.RoutePatternInvalidException
     *             if the prefix is invalid
     * @throws RouteCollisionException
     *             on capture name collision
     */
    void nest(String prefix, RouteTree other) {
        Segments.ofPattern(prefix);
        String p = prefix.endsWith("/") ?
                prefix.substring(0, prefix.length() - 1) : prefix;
        RouteTree scratch = new RouteTree();
        for (Entry e : other.flatten(p)) {
            scratch.insert(e.method(), e.pattern(), e.handler());
        }
        merge(scratch);
    }

    /**
     * Returns all routes of this tree as a list of entries.<p>
     *
     * The entry pattern is reconstructed from the node positions and includes
     * the original capture names.
     *
     * @param prefix to prepend to each pattern (empty for none)
     *
     * @return all routes (modifiable)
     */
    List<Entry> flatten(String prefix) {
        List<Entry> l = new ArrayList<>();
        flatten(root, prefix, l);
        return l;
    }

    private static void flatten(RouteNode n, String path, List<Entry> sink) {
        String pattern = path.isEmpty() ? "/" : path;
        n.handlers().forEach((m, h) -> sink.add(new Entry(m, pattern, h)));
        n.children().forEach((k, v) -> flatten(v, path + "/" + k, sink));
        RouteNode c = n.capture();
        if (c != null) {
            flatten(c, path + "/" + COLON_STR + c.captureName(), sink);
        }
    }

    /**
     * Returns a map of path pattern to the methods registered at the pattern.
     *
     * @return all routes (sorted by pattern, then method)
     */
    Map<String, Set<String>> toMap() {
        Map<String, Set<String>> m = new TreeMap<>();
        for (Entry e : flatten("")) {
            m.computeIfAbsent(e.pattern(), k -> new TreeSet<>()).add(e.method());
        }
        return m;
    }

    /**
     * Deep copies this tree. The handlers are shared.
     *
     * @return a copy
     */
    RouteTree copy() {
        return new RouteTree(root.copy());
    }

    /**
     * Renders the tree for humans.
     *
     * @return the tree
     *
     * @see alpha.treerouter.Router#describe()
     */
    String describe() {
        StringBuilder b = new StringBuilder("/\n");
        describe(root, 1, b);
        return b.toString();
    }

    private static void describe(RouteNode n, int depth, StringBuilder sink) {
        String indent = "    ".repeat(depth - 1) + "  ";
        n.handlers().forEach((m, h) ->
                sink.append(indent).append('[').append(m).append("] -> ")
                    .append(nameOf(h)).append('\n'));
        n.children().forEach((k, v) -> {
            sink.append(indent).append("├─ ").append(k).append('\n');
            describe(v, depth + 1, sink);
        });
        RouteNode c = n.capture();
        if (c != null) {
            sink.append(indent).append("├─ ").append(COLON_STR)
                .append(c.captureName()).append('\n');
            describe(c, depth + 1, sink);
        }
    }

    private static String nameOf(RequestHandler h) {
        String str = h.toString();
        if (str.indexOf('@') == -1) {
            // Custom toString()
            return str;
        }
        Class<?> type = h.getClass();
        return type.isSynthetic() || type.isAnonymousClass() ||
               type.getName().contains("$$Lambda") ?
                    "<lambda>" : type.getSimpleName();
    }
}
