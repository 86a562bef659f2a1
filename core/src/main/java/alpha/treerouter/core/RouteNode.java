package alpha.treerouter.core;

import alpha.treerouter.handler.RequestHandler;
import alpha.treerouter.route.RouteCollisionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the {@link RouteTree}.<p>
 *
 * No node stores its key. Instead, the node's position in the tree defines the
 * path pattern that leads to it. A node holds the request handlers registered
 * for that position keyed by method token, its static children keyed by
 * segment value, and at most one capture child. The name bound by the capture
 * child is stored in the child itself.<p>
 *
 * This class is not thread-safe; see {@link DefaultRouter} for how the tree is
 * published.
 *
 * @author TreeRouter authors
 */
final class RouteNode
{
    private final Map<String, RequestHandler> handlers;
    private final Map<String, RouteNode> children;
    private final String captureName;
    private RouteNode capture;

    RouteNode() {
        this(null);
    }

    private RouteNode(String captureName) {
        this.handlers    = new LinkedHashMap<>();
        this.children    = new LinkedHashMap<>();
        this.captureName = captureName;
        this.capture     = null;
    }

    /**
     * Returns the handler registered for the given method.
     *
     * @param method token
     *
     * @return the handler, or {@code null} if none is registered
     */
    RequestHandler handler(String method) {
        return handlers.get(method);
    }

    /**
     * Registers a handler, replacing any handler previously registered for the
     * same method.
     *
     * @param method token
     * @param handler to register
     */
    void setHandler(String method, RequestHandler handler) {
        handlers.put(method, handler);
    }

    Map<String, RequestHandler> handlers() {
        return Collections.unmodifiableMap(handlers);
    }

    /**
     * Traverse to a static child node.
     *
     * @param segment value
     *
     * @return the child node or {@code null} if it does not exist
     */
    RouteNode next(String segment) {
        return children.get(segment);
    }

    /**
     * Traverse to a static child node, creating the child if it does not
     * exist.
     *
     * @param segment value
     *
     * @return the child node (never {@code null})
     */
    RouteNode nextOrCreate(String segment) {
        return children.computeIfAbsent(segment, ignored -> new RouteNode());
    }

    Map<String, RouteNode> children() {
        return Collections.unmodifiableMap(children);
    }

    /**
     * Returns the capture child.
     *
     * @return the capture child, or {@code null} if it does not exist
     */
    RouteNode capture() {
        return capture;
    }

    /**
     * Returns the capture child, creating it if it does not exist.
     *
     * @param name of the capture segment
     *
     * @return the capture child (never {@code null})
     *
     * @throws RouteCollisionException
     *             if the capture child exists and binds a different name
     */
    RouteNode captureOrCreate(String name) {
        if (capture == null) {
            capture = new RouteNode(name);
        } else if (!capture.captureName.equals(name)) {
            throw new RouteCollisionException(
                    "Capture segment \":" + name + "\" collides with the already " +
                    "registered capture segment \":" + capture.captureName +
                    "\" at the same hierarchical position.");
        }
        return capture;
    }

    /**
     * Returns the name bound by this node, if this node is a capture child.
     *
     * @return the name, or {@code null} if this node is not a capture child
     */
    String captureName() {
        return captureName;
    }

    /**
     * Deep copies this node and all its descendants. The handlers are shared.
     *
     * @return a copy
     */
    RouteNode copy() {
        RouteNode c = new RouteNode(captureName);
        c.handlers.putAll(handlers);
        children.forEach((k, v) -> c.children.put(k, v.copy()));
        c.capture = capture == null ? null : capture.copy();
        return c;
    }
}
