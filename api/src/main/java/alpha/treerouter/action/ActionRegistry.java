package alpha.treerouter.action;

import alpha.treerouter.Router;

/**
 * Registry of before-actions.
 *
 * @author TreeRouter authors
 */
public interface ActionRegistry
{
    /**
     * Appends an action to the pipeline executed before the request handler.
     *
     * @param action to append
     *
     * @return the router (for chaining/fluency)
     *
     * @throws NullPointerException
     *             if {@code action} is {@code null}
     */
    Router before(BeforeAction action);
}
