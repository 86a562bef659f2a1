package alpha.treerouter.action;

import alpha.treerouter.handler.ClientChannel;
import alpha.treerouter.handler.ErrorHandler;
import alpha.treerouter.message.Request;

import java.util.concurrent.CompletionStage;

/**
 * Is an action executed before the request handler.<p>
 *
 * Before-actions execute for every request dispatched to the router, in the
 * order they were registered, before the router attempts to resolve the
 * request handler. This means that the actions are called even if the route
 * turns out to not exist.<p>
 *
 * Before-actions are useful to implement cross-cutting concerns such as
 * authentication, rate-limiting, collecting metrics, and so on.
 *
 * <pre>
 *   BeforeAction giveRole = (request, channel) -{@literal >} {
 *       String role = myAuthLogic(request.headers());
 *       request.attributes().put("user.role", role);
 *       return completedStage(null);
 *   };
 *   router.before(giveRole);
 * </pre>
 *
 * The action signals that it is done by completing the returned stage. An
 * action that performs asynchronous work returns the stage of that work, and
 * the next action (or the request handler) will not be invoked until the stage
 * has completed.<p>
 *
 * There is no way for an action to skip the rest of the chain other than to
 * fail. An exception thrown from the action, or a stage that completes
 * exceptionally, aborts the remaining actions and the failure is handed off to
 * the {@link ErrorHandler}. The route is then never resolved.<p>
 *
 * An action is known in other corners of the internet as a "filter" or a
 * "middleware".<p>
 *
 * The action may be called concurrently and must be thread-safe.<p>
 *
 * No argument passed to the action will be {@code null}.
 *
 * @author TreeRouter authors
 *
 * @see ActionRegistry
 */
@FunctionalInterface
public interface BeforeAction
{
    /**
     * Executes the action.
     *
     * @param request the request
     * @param channel the channel
     *
     * @return a stage that completes when the action is done
     *         (must not be {@code null})
     *
     * @throws Exception if the action fails
     */
    CompletionStage<Void> apply(Request request, ClientChannel channel) throws Exception;
}
