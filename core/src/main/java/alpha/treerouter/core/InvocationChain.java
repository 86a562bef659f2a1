package alpha.treerouter.core;

import alpha.treerouter.action.BeforeAction;
import alpha.treerouter.handler.ClientChannel;
import alpha.treerouter.message.Request;

import java.util.List;
import java.util.concurrent.CompletionStage;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;

/**
 * Executes before-actions, one after the other.<p>
 *
 * The next action is invoked only after the stage returned by the previous
 * action completed normally. An action that throws, or returns a stage that
 * completes exceptionally, aborts the chain and the returned stage completes
 * exceptionally with the same throwable. An action must not return
 * {@code null}; doing so fails the chain with a {@code NullPointerException}.
 *
 * @author TreeRouter authors
 */
final class InvocationChain
{
    private static final System.Logger LOG
            = System.getLogger(InvocationChain.class.getPackageName());

    private static final CompletionStage<Void> COMPLETED = completedStage(null);

    private final List<BeforeAction> actions;

    /**
     * Constructs an {@code InvocationChain}.
     *
     * @param actions to execute (effectively immutable)
     */
    InvocationChain(List<BeforeAction> actions) {
        assert actions != null;
        this.actions = actions;
    }

    /**
     * Execute all before-actions.
     *
     * @param req request
     * @param ch channel
     *
     * @return a stage that completes when all actions have completed
     */
    CompletionStage<Void> execute(Request req, ClientChannel ch) {
        CompletionStage<Void> s = COMPLETED;
        for (BeforeAction a : actions) {
            s = s.thenCompose(nil -> invoke(a, req, ch));
        }
        return s;
    }

    private static CompletionStage<Void> invoke(BeforeAction a, Request req, ClientChannel ch) {
        LOG.log(DEBUG, () -> "Invoking before-action: " + a);
        final CompletionStage<Void> s;
        try {
            s = a.apply(req, ch);
        } catch (Exception e) {
            return failedStage(e);
        }
        return s != null ? s : failedStage(new NullPointerException(
                "Before-action returned null: " + a));
    }
}
