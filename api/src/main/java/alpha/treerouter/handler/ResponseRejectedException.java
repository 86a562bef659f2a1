package alpha.treerouter.handler;

import alpha.treerouter.message.Response;

import static java.util.Objects.requireNonNull;

/**
 * A response has been rejected for writing.<p>
 *
 * Is thrown by {@link ClientChannel#write(Response)} if a response is rejected
 * for a {@link #reason()}.
 *
 * @author TreeRouter authors
 */
public class ResponseRejectedException extends RuntimeException
{
    /**
     * The reason why a response was rejected.
     */
    public enum Reason {
        /**
         * A final response has already been written.
         */
        ALREADY_RESPONDED,

        /**
         * The channel was closed.
         */
        CHANNEL_CLOSED;
    }

    private static final long serialVersionUID = 1L;

    private final transient Response rejected;
    private final Reason reason;

    /**
     * Constructs a {@code ResponseRejectedException}.
     *
     * @param rejected response
     * @param reason why
     * @param message passed through as-is to {@link Throwable#Throwable(String)}
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public ResponseRejectedException(Response rejected, Reason reason, String message) {
        super(message);
        this.rejected = requireNonNull(rejected);
        this.reason   = requireNonNull(reason);
    }

    /**
     * Returns the rejected response.
     *
     * @return the rejected response (never {@code null})
     */
    public Response rejected() {
        return rejected;
    }

    /**
     * Returns the reason why the response was rejected.
     *
     * @return the reason why the response was rejected (never {@code null})
     */
    public Reason reason() {
        return reason;
    }
}
