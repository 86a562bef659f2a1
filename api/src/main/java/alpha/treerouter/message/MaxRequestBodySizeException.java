package alpha.treerouter.message;

import alpha.treerouter.Config;

/**
 * Thrown if the size of an inbound request body exceeds the maximum limit of a
 * payload route.<p>
 *
 * The exception never reaches the application's error handler; a payload
 * route answers a declared oversize with a 413 (Request Entity Too Large)
 * response and closes the connection when the received bytes exceed the
 * limit. The exception is only used to log the event.
 *
 * @author TreeRouter authors
 *
 * @see Config#maxRequestBodySize()
 */
public final class MaxRequestBodySizeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final long limit;

    /**
     * Constructs a {@code MaxRequestBodySizeException}.
     *
     * @param limit the configured maximum
     * @param observed bytes declared or received
     */
    public MaxRequestBodySizeException(long limit, long observed) {
        super("Request body size " + observed + " exceeds limit " + limit + ".");
        this.limit = limit;
    }

    /**
     * Returns the configured maximum.
     *
     * @return the configured maximum
     */
    public long limit() {
        return limit;
    }
}
