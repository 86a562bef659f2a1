package alpha.treerouter.handler;

import alpha.treerouter.message.Response;

/**
 * The response side of an HTTP exchange.<p>
 *
 * Exactly one response is written per request. The first call to
 * {@link #write(Response)} hands the response to the transport, any
 * subsequent call is rejected with a {@link ResponseRejectedException}. The
 * router uses {@link #wroteFinal()} to decide if a fallback response still
 * needs to be written after a failure.<p>
 *
 * {@link #close()} terminates the underlying connection abruptly, without a
 * response. A payload route does this when a client sends more bytes than
 * allowed. The application should normally have no need to close the
 * channel.<p>
 *
 * None of the methods in this interface throws {@code IOException}, although
 * the underlying transport may. It is assumed that there is nothing the
 * application can or would like to do about the exception, hence the
 * exception is logged by the implementation and then ignored.<p>
 *
 * The implementation must be thread-safe.
 *
 * @author TreeRouter authors
 */
public interface ClientChannel
{
    /**
     * Writes the final response of the exchange.
     *
     * @param response to write
     *
     * @throws NullPointerException
     *             if {@code response} is {@code null}
     * @throws ResponseRejectedException
     *             if a response has already been written, or
     *             if the channel is closed
     */
    void write(Response response);

    /**
     * Returns {@code true} if a response has been written.
     *
     * @return {@code true} if a response has been written
     */
    boolean wroteFinal();

    /**
     * Abruptly terminates the connection.<p>
     *
     * This method is NOP if the channel is already closed.
     */
    void close();

    /**
     * Returns {@code true} if the channel has not been {@link #close() closed}.
     *
     * @return {@code true} if the channel is open
     */
    boolean isOpen();
}
