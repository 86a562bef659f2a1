package alpha.treerouter.testutil;

import alpha.treerouter.handler.ClientChannel;
import alpha.treerouter.handler.ResponseRejectedException;
import alpha.treerouter.message.Response;

import static alpha.treerouter.handler.ResponseRejectedException.Reason.ALREADY_RESPONDED;
import static alpha.treerouter.handler.ResponseRejectedException.Reason.CHANNEL_CLOSED;
import static java.util.Objects.requireNonNull;

/**
 * An in-memory {@link ClientChannel} that records the written response.
 *
 * @author TreeRouter authors
 */
public final class TestChannel implements ClientChannel
{
    private Response response;
    private boolean closed;
    private int rejected;

    @Override
    public synchronized void write(Response response) {
        requireNonNull(response);
        if (this.response != null) {
            ++rejected;
            throw new ResponseRejectedException(
                    response, ALREADY_RESPONDED, "Already wrote a response.");
        }
        if (closed) {
            ++rejected;
            throw new ResponseRejectedException(
                    response, CHANNEL_CLOSED, "Channel is closed.");
        }
        this.response = response;
    }

    @Override
    public synchronized boolean wroteFinal() {
        return response != null;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    @Override
    public synchronized boolean isOpen() {
        return !closed;
    }

    /**
     * Returns the written response.
     *
     * @return the written response, or {@code null} if none was written
     */
    public synchronized Response response() {
        return response;
    }

    /**
     * Returns the number of responses rejected by {@link #write(Response)}.
     *
     * @return the number of rejected responses
     */
    public synchronized int rejected() {
        return rejected;
    }
}
