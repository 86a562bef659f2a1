package alpha.treerouter.testutil;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Flow;

import static java.util.Objects.requireNonNull;

/**
 * Publishes a predefined sequence of bytebuffers, optionally followed by an
 * error signal instead of a completion signal.<p>
 *
 * Items are delivered synchronously by the thread requesting them. The
 * publisher records whether its subscription was ever requested from and
 * whether it was cancelled, so tests can assert that a body was or was not
 * consumed.
 *
 * @author TreeRouter authors
 */
public final class ByteBufferPublisher implements Flow.Publisher<ByteBuffer>
{
    /**
     * Returns a publisher of the given items, which completes normally.
     *
     * @param items to publish
     *
     * @return a new publisher
     */
    public static ByteBufferPublisher of(List<ByteBuffer> items) {
        return new ByteBufferPublisher(items, null);
    }

    /**
     * Returns a publisher of the given items, which completes with an error.
     *
     * @param items to publish before the error
     * @param error to signal
     *
     * @return a new publisher
     */
    public static ByteBufferPublisher failing(List<ByteBuffer> items, Throwable error) {
        return new ByteBufferPublisher(items, requireNonNull(error));
    }

    private final List<ByteBuffer> items;
    private final Throwable error;
    private volatile boolean requested, cancelled;

    private ByteBufferPublisher(List<ByteBuffer> items, Throwable error) {
        this.items = List.copyOf(items);
        this.error = error;
    }

    /**
     * Returns {@code true} if a subscriber requested items.
     *
     * @return {@code true} if a subscriber requested items
     */
    public boolean requested() {
        return requested;
    }

    /**
     * Returns {@code true} if a subscriber cancelled its subscription.
     *
     * @return {@code true} if a subscriber cancelled its subscription
     */
    public boolean cancelled() {
        return cancelled;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super ByteBuffer> s) {
        Deque<ByteBuffer> q = new ArrayDeque<>();
        items.forEach(b -> q.add(b.duplicate()));
        s.onSubscribe(new Flow.Subscription() {
            private long demand;
            private boolean emitting, done;

            @Override
            public synchronized void request(long n) {
                requested = true;
                if (done || cancelled) {
                    return;
                }
                demand = demand + n < 0 ? Long.MAX_VALUE : demand + n;
                if (emitting) {
                    return;
                }
                emitting = true;
                try {
                    while (demand > 0 && !q.isEmpty() && !cancelled) {
                        --demand;
                        s.onNext(q.poll());
                    }
                    if (q.isEmpty() && !cancelled) {
                        done = true;
                        if (error == null) {
                            s.onComplete();
                        } else {
                            s.onError(error);
                        }
                    }
                } finally {
                    emitting = false;
                }
            }

            @Override
            public void cancel() {
                cancelled = true;
            }
        });
    }
}
