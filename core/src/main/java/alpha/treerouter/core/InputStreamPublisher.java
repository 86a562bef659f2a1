package alpha.treerouter.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Publishes the bytes of an {@code InputStream} as bytebuffers.<p>
 *
 * The stream is read by the thread requesting items, in chunks of at most
 * {@value #CHUNK_SIZE} bytes, and each chunk is published as a new bytebuffer.
 * Only one subscriber is accepted; a second subscriber is signalled an
 * {@code IllegalStateException}. The publisher never closes the stream.
 *
 * @author TreeRouter authors
 */
final class InputStreamPublisher implements Flow.Publisher<ByteBuffer>
{
    private static final System.Logger LOG
            = System.getLogger(InputStreamPublisher.class.getPackageName());

    static final int CHUNK_SIZE = 8 * 1_024;

    private final InputStream in;
    private final AtomicBoolean subscribed;

    InputStreamPublisher(InputStream in) {
        this.in = requireNonNull(in);
        this.subscribed = new AtomicBoolean();
    }

    @Override
    public void subscribe(Flow.Subscriber<? super ByteBuffer> subscriber) {
        requireNonNull(subscriber);
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override public void request(long n) { }
                @Override public void cancel() { }
            });
            subscriber.onError(new IllegalStateException(
                    "Publisher accepts only one subscriber."));
            return;
        }
        subscriber.onSubscribe(new StreamSubscription(subscriber));
    }

    private final class StreamSubscription implements Flow.Subscription {
        private final Flow.Subscriber<? super ByteBuffer> s;
        private long demand;
        private boolean emitting, done;
        private volatile boolean cancelled;

        StreamSubscription(Flow.Subscriber<? super ByteBuffer> s) {
            this.s = s;
        }

        @Override
        public synchronized void request(long n) {
            if (done || cancelled) {
                return;
            }
            if (n <= 0) {
                done = true;
                s.onError(new IllegalArgumentException("Non-positive request: " + n));
                return;
            }
            demand = demand + n < 0 ? Long.MAX_VALUE : demand + n;
            if (emitting) {
                // Reentrant call from onNext, the loop below picks up the demand
                return;
            }
            emitting = true;
            try {
                drain();
            } finally {
                emitting = false;
            }
        }

        private void drain() {
            while (demand > 0 && !done && !cancelled) {
                final byte[] buf = new byte[CHUNK_SIZE];
                final int r;
                try {
                    r = in.read(buf);
                } catch (IOException e) {
                    done = true;
                    s.onError(e);
                    return;
                }
                if (r == -1) {
                    done = true;
                    s.onComplete();
                } else if (r > 0) {
                    --demand;
                    s.onNext(ByteBuffer.wrap(buf, 0, r));
                }
            }
        }

        @Override
        public void cancel() {
            cancelled = true;
            LOG.log(DEBUG, "Subscription cancelled.");
        }
    }
}
