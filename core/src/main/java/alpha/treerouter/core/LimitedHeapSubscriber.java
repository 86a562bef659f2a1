package alpha.treerouter.core;

import alpha.treerouter.message.MaxRequestBodySizeException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;
import java.util.function.BiFunction;

import static java.lang.Long.MAX_VALUE;
import static java.lang.System.Logger.Level.DEBUG;

/**
 * A subscriber that collects all bytes in bytebuffers into an expanding
 * {@code byte[]} then {@code onComplete} calls a {@code BiFunction}-finisher
 * with the array together with a valid count of bytes that can be safely read
 * in order to produce the final result, exposed through a
 * {@code CompletionStage}.<p>
 *
 * The subscriber enforces a hard cap on the number of bytes collected. As soon
 * as the cap is exceeded, the subscription is cancelled and the result stage
 * completes exceptionally with a {@link MaxRequestBodySizeException}. An error
 * signalled by the publisher completes the result stage exceptionally with
 * that error.
 *
 * @param <R> type of result
 *
 * @author TreeRouter authors
 */
final class LimitedHeapSubscriber<R> implements Flow.Subscriber<ByteBuffer>
{
    private static final System.Logger LOG
            = System.getLogger(LimitedHeapSubscriber.class.getPackageName());

    private static final byte[] EMPTY = new byte[0];

    private final long maxBytes;
    private final BiFunction<byte[], Integer, ? extends R> finisher;
    private final ExposedByteArrayOutputStream sink;
    private final CompletableFuture<R> result;
    private Flow.Subscription subscription;

    LimitedHeapSubscriber(long maxBytes, BiFunction<byte[], Integer, ? extends R> finisher) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("Negative cap: " + maxBytes);
        }
        this.maxBytes = maxBytes;
        this.finisher = finisher;
        this.sink     = new ExposedByteArrayOutputStream(128);
        this.result   = new CompletableFuture<>();
        this.subscription = null;
    }

    /**
     * Returns the result stage.
     *
     * @return the result stage
     */
    CompletionStage<R> asCompletionStage() {
        return result;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        if (this.subscription != null) {
            subscription.cancel();
            throw new IllegalStateException("Already subscribed.");
        }
        this.subscription = subscription;
        subscription.request(MAX_VALUE);
    }

    @Override
    public void onNext(ByteBuffer buf) {
        if (result.isDone()) {
            LOG.log(DEBUG, "Received bytes although I'm done.");
            return;
        }
        final long total = (long) sink.size() + buf.remaining();
        if (total > maxBytes) {
            subscription.cancel();
            result.completeExceptionally(
                    new MaxRequestBodySizeException(maxBytes, total));
            return;
        }
        if (buf.hasArray()) {
            final var len = buf.remaining();
            sink.write(buf.array(), buf.arrayOffset() + buf.position(), len);
            buf.position(buf.position() + len);
        } else {
            while (buf.hasRemaining()) {
                sink.write(buf.get());
            }
        }
    }

    @Override
    public void onError(Throwable t) {
        if (!result.completeExceptionally(t)) {
            LOG.log(DEBUG, () -> "Ignoring error signal received after completion: " + t);
        }
    }

    @Override
    public void onComplete() {
        if (result.isDone()) {
            return;
        }
        final int len = sink.size();
        try {
            result.complete(len == 0 ?
                    finisher.apply(EMPTY, 0) :
                    finisher.apply(sink.buffer(), len));
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    private static final class ExposedByteArrayOutputStream extends ByteArrayOutputStream {
        ExposedByteArrayOutputStream(int size) {
            super(size);
        }

        byte[] buffer() {
            return buf;
        }
    }
}
