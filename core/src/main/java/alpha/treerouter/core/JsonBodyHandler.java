package alpha.treerouter.core;

import alpha.treerouter.handler.ClientChannel;
import alpha.treerouter.handler.PayloadHandler;
import alpha.treerouter.handler.RequestHandler;
import alpha.treerouter.message.MaxRequestBodySizeException;
import alpha.treerouter.message.Request;
import alpha.treerouter.message.Responses;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;
import static java.util.function.Function.identity;

/**
 * A request handler that reads and parses a JSON request body before
 * delegating to a {@link PayloadHandler}.<p>
 *
 * The request is subject to these constraints, checked in order:
 *
 * <ol>
 *   <li>The Content-Type must start with "application/json", else
 *       {@link Responses#unsupportedMediaType()} is written and the body is not
 *       read.</li>
 *   <li>A declared Content-Length must not exceed the cap, else
 *       {@link Responses#entityTooLarge()} is written and the body is not
 *       read. A malformed Content-Length counts as not declared.</li>
 *   <li>The number of bytes received must not exceed the cap, else the
 *       subscription is cancelled and the channel is closed without a
 *       response.</li>
 *   <li>The body must be exactly one JSON value, else
 *       {@link Responses#invalidJson()} is written.</li>
 * </ol>
 *
 * A failure to read the body closes the channel. None of these outcomes
 * reaches the router's error handler. Whatever the delegate throws, or the
 * delegate's stage completes with, is returned to the caller as-is.
 *
 * @param <T> type of the parsed body
 *
 * @author TreeRouter authors
 */
final class JsonBodyHandler<T> implements RequestHandler
{
    private static final System.Logger LOG
            = System.getLogger(JsonBodyHandler.class.getPackageName());

    private static final CompletionStage<Void> COMPLETED = completedStage(null);

    private static final String APPLICATION_JSON = "application/json";

    private final TypeAdapter<T> adapter;
    private final Class<T> type;
    private final long maxBodySize;
    private final PayloadHandler<T> delegate;

    /**
     * Constructs a {@code JsonBodyHandler}.
     *
     * @param gson used to bind the body
     * @param type of the parsed body
     * @param maxBodySize cap in bytes
     * @param delegate application handler
     *
     * @throws NullPointerException
     *             if any reference argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code maxBodySize} is negative
     */
    JsonBodyHandler(Gson gson, Class<T> type, long maxBodySize, PayloadHandler<T> delegate) {
        if (maxBodySize < 0) {
            throw new IllegalArgumentException("Negative maxBodySize: " + maxBodySize);
        }
        this.adapter     = gson.getAdapter(type);
        this.type        = type;
        this.maxBodySize = maxBodySize;
        this.delegate    = requireNonNull(delegate);
    }

    long maxBodySize() {
        return maxBodySize;
    }

    @Override
    public CompletionStage<Void> handle(Request req, ClientChannel ch) {
        if (!req.contentType().toLowerCase(Locale.ROOT).startsWith(APPLICATION_JSON)) {
            LOG.log(DEBUG, () -> "Unsupported Content-Type: \"" + req.contentType() + "\".");
            ch.write(Responses.unsupportedMediaType());
            return COMPLETED;
        }
        var declared = declaredLength(req);
        if (declared.isPresent() && declared.getAsLong() > maxBodySize) {
            LOG.log(DEBUG, () -> "Declared Content-Length " + declared.getAsLong() +
                                 " exceeds cap " + maxBodySize + ".");
            ch.write(Responses.entityTooLarge());
            return COMPLETED;
        }
        var sub = new LimitedHeapSubscriber<>(maxBodySize,
                (buf, count) -> new String(buf, 0, count, UTF_8));
        req.body().subscribe(sub);
        return sub.asCompletionStage()
                  .handle((json, thr) -> thr == null ?
                          parseAndDelegate(req, ch, json) :
                          abort(ch, thr))
                  .thenCompose(identity());
    }

    // A malformed header counts as undeclared; the observed size still applies
    private static OptionalLong declaredLength(Request req) {
        try {
            return req.contentLength();
        } catch (NumberFormatException e) {
            LOG.log(DEBUG, () -> "Ignoring malformed Content-Length: " + e.getMessage());
            return OptionalLong.empty();
        }
    }

    private CompletionStage<Void> parseAndDelegate(Request req, ClientChannel ch, String json) {
        final T body;
        try {
            body = parse(json);
        } catch (IOException | JsonParseException | IllegalStateException | NumberFormatException e) {
            LOG.log(DEBUG, () -> "Invalid JSON: " + e);
            ch.write(Responses.invalidJson());
            return COMPLETED;
        }
        try {
            return delegate.handle(req, ch, body);
        } catch (Exception e) {
            return failedStage(e);
        }
    }

    private T parse(String json) throws IOException {
        JsonReader r = new JsonReader(new StringReader(json));
        r.setLenient(false);
        T val = adapter.read(r);
        if (r.peek() != JsonToken.END_DOCUMENT) {
            throw new JsonParseException("Trailing data after JSON value.");
        }
        if (val == null) {
            throw new JsonParseException("JSON null can not be bound to " + type.getName() + ".");
        }
        return val;
    }

    private static CompletionStage<Void> abort(ClientChannel ch, Throwable thr) {
        Throwable t = thr instanceof CompletionException && thr.getCause() != null ?
                thr.getCause() : thr;
        if (t instanceof MaxRequestBodySizeException) {
            LOG.log(WARNING, "Request body too large, closing channel.", t);
        } else {
            LOG.log(WARNING, "Failed to read request body, closing channel.", t);
        }
        ch.close();
        return COMPLETED;
    }

    @Override
    public String toString() {
        return JsonBodyHandler.class.getSimpleName() + "{" +
                "type=" + type.getSimpleName() +
                ", maxBodySize=" + maxBodySize + "}";
    }
}
