package alpha.treerouter.message;

import alpha.treerouter.handler.ClientChannel;

import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.OptionalLong;
import java.util.concurrent.Flow;

import static alpha.treerouter.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.treerouter.HttpConstants.HeaderName.CONTENT_TYPE;

/**
 * A request as delivered by the transport, before any routing took place.<p>
 *
 * The transport parses the request head and makes the body available as a
 * publisher of bytebuffers. The request is then dispatched to the router
 * together with the {@link ClientChannel} through which the response is
 * written.<p>
 *
 * The implementation must be thread-safe.
 *
 * @author TreeRouter authors
 */
public interface RawRequest
{
    /**
     * Returns the request-line's method token.
     *
     * @return the request-line's method token (never {@code null})
     */
    String method();

    /**
     * Returns the raw request-target, path and query as received on the wire.
     *
     * <pre>
     *   "/where?q=now" -{@literal >} "/where?q=now"
     * </pre>
     *
     * @return the raw request-target (never {@code null})
     */
    String target();

    /**
     * Returns the request headers.
     *
     * @return the request headers (never {@code null})
     */
    HttpHeaders headers();

    /**
     * Returns the request body.<p>
     *
     * The publisher is unicast and must be subscribed to at most once. A
     * request without a body is represented by a publisher that immediately
     * completes.
     *
     * @return the request body (never {@code null})
     */
    Flow.Publisher<ByteBuffer> body();

    /**
     * Returns the first value of the Content-Type header, or an empty string
     * if the header is absent.
     *
     * @return the content type (never {@code null})
     */
    default String contentType() {
        return headers().firstValue(CONTENT_TYPE).orElse("");
    }

    /**
     * Returns the declared Content-Length.
     *
     * @return the declared Content-Length
     *
     * @throws NumberFormatException
     *             if the header value is not a number
     */
    default OptionalLong contentLength() {
        return headers().firstValueAsLong(CONTENT_LENGTH);
    }
}
