package alpha.treerouter.testutil;

import alpha.treerouter.message.RawRequest;

import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Flow;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Factories of in-memory {@link RawRequest}s.<p>
 *
 * <pre>
 *   RawRequest req = TestRequests.builder("POST", "/items")
 *           .header("Content-Type", "application/json")
 *           .body("{\"name\":\"x\"}", 4)
 *           .build();
 * </pre>
 *
 * @author TreeRouter authors
 */
public final class TestRequests
{
    private TestRequests() {
        // Empty
    }

    /**
     * Returns a GET request without a body.
     *
     * @param target request-target
     *
     * @return a request
     */
    public static RawRequest get(String target) {
        return builder("GET", target).build();
    }

    /**
     * Returns a JSON POST request.<p>
     *
     * The Content-Type is "application/json" and the Content-Length is
     * declared.
     *
     * @param target request-target
     * @param json body
     *
     * @return a request
     */
    public static RawRequest postJson(String target, String json) {
        return builder("POST", target)
                .header("Content-Type", "application/json")
                .header("Content-Length", String.valueOf(json.getBytes(UTF_8).length))
                .body(json)
                .build();
    }

    /**
     * Returns a request builder.
     *
     * @param method of request
     * @param target request-target
     *
     * @return a builder
     */
    public static Builder builder(String method, String target) {
        return new Builder(method, target);
    }

    /**
     * Builder of {@link RawRequest}. Not thread-safe.
     */
    public static final class Builder {
        private final String method, target;
        private final Map<String, List<String>> headers;
        private Flow.Publisher<ByteBuffer> body;

        private Builder(String method, String target) {
            this.method  = requireNonNull(method);
            this.target  = requireNonNull(target);
            this.headers = new LinkedHashMap<>();
            this.body    = ByteBufferPublisher.of(List.of());
        }

        /**
         * Adds a header value.
         *
         * @param name of header
         * @param value of header
         *
         * @return this for chaining/fluency
         */
        public Builder header(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        /**
         * Sets a UTF-8 body published as one bytebuffer.
         *
         * @param body of request
         *
         * @return this for chaining/fluency
         */
        public Builder body(String body) {
            return body(body, Integer.MAX_VALUE);
        }

        /**
         * Sets a UTF-8 body published in chunks.
         *
         * @param body of request
         * @param chunkSize max bytes per bytebuffer
         *
         * @return this for chaining/fluency
         */
        public Builder body(String body, int chunkSize) {
            return body(ByteBufferPublisher.of(chunks(body.getBytes(UTF_8), chunkSize)));
        }

        /**
         * Sets the body publisher.
         *
         * @param body of request
         *
         * @return this for chaining/fluency
         */
        public Builder body(Flow.Publisher<ByteBuffer> body) {
            this.body = requireNonNull(body);
            return this;
        }

        /**
         * Builds the request.
         *
         * @return the request
         */
        public RawRequest build() {
            var h = HttpHeaders.of(headers, (k, v) -> true);
            var b = body;
            return new RawRequest() {
                @Override public String method() {
                    return method;
                }
                @Override public String target() {
                    return target;
                }
                @Override public HttpHeaders headers() {
                    return h;
                }
                @Override public Flow.Publisher<ByteBuffer> body() {
                    return b;
                }
                @Override public String toString() {
                    return method + " " + target;
                }
            };
        }
    }

    /**
     * Splits the given bytes into bytebuffers.
     *
     * @param bytes to split
     * @param chunkSize max bytes per bytebuffer
     *
     * @return bytebuffers
     */
    public static List<ByteBuffer> chunks(byte[] bytes, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize: " + chunkSize);
        }
        List<ByteBuffer> l = new ArrayList<>();
        for (int i = 0; i < bytes.length; i += chunkSize) {
            int len = Math.min(chunkSize, bytes.length - i);
            l.add(ByteBuffer.wrap(bytes, i, len).slice());
        }
        return l;
    }
}
