package alpha.treerouter.message;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static alpha.treerouter.HttpConstants.HeaderName.CONTENT_TYPE;
import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Response}.
 *
 * @author TreeRouter authors
 */
final class DefaultResponse implements Response
{
    private static final byte[] EMPTY = new byte[0];

    private final Builder origin;
    private final int statusCode;
    private final HttpHeaders headers;
    private final byte[] body;

    private DefaultResponse(Builder origin) {
        this.origin     = origin;
        this.statusCode = origin.statusCode;
        this.headers    = HttpHeaders.of(origin.headers, (k, v) -> true);
        this.body       = origin.body;
    }

    @Override
    public int statusCode() {
        return statusCode;
    }

    @Override
    public HttpHeaders headers() {
        return headers;
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    @Override
    public String bodyAsText() {
        return new String(body, UTF_8);
    }

    @Override
    public Response.Builder toBuilder() {
        return origin;
    }

    @Override
    public String toString() {
        return DefaultResponse.class.getSimpleName() + "{" +
                "statusCode=" + statusCode +
                ", headers=" + headers.map() +
                ", body.length=" + body.length + "}";
    }

    static final class Builder implements Response.Builder
    {
        static final Builder ROOT = new Builder(200, Map.of(), EMPTY);

        private final int statusCode;
        // Never modified after construction
        private final Map<String, List<String>> headers;
        private final byte[] body;

        private Builder(int statusCode, Map<String, List<String>> headers, byte[] body) {
            this.statusCode = statusCode;
            this.headers    = headers;
            this.body       = body;
        }

        @Override
        public Response.Builder statusCode(int statusCode) {
            if (statusCode < 100 || statusCode > 999) {
                throw new IllegalArgumentException(
                        "Status code is not a three-digit number: " + statusCode);
            }
            return new Builder(statusCode, headers, body);
        }

        @Override
        public Response.Builder header(String name, String value) {
            requireNonNull(name);
            requireNonNull(value);
            Map<String, List<String>> m = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            m.putAll(headers);
            m.put(name, List.of(value));
            return new Builder(statusCode, m, body);
        }

        @Override
        public Response.Builder body(byte[] body, String contentType) {
            byte[] copy = body.clone();
            Builder b = (Builder) header(CONTENT_TYPE, contentType);
            return new Builder(b.statusCode, b.headers, copy);
        }

        @Override
        public Response.Builder body(String body, String contentType) {
            return body(body.getBytes(UTF_8), contentType);
        }

        @Override
        public Response build() {
            return new DefaultResponse(this);
        }
    }
}
