package alpha.treerouter.core;

import alpha.treerouter.message.RawRequest;
import alpha.treerouter.message.Request;
import alpha.treerouter.util.PercentDecoder;

import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Flow;

import static alpha.treerouter.core.RequestTarget.decodeOrKeep;
import static java.util.Objects.requireNonNull;

/**
 * The default implementation of {@code Request}.<p>
 *
 * A new instance of this class is created when path parameters are bound, as
 * the path parameters are unique per matched route. Before-actions and the
 * not-found handler observe a request without path parameters.<p>
 *
 * All other components of the request, including the attributes, are shared
 * throughout the exchange as all created request objects have a reference to
 * the same {@link RawRequest} and {@link RequestTarget}.
 *
 * @author TreeRouter authors
 */
final class DefaultRequest implements Request
{
    static DefaultRequest requestWithoutParams(RawRequest raw) {
        return new DefaultRequest(raw,
                RequestTarget.parse(raw.target()),
                Map.of(),
                new ConcurrentHashMap<>());
    }

    private final RawRequest raw;
    private final RequestTarget rt;
    private final ConcurrentMap<String, Object> attributes;
    private final Parameters params;

    private DefaultRequest(
            RawRequest raw,
            RequestTarget rt,
            Map<String, String> pathParamsRaw,
            ConcurrentMap<String, Object> attributes)
    {
        this.raw        = requireNonNull(raw);
        this.rt         = rt;
        this.attributes = attributes;
        this.params     = new DefaultParameters(pathParamsRaw);
    }

    /**
     * Returns a request that shares all components with this request, except
     * for the path parameters which are set to the given map.
     *
     * @param pathParamsRaw capture name to raw segment value
     *
     * @return a new request
     */
    DefaultRequest withParams(Map<String, String> pathParamsRaw) {
        return new DefaultRequest(raw, rt, Map.copyOf(pathParamsRaw), attributes);
    }

    @Override
    public String method() {
        return raw.method();
    }

    @Override
    public String target() {
        return rt.raw();
    }

    @Override
    public HttpHeaders headers() {
        return raw.headers();
    }

    @Override
    public Flow.Publisher<ByteBuffer> body() {
        return raw.body();
    }

    @Override
    public String path() {
        return rt.path();
    }

    @Override
    public Parameters parameters() {
        return params;
    }

    @Override
    public ConcurrentMap<String, Object> attributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return DefaultRequest.class.getSimpleName() + "{" +
                "method=" + method() +
                ", target=" + target() + "}";
    }

    private final class DefaultParameters implements Parameters {
        private final Map<String, String> pathRaw;
        private Map<String, String> decoded;

        DefaultParameters(Map<String, String> pathRaw) {
            this.pathRaw = pathRaw;
        }

        @Override
        public String path(String name) {
            return pathMap().get(name);
        }

        @Override
        public String pathRaw(String name) {
            return pathRaw.get(name);
        }

        @Override
        public Map<String, String> pathMap() {
            Map<String, String> d = decoded;
            if (d == null) {
                Map<String, String> m = new HashMap<>();
                pathRaw.forEach((k, v) -> m.put(k, decodeOrKeep(v, PercentDecoder::decode)));
                decoded = d = Map.copyOf(m);
            }
            return d;
        }

        @Override
        public Map<String, List<String>> queryMap() {
            return rt.queryMap();
        }
    }
}
