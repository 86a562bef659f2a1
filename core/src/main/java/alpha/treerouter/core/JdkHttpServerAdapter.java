package alpha.treerouter.core;

import alpha.treerouter.Router;
import alpha.treerouter.handler.ClientChannel;
import alpha.treerouter.handler.ResponseRejectedException;
import alpha.treerouter.message.RawRequest;
import alpha.treerouter.message.Response;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static alpha.treerouter.handler.ResponseRejectedException.Reason.ALREADY_RESPONDED;
import static alpha.treerouter.handler.ResponseRejectedException.Reason.CHANNEL_CLOSED;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Serves a {@link Router} using the JDK's built-in HTTP server.<p>
 *
 * Each exchange received by the server is dispatched to the router. The
 * exchange's request body is published lazily to whoever subscribes to
 * {@link RawRequest#body()}, and the exchange is completed when the router
 * writes a response. If processing ends without a response, the exchange is
 * closed, which terminates the connection.
 *
 * <pre>
 *   HttpServer server = JdkHttpServerAdapter.start(router, new InetSocketAddress(8080));
 *   ...
 *   server.stop(0);
 * </pre>
 *
 * @author TreeRouter authors
 */
public final class JdkHttpServerAdapter implements HttpHandler
{
    private static final System.Logger LOG
            = System.getLogger(JdkHttpServerAdapter.class.getPackageName());

    /**
     * Creates and starts a server that serves the given router.<p>
     *
     * Exchanges are handled by a cached pool of daemon threads, so that a
     * client sending its request body slowly only ties up its own thread and
     * never the server's dispatcher thread. Idle pool threads expire after
     * one minute; stopping the server is all the cleanup needed.
     *
     * @param router to serve
     * @param address to bind (port 0 binds an ephemeral port)
     *
     * @return the started server
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IOException
     *             if the server could not be bound
     */
    public static HttpServer start(Router router, InetSocketAddress address) throws IOException {
        return start(router, address, Executors.newCachedThreadPool(new ExchangeThreads()));
    }

    /**
     * Creates and starts a server that serves the given router using the
     * given executor.<p>
     *
     * The executor runs the router's processing of each exchange, including
     * the blocking reads of a request body. It should not be a single thread.
     * The caller owns the executor and shuts it down after the server has been
     * stopped.
     *
     * @param router to serve
     * @param address to bind (port 0 binds an ephemeral port)
     * @param executor of exchanges
     *
     * @return the started server
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IOException
     *             if the server could not be bound
     */
    public static HttpServer start(Router router, InetSocketAddress address, Executor executor)
            throws IOException
    {
        requireNonNull(router);
        requireNonNull(executor);
        HttpServer server = HttpServer.create(requireNonNull(address), 0);
        server.createContext("/", new JdkHttpServerAdapter(router));
        server.setExecutor(executor);
        server.start();
        LOG.log(INFO, () -> "Listening on " + server.getAddress() + ".");
        return server;
    }

    private final Router router;

    /**
     * Constructs a {@code JdkHttpServerAdapter}.
     *
     * @param router to dispatch exchanges to
     *
     * @throws NullPointerException
     *             if {@code router} is {@code null}
     */
    public JdkHttpServerAdapter(Router router) {
        this.router = requireNonNull(router);
    }

    @Override
    public void handle(HttpExchange exchange) {
        var req = new ExchangeRequest(exchange);
        var ch  = new ExchangeChannel(exchange);
        router.dispatch(req, ch).whenComplete((nil, thr) -> ch.endIfNoResponse());
    }

    private static final class ExchangeThreads implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "treerouter-exchange-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    private static final class ExchangeRequest implements RawRequest {
        private final HttpExchange ex;
        private final String target;
        private final HttpHeaders headers;
        private final Flow.Publisher<ByteBuffer> body;

        ExchangeRequest(HttpExchange ex) {
            URI uri = ex.getRequestURI();
            String q = uri.getRawQuery();
            this.ex      = ex;
            this.target  = q == null ? uri.getRawPath() : uri.getRawPath() + "?" + q;
            this.headers = HttpHeaders.of(ex.getRequestHeaders(), (k, v) -> true);
            this.body    = new InputStreamPublisher(ex.getRequestBody());
        }

        @Override
        public String method() {
            return ex.getRequestMethod();
        }

        @Override
        public String target() {
            return target;
        }

        @Override
        public HttpHeaders headers() {
            return headers;
        }

        @Override
        public Flow.Publisher<ByteBuffer> body() {
            return body;
        }
    }

    private static final class ExchangeChannel implements ClientChannel {
        private final HttpExchange ex;
        private boolean wroteFinal, closed;

        ExchangeChannel(HttpExchange ex) {
            this.ex = ex;
        }

        @Override
        public synchronized void write(Response response) {
            requireNonNull(response);
            if (wroteFinal) {
                throw new ResponseRejectedException(
                        response, ALREADY_RESPONDED, "Already wrote a response.");
            }
            if (closed) {
                throw new ResponseRejectedException(
                        response, CHANNEL_CLOSED, "Channel is closed.");
            }
            wroteFinal = true;
            response.headers().map().forEach((k, v) -> ex.getResponseHeaders().put(k, v));
            byte[] body = response.body();
            try {
                ex.sendResponseHeaders(response.statusCode(), body.length == 0 ? -1 : body.length);
                if (body.length > 0) {
                    try (OutputStream out = ex.getResponseBody()) {
                        out.write(body);
                    }
                }
            } catch (IOException e) {
                LOG.log(WARNING, "Failed to write response, closing exchange.", e);
            } finally {
                closed = true;
                ex.close();
            }
        }

        @Override
        public synchronized boolean wroteFinal() {
            return wroteFinal;
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            LOG.log(DEBUG, "Closing exchange without a response.");
            ex.close();
        }

        @Override
        public synchronized boolean isOpen() {
            return !closed;
        }

        synchronized void endIfNoResponse() {
            if (!wroteFinal && !closed) {
                LOG.log(WARNING, () -> "No response written for " +
                        ex.getRequestMethod() + " " + ex.getRequestURI() + ", closing exchange.");
                close();
            }
        }
    }
}
