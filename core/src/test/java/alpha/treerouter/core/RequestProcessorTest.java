package alpha.treerouter.core;

import alpha.treerouter.Router;
import alpha.treerouter.testutil.LogRecorder;
import alpha.treerouter.testutil.TestChannel;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static alpha.treerouter.core.RequestProcessor.State.BODY_PARSE;
import static alpha.treerouter.core.RequestProcessor.State.CUSTOM_ERROR_HANDLER;
import static alpha.treerouter.core.RequestProcessor.State.DEFAULT_500;
import static alpha.treerouter.core.RequestProcessor.State.ERROR;
import static alpha.treerouter.core.RequestProcessor.State.HANDLER_EXEC;
import static alpha.treerouter.core.RequestProcessor.State.MIDDLEWARE;
import static alpha.treerouter.core.RequestProcessor.State.NOT_FOUND;
import static alpha.treerouter.core.RequestProcessor.State.PARAM_BIND;
import static alpha.treerouter.core.RequestProcessor.State.RECEIVED;
import static alpha.treerouter.core.RequestProcessor.State.RESPONSE_SENT;
import static alpha.treerouter.core.RequestProcessor.State.ROUTE_MATCH;
import static alpha.treerouter.handler.RequestHandlers.accept;
import static alpha.treerouter.handler.RequestHandlers.acceptBody;
import static alpha.treerouter.handler.RequestHandlers.respond;
import static alpha.treerouter.message.Responses.text;
import static alpha.treerouter.testutil.TestRequests.get;
import static alpha.treerouter.testutil.TestRequests.postJson;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.concurrent.CompletableFuture.completedStage;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests of the request lifecycle, observed through the state transitions that
 * {@link RequestProcessor} logs.
 *
 * @author TreeRouter authors
 */
class RequestProcessorTest
{
    private LogRecorder log;
    private TestChannel ch;

    @BeforeEach
    void before() {
        log = LogRecorder.startRecording(RequestProcessor.class);
        ch = new TestChannel();
    }

    @AfterEach
    void after() {
        log.stopRecording();
    }

    @Test
    void route_match() {
        var app = Router.create().get("/x", respond(text("x")));
        app.dispatch(get("/x"), ch).toCompletableFuture().join();
        assertThat(states("GET /x")).containsExactly(
                RECEIVED, MIDDLEWARE, ROUTE_MATCH, PARAM_BIND, HANDLER_EXEC, RESPONSE_SENT);
        assertThat(ch.response().statusCode()).isEqualTo(200);
    }

    @Test
    void not_found() {
        Router.create().dispatch(get("/x"), ch).toCompletableFuture().join();
        assertThat(states("GET /x")).containsExactly(
                RECEIVED, MIDDLEWARE, ROUTE_MATCH, NOT_FOUND, RESPONSE_SENT);
        assertThat(ch.response().statusCode()).isEqualTo(404);
    }

    @Test
    void default_error_response() {
        var app = Router.create().get("/x", accept((req, ch) -> {
            throw new IllegalStateException("boom");
        }));
        app.dispatch(get("/x"), ch).toCompletableFuture().join();
        assertThat(states("GET /x")).containsExactly(
                RECEIVED, MIDDLEWARE, ROUTE_MATCH, PARAM_BIND, HANDLER_EXEC,
                ERROR, DEFAULT_500, RESPONSE_SENT);
        assertThat(ch.response().statusCode()).isEqualTo(500);
    }

    @Test
    void custom_error_handler() {
        var app = Router.create()
                .get("/x", accept((req, ch) -> {
                    throw new IllegalStateException("boom");
                }))
                .onError((thr, req, ch) -> {
                    ch.write(text(503, thr.getMessage()));
                    return completedStage(null);
                });
        app.dispatch(get("/x"), ch).toCompletableFuture().join();
        assertThat(states("GET /x")).containsExactly(
                RECEIVED, MIDDLEWARE, ROUTE_MATCH, PARAM_BIND, HANDLER_EXEC,
                ERROR, CUSTOM_ERROR_HANDLER, RESPONSE_SENT);
        assertThat(ch.response().statusCode()).isEqualTo(503);
        assertThat(ch.response().bodyAsText()).isEqualTo("boom");
    }

    @Test
    void error_handler_fails() {
        var app = Router.create()
                .get("/x", accept((req, ch) -> {
                    throw new IllegalStateException("boom");
                }))
                .onError((thr, req, ch) -> {
                    throw new UnsupportedOperationException("also boom");
                });
        app.dispatch(get("/x"), ch).toCompletableFuture().join();
        assertThat(states("GET /x")).containsExactly(
                RECEIVED, MIDDLEWARE, ROUTE_MATCH, PARAM_BIND, HANDLER_EXEC,
                ERROR, CUSTOM_ERROR_HANDLER, DEFAULT_500, RESPONSE_SENT);
        assertThat(ch.response().statusCode()).isEqualTo(500);
        log.assertRemove(System.Logger.Level.ERROR, "Error handler failed.",
                UnsupportedOperationException.class)
           .hasMessage("also boom");
    }

    @Test
    void payload_route() {
        var app = Router.create().post("/x", Object.class,
                acceptBody((req, ch, body) -> ch.write(text("ok"))));
        app.dispatch(postJson("/x", "{}"), ch).toCompletableFuture().join();
        assertThat(states("POST /x")).containsExactly(
                RECEIVED, MIDDLEWARE, ROUTE_MATCH, PARAM_BIND, BODY_PARSE, RESPONSE_SENT);
        assertThat(ch.response().bodyAsText()).isEqualTo("ok");
    }

    @Test
    void state_after_process() {
        var tree = new RouteTree();
        tree.insert("GET", "/x", respond(text("x")));
        var testee = new RequestProcessor(tree, List.of(), null, null, get("/x"), ch);
        assertThat(testee.state()).isNull();
        testee.process().toCompletableFuture().join();
        assertThat(testee.state()).isEqualTo(RESPONSE_SENT);
    }

    @Test
    void state_after_payload_route_with_bad_json() {
        var tree = new RouteTree();
        tree.insert("POST", "/x", new JsonBodyHandler<JsonElement>(
                new Gson(), JsonElement.class, 100,
                acceptBody((req, ch, body) -> ch.write(text("ok")))));
        var testee = new RequestProcessor(tree, List.of(), null, null, postJson("/x", "{"), ch);
        testee.process().toCompletableFuture().join();
        assertThat(testee.state()).isEqualTo(RESPONSE_SENT);
        assertThat(ch.response().statusCode()).isEqualTo(400);
    }

    private List<RequestProcessor.State> states(String methodAndTarget) {
        String prefix = methodAndTarget + ": ";
        return log.messages(DEBUG).stream()
                .filter(m -> m.startsWith(prefix))
                .map(m -> m.substring(m.lastIndexOf("-> ") + 3))
                .map(RequestProcessor.State::valueOf)
                .toList();
    }
}
