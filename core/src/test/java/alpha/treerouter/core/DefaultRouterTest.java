package alpha.treerouter.core;

import alpha.treerouter.Router;
import alpha.treerouter.handler.RequestHandler;
import alpha.treerouter.handler.ResponseRejectedException;
import alpha.treerouter.message.RawRequest;
import alpha.treerouter.message.Request;
import alpha.treerouter.message.Response;
import alpha.treerouter.route.RouteCollisionException;
import alpha.treerouter.route.RoutePatternInvalidException;
import alpha.treerouter.testutil.LogRecorder;
import alpha.treerouter.testutil.TestChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static alpha.treerouter.core.Handlers.named;
import static alpha.treerouter.handler.RequestHandlers.accept;
import static alpha.treerouter.handler.RequestHandlers.noop;
import static alpha.treerouter.handler.RequestHandlers.respond;
import static alpha.treerouter.message.Responses.text;
import static alpha.treerouter.testutil.TestRequests.builder;
import static alpha.treerouter.testutil.TestRequests.get;
import static java.lang.System.Logger.Level.ERROR;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Small tests for {@link DefaultRouter}, dispatching in-memory requests.
 *
 * @author TreeRouter authors
 */
class DefaultRouterTest
{
    private final Router testee = Router.create();
    private TestChannel ch;
    private LogRecorder log;

    @BeforeEach
    void startRecording() {
        ch = new TestChannel();
        log = LogRecorder.startRecording(DefaultRouter.class);
    }

    @AfterEach
    void stopRecording() {
        log.stopRecording();
    }

    // Routing
    // ----

    @Test
    void create_uses_service_provider() {
        assertThat(testee).isExactlyInstanceOf(DefaultRouter.class);
    }

    @Test
    void match() {
        testee.get("/hello", respond(text("Hi")));
        assertThat(dispatch(get("/hello")).bodyAsText()).isEqualTo("Hi");
        log.assertNoProblem();
    }

    @Test
    void root() {
        testee.get("/", named("root"));
        assertThat(dispatch(get("/")).bodyAsText()).isEqualTo("root");
        ch = new TestChannel();
        assertThat(dispatch(get("/?x=1")).bodyAsText()).isEqualTo("root");
    }

    @Test
    void registrars_use_their_method() {
        testee.get("/r", named("get"))
              .put("/r", named("put"))
              .delete("/r", named("delete"))
              .patch("/r", named("patch"));
        for (String m : List.of("GET", "PUT", "DELETE", "PATCH")) {
            ch = new TestChannel();
            var req = builder(m, "/r").build();
            assertThat(dispatch(req).bodyAsText()).isEqualTo(m.toLowerCase());
        }
    }

    @Test
    void path_parameters_raw_and_decoded() {
        var captured = new AtomicReference<Request>();
        testee.get("/files/:name", accept((req, ch) -> {
            captured.set(req);
            ch.write(text("ok"));
        }));
        dispatch(get("/files/a%20b+c"));
        var p = captured.get().parameters();
        assertThat(p.path("name")).isEqualTo("a b+c");
        assertThat(p.pathRaw("name")).isEqualTo("a%20b+c");
        assertThat(p.pathMap()).containsOnlyKeys("name");
        assertThat(p.path("nope")).isNull();
        assertThat(captured.get().path()).isEqualTo("/files/a%20b+c");
    }

    @Test
    void query_parameters() {
        var captured = new AtomicReference<Request>();
        testee.get("/search", accept((req, ch) -> {
            captured.set(req);
            ch.write(text("ok"));
        }));
        dispatch(get("/search?q=a+b&tag=x&tag=y&flag"));
        var p = captured.get().parameters();
        assertThat(p.queryFirst("q")).hasValue("a b");
        assertThat(p.queryList("tag")).containsExactly("x", "y");
        assertThat(p.queryFirst("flag")).hasValue("");
        assertThat(p.queryFirst("missing")).isEmpty();
        assertThat(p.queryStream("tag")).containsExactly("x", "y");
        assertThat(captured.get().target()).isEqualTo("/search?q=a+b&tag=x&tag=y&flag");
    }

    // Not found
    // ----

    @Test
    void not_found_default() {
        testee.get("/a", noop());
        var rsp = dispatch(get("/b"));
        assertThat(rsp.statusCode()).isEqualTo(404);
        assertThat(rsp.bodyAsText()).isEqualTo("Route Not Found");
        log.assertNoProblem();
    }

    @Test
    void not_found_for_unregistered_method() {
        testee.get("/a", noop());
        var req = builder("POST", "/a").build();
        assertThat(dispatch(req).statusCode()).isEqualTo(404);
    }

    @Test
    void not_found_custom() {
        var captured = new AtomicReference<Request>();
        testee.notFound(accept((req, ch) -> {
            captured.set(req);
            ch.write(text(404, "Nothing at " + req.path()));
        }));
        var rsp = dispatch(get("/nope?x=1"));
        assertThat(rsp.statusCode()).isEqualTo(404);
        assertThat(rsp.bodyAsText()).isEqualTo("Nothing at /nope");
        assertThat(captured.get().parameters().pathMap()).isEmpty();
        assertThat(captured.get().parameters().queryFirst("x")).hasValue("1");
    }

    @Test
    void not_found_custom_fails() {
        testee.notFound((req, ch) -> {
            throw new IllegalStateException("boom");
        });
        assertThat(dispatch(get("/nope")).statusCode()).isEqualTo(500);
        log.assertRemove(ERROR, "Internal Server Error", IllegalStateException.class);
    }

    // Errors
    // ----

    @Test
    void handler_throws_default_500() {
        testee.get("/", (req, ch) -> {
            throw new IOException("boom");
        });
        var rsp = dispatch(get("/"));
        assertThat(rsp.statusCode()).isEqualTo(500);
        assertThat(rsp.bodyAsText()).isEqualTo("Internal Server Error");
        log.assertRemove(ERROR, "Internal Server Error: GET /", IOException.class)
           .hasMessage("boom");
        log.assertNoProblem();
    }

    @Test
    void handler_stage_fails_default_500() {
        testee.get("/", (req, ch) -> failedStage(new IllegalStateException()));
        assertThat(dispatch(get("/")).statusCode()).isEqualTo(500);
    }

    @Test
    void handler_returns_null_stage() {
        testee.get("/", (req, ch) -> null);
        assertThat(dispatch(get("/")).statusCode()).isEqualTo(500);
        log.assertRemove(ERROR, "Internal Server Error", NullPointerException.class);
    }

    @Test
    void custom_error_handler_receives_unwrapped_throwable() {
        var cause = new IllegalStateException("boom");
        var seen = new AtomicReference<Throwable>();
        testee.get("/x/:id", (req, ch) -> failedStage(new CompletionException(cause)))
              .onError((thr, req, ch) -> {
                  seen.set(thr);
                  ch.write(text(503, "Sorry " + req.parameters().path("id")));
                  return completedStage(null);
              });
        var rsp = dispatch(get("/x/7"));
        assertThat(seen.get()).isSameAs(cause);
        assertThat(rsp.statusCode()).isEqualTo(503);
        assertThat(rsp.bodyAsText()).isEqualTo("Sorry 7");
    }

    @Test
    void custom_error_handler_fails() {
        testee.get("/", (req, ch) -> {
            throw new IllegalStateException("first");
        }).onError((thr, req, ch) -> {
            throw new IOException("second");
        });
        assertThat(dispatch(get("/")).statusCode()).isEqualTo(500);
        log.assertRemove(ERROR, "Internal Server Error", IllegalStateException.class);
        log.assertRemove(ERROR, "Error handler failed.", IOException.class);
        log.assertNoProblem();
    }

    @Test
    void custom_error_handler_writes_nothing() {
        testee.get("/", (req, ch) -> {
            throw new IllegalStateException();
        }).onError((thr, req, ch) -> completedStage(null));
        dispatch(get("/"));
        assertThat(ch.response()).isNull();
    }

    @Test
    void handler_responded_then_failed() {
        testee.get("/", (req, ch) -> {
            ch.write(text("first"));
            throw new IllegalStateException();
        });
        assertThat(dispatch(get("/")).bodyAsText()).isEqualTo("first");
        assertThat(ch.rejected()).isZero();
    }

    @Test
    void second_write_is_rejected() {
        var rejected = new AtomicReference<Throwable>();
        testee.get("/", accept((req, ch) -> {
            ch.write(text("first"));
            ch.write(text("second"));
        })).onError((thr, req, ch) -> {
            rejected.set(thr);
            return completedStage(null);
        });
        assertThat(dispatch(get("/")).bodyAsText()).isEqualTo("first");
        assertThat(rejected.get())
                .isExactlyInstanceOf(ResponseRejectedException.class)
                .extracting(t -> ((ResponseRejectedException) t).reason())
                .isEqualTo(ResponseRejectedException.Reason.ALREADY_RESPONDED);
    }

    @Test
    void dispatch_never_completes_exceptionally() {
        testee.get("/", (req, ch) -> {
            throw new Error("very bad");
        });
        var stage = testee.dispatch(get("/"), ch).toCompletableFuture();
        assertThat(stage).isCompleted();
        assertThat(ch.response().statusCode()).isEqualTo(500);
    }

    // Before-actions
    // ----

    @Test
    void before_actions_run_in_order() {
        List<String> trail = new ArrayList<>();
        testee.before((req, ch) -> { trail.add("a"); return completedStage(null); })
              .before((req, ch) -> { trail.add("b"); return completedStage(null); })
              .get("/", accept((req, ch) -> {
                  trail.add("h");
                  ch.write(text("ok"));
              }));
        dispatch(get("/"));
        assertThat(trail).containsExactly("a", "b", "h");
    }

    @Test
    void before_action_runs_also_for_not_found() {
        List<String> trail = new ArrayList<>();
        testee.before((req, ch) -> { trail.add(req.path()); return completedStage(null); });
        assertThat(dispatch(get("/nope")).statusCode()).isEqualTo(404);
        assertThat(trail).containsExactly("/nope");
    }

    @Test
    void async_before_action_is_awaited() {
        var gate = new CompletableFuture<Void>();
        testee.before((req, ch) -> gate).get("/", named("h"));
        var stage = testee.dispatch(get("/"), ch).toCompletableFuture();
        assertThat(stage).isNotDone();
        assertThat(ch.response()).isNull();
        gate.complete(null);
        assertThat(stage).isCompleted();
        assertThat(ch.response().bodyAsText()).isEqualTo("h");
    }

    @Test
    void failing_before_action_skips_routing() throws Exception {
        RequestHandler h = mock(RequestHandler.class);
        var seen = new AtomicReference<Throwable>();
        testee.before((req, ch) -> { throw new SecurityException("denied"); })
              .before((req, ch) -> { throw new AssertionError("Not invoked"); })
              .get("/", h)
              .onError((thr, req, ch) -> {
                  seen.set(thr);
                  ch.write(text(403, thr.getMessage()));
                  return completedStage(null);
              });
        var rsp = dispatch(get("/"));
        assertThat(rsp.statusCode()).isEqualTo(403);
        assertThat(rsp.bodyAsText()).isEqualTo("denied");
        assertThat(seen.get()).isExactlyInstanceOf(SecurityException.class);
        verifyNoInteractions(h);
    }

    @Test
    void before_action_may_respond() throws Exception {
        RequestHandler h = mock(RequestHandler.class);
        testee.before((req, ch) -> {
            ch.write(text(401, "Who are you?"));
            return completedStage(null);
        }).get("/", h);
        assertThat(dispatch(get("/")).statusCode()).isEqualTo(401);
        verifyNoInteractions(h);
        assertThat(ch.rejected()).isZero();
    }

    @Test
    void attributes_are_shared() throws Exception {
        RequestHandler h = mock(RequestHandler.class);
        when(h.handle(any(), any())).thenReturn(completedStage(null));
        testee.before((req, ch) -> {
            req.attributes().put("user", "John");
            return completedStage(null);
        }).get("/:x", h);
        dispatch(get("/1"));
        var captor = ArgumentCaptor.forClass(Request.class);
        verify(h).handle(captor.capture(), any());
        assertThat(captor.getValue().attributes()).containsEntry("user", "John");
        assertThat(captor.getValue().parameters().path("x")).isEqualTo("1");
    }

    // Registration
    // ----

    @Test
    void registration_errors() {
        assertThatThrownBy(() -> testee.get("no-slash", noop()))
                .isExactlyInstanceOf(RoutePatternInvalidException.class);
        testee.get("/u/:id", noop());
        assertThatThrownBy(() -> testee.get("/u/:name", noop()))
                .isExactlyInstanceOf(RouteCollisionException.class);
        assertThatThrownBy(() -> testee.get("/x", null))
                .isExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void failed_registration_publishes_nothing() {
        var other = Router.create().get("/new", noop()).get("/:y", noop());
        testee.get("/api/:x", noop());
        var before = ((DefaultRouter) testee).tree();
        // "/api/new" is fine, "/api/:y" collides
        assertThatThrownBy(() -> testee.nest("/api", other))
                .isExactlyInstanceOf(RouteCollisionException.class);
        assertThat(((DefaultRouter) testee).tree()).isSameAs(before);
        assertThat(before.toMap()).containsOnlyKeys("/api/:x");
    }

    @Test
    void registration_publishes_a_copy() {
        var before = ((DefaultRouter) testee).tree();
        testee.get("/x", noop());
        assertThat(((DefaultRouter) testee).tree()).isNotSameAs(before);
        assertThat(before.toMap()).isEmpty();
    }

    @Test
    void merge_and_nest() {
        var users = Router.create().get("/", named("list")).get("/:id", named("one"));
        var admin = Router.create().get("/stats", named("stats"));
        testee.get("/", named("index"))
              .nest("/users", users)
              .merge(admin);
        assertThat(dispatch(get("/users")).bodyAsText()).isEqualTo("list");
        ch = new TestChannel();
        assertThat(dispatch(get("/users/3")).bodyAsText()).isEqualTo("one");
        ch = new TestChannel();
        assertThat(dispatch(get("/stats")).bodyAsText()).isEqualTo("stats");
        // Source is left intact
        assertThat(((DefaultRouter) users).tree().toMap()).containsOnlyKeys("/", "/:id");
    }

    @Test
    void merge_self() {
        testee.get("/a", named("a"));
        testee.merge(testee);
        assertThat(dispatch(get("/a")).bodyAsText()).isEqualTo("a");
    }

    @Test
    void merge_foreign_implementation() {
        Router foreign = mock(Router.class);
        assertThatThrownBy(() -> testee.merge(foreign))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Router implementation not supported: ");
        assertThatThrownBy(() -> testee.nest("/x", foreign))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describe() {
        testee.get("/", named("Index")).get("/items/:id", named("GetItem"));
        assertThat(testee.describe()).isEqualTo("""
                /
                  [GET] -> Index
                  ├─ items
                      ├─ :id
                          [GET] -> GetItem
                """);
    }

    @Test
    void concurrent_registrations_are_all_published() throws InterruptedException {
        final int threads = 8, perThread = 50;
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; ++t) {
            final int id = t;
            workers.add(new Thread(() -> {
                for (int i = 0; i < perThread; ++i) {
                    testee.get("/t" + id + "/r" + i, noop());
                    // Dispatching concurrently with registration
                    testee.dispatch(get("/t" + id + "/r" + i), new TestChannel());
                }
            }));
        }
        workers.forEach(Thread::start);
        for (Thread w : workers) {
            w.join();
        }
        assertThat(((DefaultRouter) testee).tree().toMap()).hasSize(threads * perThread);
    }

    private Response dispatch(RawRequest req) {
        testee.dispatch(req, ch).toCompletableFuture().join();
        return ch.response();
    }
}
