package alpha.treerouter.examples;

import alpha.treerouter.Router;
import alpha.treerouter.message.RawRequest;
import alpha.treerouter.message.Response;
import alpha.treerouter.testutil.TestChannel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static alpha.treerouter.testutil.TestRequests.get;
import static alpha.treerouter.testutil.TestRequests.postJson;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests of the example applications, without a server.
 *
 * @author TreeRouter authors
 */
class ExamplesTest
{
    @Test
    void hello_world() {
        var rsp = exchange(HelloWorld.router(), get("/"));
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.bodyAsText()).isEqualTo("Hello World!");
    }

    @Test
    void greet_parameter() {
        var app = GreetParameter.router();
        assertThat(exchange(app, get("/hello/John")).bodyAsText()).isEqualTo("Hello John!");
        assertThat(exchange(app, get("/hello?name=John")).bodyAsText()).isEqualTo("Hello John!");
        assertThat(exchange(app, get("/hello/J%C3%B6rgen")).bodyAsText()).isEqualTo("Hello Jörgen!");
        var missing = exchange(app, get("/hello"));
        assertThat(missing.statusCode()).isEqualTo(400);
        assertThat(missing.bodyAsText()).isEqualTo("Missing name");
    }

    @Test
    void greet_body() {
        var app = GreetBody.router();
        assertThat(exchange(app, postJson("/greet", "{\"name\":\"John\"}")).bodyAsText())
                .isEqualTo("Hello John!");
        assertThat(exchange(app, postJson("/greet", "{}")).statusCode()).isEqualTo(400);
        assertThat(exchange(app, postJson("/greet", "{\"name\":\"" + "x".repeat(1_024) + "\"}"))
                .statusCode()).isEqualTo(413);
    }

    @Test
    void continents_api() throws IOException {
        var app = Continents.router(null);
        assertThat(exchange(app, get("/")).bodyAsText()).contains("Continents");
        var all = exchange(app, get("/api/continents"));
        assertThat(all.headers().firstValue("Content-Type"))
                .hasValue("application/json; charset=utf-8");
        assertThat(all.bodyAsText()).startsWith("[\"Africa\",").endsWith("\"South America\"]");
        assertThat(exchange(app, get("/api/continents/4")).bodyAsText()).isEqualTo("Europe");
    }

    @Test
    void continents_error_handler() throws IOException {
        var app = Continents.router(null);
        var outOfRange = exchange(app, get("/api/continents/99"));
        assertThat(outOfRange.statusCode()).isEqualTo(404);
        assertThat(outOfRange.bodyAsText()).startsWith("Failed: ");
        var notANumber = exchange(app, get("/api/continents/x"));
        assertThat(notANumber.statusCode()).isEqualTo(404);
        assertThat(notANumber.bodyAsText()).isEqualTo("Failed: NumberFormatException");
        assertThat(exchange(app, get("/api/nope")).statusCode()).isEqualTo(404);
    }

    @Test
    void continents_static_assets(@TempDir Path tmp) throws IOException {
        Path web = Files.createDirectory(tmp.resolve("web"));
        Files.writeString(web.resolve("style.css"), "h1 {}");
        var app = Continents.router(web);
        var rsp = exchange(app, get("/web/style.css"));
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.headers().firstValue("Content-Type")).hasValue("text/css");
        assertThat(rsp.bodyAsText()).isEqualTo("h1 {}");
    }

    private static Response exchange(Router app, RawRequest req) {
        var ch = new TestChannel();
        app.dispatch(req, ch).toCompletableFuture().join();
        return ch.response();
    }
}
