package alpha.treerouter.message;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Responses} and {@link Response.Builder}.
 *
 * @author TreeRouter authors
 */
class ResponsesTest
{
    @Test
    void notFound() {
        assertResponse(Responses.notFound(), 404, "Route Not Found");
    }

    @Test
    void internalServerError() {
        assertResponse(Responses.internalServerError(), 500, "Internal Server Error");
    }

    @Test
    void entityTooLarge() {
        assertResponse(Responses.entityTooLarge(), 413, "Request Entity Too Large");
    }

    @Test
    void unsupportedMediaType() {
        assertResponse(Responses.unsupportedMediaType(), 415, "Unsupported Media Type");
    }

    @Test
    void invalidJson() {
        assertResponse(Responses.invalidJson(), 400, "Invalid JSON");
    }

    @Test
    void json_contentType() {
        var r = Responses.json("[1]");
        assertThat(r.headers().firstValue("content-type"))
                .hasValue("application/json; charset=utf-8");
        assertThat(r.bodyAsText()).isEqualTo("[1]");
    }

    @Test
    void status_noBody() {
        var r = Responses.status(204);
        assertThat(r.statusCode()).isEqualTo(204);
        assertThat(r.body()).isEmpty();
        assertThat(r.headers().map()).isEmpty();
    }

    @Test
    void toBuilder_leaves_original_intact() {
        var orig = Responses.text("I'm a teapot");
        var teapot = orig.toBuilder().statusCode(418).header("X-Brew", "tea").build();
        assertThat(teapot.statusCode()).isEqualTo(418);
        assertThat(teapot.bodyAsText()).isEqualTo("I'm a teapot");
        assertThat(teapot.headers().firstValue("x-brew")).hasValue("tea");
        assertThat(orig.statusCode()).isEqualTo(200);
        assertThat(orig.headers().firstValue("X-Brew")).isEmpty();
    }

    @Test
    void header_replaces_case_insensitively() {
        var r = Response.builder(200)
                .header("X-Thing", "a")
                .header("x-thing", "b")
                .build();
        assertThat(r.headers().allValues("X-THING")).containsExactly("b");
    }

    @Test
    void body_is_copied() {
        byte[] bytes = {1, 2, 3};
        var r = Responses.ok(bytes, "application/octet-stream");
        bytes[0] = 9;
        assertThat(r.body()).containsExactly(1, 2, 3);
        r.body()[1] = 9;
        assertThat(r.body()).containsExactly(1, 2, 3);
    }

    @Test
    void statusCode_must_have_three_digits() {
        assertThatThrownBy(() -> Response.builder(99))
                .isExactlyInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Response.builder(1_000))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    private static void assertResponse(Response r, int code, String body) {
        assertThat(r.statusCode()).isEqualTo(code);
        assertThat(r.bodyAsText()).isEqualTo(body);
        assertThat(r.headers().firstValue("Content-Type"))
                .hasValue("text/plain; charset=utf-8");
    }
}
