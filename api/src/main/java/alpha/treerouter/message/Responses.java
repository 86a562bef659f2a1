package alpha.treerouter.message;

import alpha.treerouter.Router;

import static alpha.treerouter.HttpConstants.ReasonPhrase.ENTITY_TOO_LARGE;
import static alpha.treerouter.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.treerouter.HttpConstants.ReasonPhrase.UNSUPPORTED_MEDIA_TYPE;
import static alpha.treerouter.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.treerouter.HttpConstants.StatusCode.FOUR_HUNDRED;
import static alpha.treerouter.HttpConstants.StatusCode.FOUR_HUNDRED_FIFTEEN;
import static alpha.treerouter.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.treerouter.HttpConstants.StatusCode.FOUR_HUNDRED_THIRTEEN;
import static alpha.treerouter.HttpConstants.StatusCode.TWO_HUNDRED;

/**
 * Factories of {@link Response}s.<p>
 *
 * Even though this class produces ready-built responses, further modifications
 * of the response is easy to accomplish using {@code toBuilder()}.
 *
 * <pre>
 *   Response teapot = Responses.text("I'm a teapot")
 *                              .toBuilder()
 *                              .statusCode(418)
 *                              .build();
 * </pre>
 *
 * The error responses have a short text body. These are the responses the
 * router itself writes when the application has not registered a handler of
 * its own, see {@link Router#notFound(alpha.treerouter.handler.RequestHandler)}
 * and {@link Router#onError(alpha.treerouter.handler.ErrorHandler)}.
 *
 * @author TreeRouter authors
 */
public final class Responses
{
    private static final String
            TEXT_PLAIN = "text/plain; charset=utf-8",
            TEXT_HTML  = "text/html; charset=utf-8",
            JSON       = "application/json; charset=utf-8";

    private static final Response
            NOT_FOUND          = text(FOUR_HUNDRED_FOUR, "Route Not Found"),
            TOO_LARGE          = text(FOUR_HUNDRED_THIRTEEN, ENTITY_TOO_LARGE),
            UNSUPPORTED_MEDIA  = text(FOUR_HUNDRED_FIFTEEN, UNSUPPORTED_MEDIA_TYPE),
            INVALID_JSON       = text(FOUR_HUNDRED, "Invalid JSON"),
            SERVER_ERROR       = text(FIVE_HUNDRED, INTERNAL_SERVER_ERROR);

    private Responses() {
        // Empty
    }

    /**
     * Returns a response with the given status code and no body.
     *
     * @param code status code
     * @return a response
     * @throws IllegalArgumentException
     *             if {@code code} is not a three-digit number
     */
    public static Response status(int code) {
        return Response.builder(code).build();
    }

    /**
     * Returns a 200 (OK) response with a text body.<p>
     *
     * The Content-Type header is "text/plain; charset=utf-8".
     *
     * @param textPlain body
     * @return a response
     * @throws NullPointerException if {@code textPlain} is {@code null}
     */
    public static Response text(String textPlain) {
        return text(TWO_HUNDRED, textPlain);
    }

    /**
     * Returns a response with the given status code and a text body.
     *
     * @param code status code
     * @param textPlain body
     * @return a response
     * @throws NullPointerException if {@code textPlain} is {@code null}
     */
    public static Response text(int code, String textPlain) {
        return Response.builder(code).body(textPlain, TEXT_PLAIN).build();
    }

    /**
     * Returns a 200 (OK) response with an HTML body.
     *
     * @param textHtml body
     * @return a response
     * @throws NullPointerException if {@code textHtml} is {@code null}
     */
    public static Response html(String textHtml) {
        return Response.builder(TWO_HUNDRED).body(textHtml, TEXT_HTML).build();
    }

    /**
     * Returns a 200 (OK) response with a JSON body.
     *
     * @param json body
     * @return a response
     * @throws NullPointerException if {@code json} is {@code null}
     */
    public static Response json(String json) {
        return Response.builder(TWO_HUNDRED).body(json, JSON).build();
    }

    /**
     * Returns a 200 (OK) response with an arbitrary body.
     *
     * @param body bytes
     * @param contentType media type
     * @return a response
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Response ok(byte[] body, String contentType) {
        return Response.builder(TWO_HUNDRED).body(body, contentType).build();
    }

    /**
     * Returns a 404 (Not Found) response with body "Route Not Found".
     *
     * @return a response
     */
    public static Response notFound() {
        return NOT_FOUND;
    }

    /**
     * Returns a 413 (Request Entity Too Large) response.
     *
     * @return a response
     */
    public static Response entityTooLarge() {
        return TOO_LARGE;
    }

    /**
     * Returns a 415 (Unsupported Media Type) response.
     *
     * @return a response
     */
    public static Response unsupportedMediaType() {
        return UNSUPPORTED_MEDIA;
    }

    /**
     * Returns a 400 (Bad Request) response with body "Invalid JSON".
     *
     * @return a response
     */
    public static Response invalidJson() {
        return INVALID_JSON;
    }

    /**
     * Returns a 500 (Internal Server Error) response.
     *
     * @return a response
     */
    public static Response internalServerError() {
        return SERVER_ERROR;
    }
}
