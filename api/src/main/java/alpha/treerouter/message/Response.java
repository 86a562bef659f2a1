package alpha.treerouter.message;

import alpha.treerouter.handler.ClientChannel;

import java.net.http.HttpHeaders;

/**
 * An immutable HTTP response.<p>
 *
 * A response is written to the client using
 * {@link ClientChannel#write(Response)}. Ready-built responses are available
 * in {@link Responses}; custom responses are built with
 * {@link #builder(int)}:
 *
 * <pre>
 *   Response rsp = Response.builder(201)
 *                          .header("Location", "/items/42")
 *                          .body("Created", "text/plain; charset=utf-8")
 *                          .build();
 * </pre>
 *
 * @author TreeRouter authors
 */
public interface Response
{
    /**
     * Returns a builder of a response with the given status code.
     *
     * @param statusCode of response
     *
     * @return a builder
     *
     * @throws IllegalArgumentException
     *             if {@code statusCode} is not a three-digit number
     */
    static Response.Builder builder(int statusCode) {
        return DefaultResponse.Builder.ROOT.statusCode(statusCode);
    }

    /**
     * Returns the status code.
     *
     * @return the status code
     */
    int statusCode();

    /**
     * Returns the headers.
     *
     * @return the headers (never {@code null})
     */
    HttpHeaders headers();

    /**
     * Returns a copy of the body.
     *
     * @return the body (never {@code null}, may be empty)
     */
    byte[] body();

    /**
     * Returns the body decoded as UTF-8.
     *
     * @return the body (never {@code null}, may be empty)
     */
    String bodyAsText();

    /**
     * Returns a builder pre-populated with the state of this response.
     *
     * @return a builder
     */
    Response.Builder toBuilder();

    /**
     * Builder of {@link Response}. The builder is immutable.
     */
    interface Builder {
        /**
         * Set the status code.
         *
         * @param statusCode of response
         * @return a new builder
         * @throws IllegalArgumentException
         *             if {@code statusCode} is not a three-digit number
         */
        Builder statusCode(int statusCode);

        /**
         * Set a header, replacing any value(s) previously set.
         *
         * @param name of header
         * @param value of header
         * @return a new builder
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder header(String name, String value);

        /**
         * Set the body and the Content-Type header.
         *
         * @param body bytes
         * @param contentType media type of body
         * @return a new builder
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder body(byte[] body, String contentType);

        /**
         * Set the body encoded as UTF-8 and the Content-Type header.
         *
         * @param body text
         * @param contentType media type of body
         * @return a new builder
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder body(String body, String contentType);

        /**
         * Builds the response.
         *
         * @return a response
         */
        Response build();
    }
}
