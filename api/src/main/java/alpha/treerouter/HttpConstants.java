package alpha.treerouter;

/**
 * Namespace of HTTP constants used by the router and its collaborators.<p>
 *
 * Only a small subset of the constants registered by IANA are declared here;
 * the ones the router itself produces or inspects, plus the common method
 * tokens used by the convenience registrars of {@link Router}.
 *
 * @author TreeRouter authors
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * Method tokens.<p>
     *
     * Any string is a valid method token to the router. The tokens declared
     * here are simply the ones that have convenience registrars.
     */
    public static final class Method {
        private Method() {
            // Empty
        }

        /** {@value} */
        public static final String GET = "GET";
        /** {@value} */
        public static final String HEAD = "HEAD";
        /** {@value} */
        public static final String POST = "POST";
        /** {@value} */
        public static final String PUT = "PUT";
        /** {@value} */
        public static final String DELETE = "DELETE";
        /** {@value} */
        public static final String PATCH = "PATCH";
        /** {@value} */
        public static final String OPTIONS = "OPTIONS";
    }

    /**
     * Status codes produced by the router.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Empty
        }

        /** {@value} */
        public static final int TWO_HUNDRED = 200;
        /** {@value} */
        public static final int FOUR_HUNDRED = 400;
        /** {@value} */
        public static final int FOUR_HUNDRED_FOUR = 404;
        /** {@value} */
        public static final int FOUR_HUNDRED_THIRTEEN = 413;
        /** {@value} */
        public static final int FOUR_HUNDRED_FIFTEEN = 415;
        /** {@value} */
        public static final int FIVE_HUNDRED = 500;

        /**
         * Returns {@code true} if the given code is a client error (4XX).
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isClientError(int code) {
            return code >= 400 && code <= 499;
        }

        /**
         * Returns {@code true} if the given code is a server error (5XX).
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isServerError(int code) {
            return code >= 500 && code <= 599;
        }
    }

    /**
     * Reason phrases of the status codes in {@link StatusCode}.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Empty
        }

        /** {@value} */
        public static final String OK = "OK";
        /** {@value} */
        public static final String BAD_REQUEST = "Bad Request";
        /** {@value} */
        public static final String NOT_FOUND = "Not Found";
        /** {@value} */
        public static final String ENTITY_TOO_LARGE = "Request Entity Too Large";
        /** {@value} */
        public static final String UNSUPPORTED_MEDIA_TYPE = "Unsupported Media Type";
        /** {@value} */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
    }

    /**
     * Header names.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Empty
        }

        /** {@value} */
        public static final String CONTENT_TYPE = "Content-Type";
        /** {@value} */
        public static final String CONTENT_LENGTH = "Content-Length";
    }
}
