package alpha.treerouter.util;

import java.net.URLDecoder;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Util for percent-decoding.
 *
 * @author TreeRouter authors
 */
public final class PercentDecoder
{
    private PercentDecoder() {
        // Empty
    }

    /**
     * Percent-decodes a path segment.<p>
     *
     * Unlike {@link URLDecoder}, a plus character is retained as-is; plus
     * means space only in form data.
     *
     * @param str to decode
     *
     * @return the decoded string
     *
     * @throws IllegalArgumentException
     *             if an escape sequence is malformed
     */
    public static String decode(String str) {
        final int p = str.indexOf('+');
        if (p == -1) {
            // No plus characters? JDK-decode the entire string
            return URLDecoder.decode(str, UTF_8);
        } else {
            // Else decode chunks in-between
            return decode(str.substring(0, p)) + "+" + decode(str.substring(p + 1));
        }
    }

    /**
     * Decodes a query key or value using the
     * {@code application/x-www-form-urlencoded} rules; a plus character becomes
     * a space.
     *
     * @param str to decode
     *
     * @return the decoded string
     *
     * @throws IllegalArgumentException
     *             if an escape sequence is malformed
     */
    public static String decodeForm(String str) {
        return URLDecoder.decode(str, UTF_8);
    }
}
