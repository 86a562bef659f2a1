package alpha.treerouter.core;

import alpha.treerouter.route.RoutePatternInvalidException;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;

/**
 * Splits paths and path patterns into segments.<p>
 *
 * The leading forward slash is the root and produces no segment. Every
 * subsequent slash delimits a segment, which may be empty:
 *
 * <pre>
 *   "/"      -{@literal >} []
 *   "/a/:b"  -{@literal >} ["a", ":b"]
 *   "/a/"    -{@literal >} ["a", ""]
 * </pre>
 *
 * @author TreeRouter authors
 */
final class Segments
{
    static final char   COLON_CH  = ':';
    static final String COLON_STR = ":";

    private Segments() {
        // Empty
    }

    /**
     * Splits a path pattern.
     *
     * @param pattern to split
     *
     * @return an unmodifiable list of segments
     *
     * @throws RoutePatternInvalidException
     *             if the pattern does not start with '/', or
     *             if a capture segment has no name
     */
    static List<String> ofPattern(String pattern) {
        if (pattern.isEmpty() || pattern.charAt(0) != '/') {
            throw new RoutePatternInvalidException(
                    "Pattern must start with a forward slash: \"" + pattern + "\".");
        }
        List<String> segments = split(pattern);
        for (String s : segments) {
            if (s.equals(COLON_STR)) {
                throw new RoutePatternInvalidException(
                        "Capture segment has no name in \"" + pattern + "\".");
            }
        }
        return segments;
    }

    /**
     * Splits a request path.
     *
     * @param path to split
     *
     * @return an unmodifiable list of segments,
     *         or {@code null} if the path does not start with '/'
     */
    static List<String> ofPath(String path) {
        if (path.isEmpty() || path.charAt(0) != '/') {
            return null;
        }
        return split(path);
    }

    static boolean isCapture(String segment) {
        return !segment.isEmpty() && segment.charAt(0) == COLON_CH;
    }

    static String captureName(String segment) {
        assert isCapture(segment);
        return segment.substring(1);
    }

    private static List<String> split(String str) {
        if (str.length() == 1) {
            return List.of();
        }
        List<String> l = new ArrayList<>();
        int start = 1;
        for (int end = 1; end <= str.length(); ++end) {
            if (end == str.length() || str.charAt(end) == '/') {
                l.add(str.substring(start, end));
                start = end + 1;
            }
        }
        return unmodifiableList(l);
    }
}
