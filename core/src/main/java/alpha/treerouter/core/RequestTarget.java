package alpha.treerouter.core;

import alpha.treerouter.util.PercentDecoder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * The request-target of a request, split into a path and a query.<p>
 *
 * The path is everything up until the first question mark, as-is. It is not
 * normalized and not percent-decoded. The query is everything after the first
 * question mark, parsed lazily into a map:
 *
 * <ul>
 *   <li>Pairs are separated by '&amp;', empty pairs are skipped.</li>
 *   <li>A pair is split at the first '='. A key without '=' maps to the empty
 *       string.</li>
 *   <li>Keys and values are form-decoded; '+' becomes a space.</li>
 *   <li>A repeated key collects all its values, in order of appearance.</li>
 *   <li>A key or value that can not be decoded is kept as-is.</li>
 * </ul>
 *
 * @author TreeRouter authors
 */
final class RequestTarget
{
    private static final System.Logger LOG
            = System.getLogger(RequestTarget.class.getPackageName());

    /**
     * Parse the given input.
     *
     * @param rt raw request-target
     *
     * @return a complex type of the input
     *
     * @throws NullPointerException if {@code rt} is {@code null}
     */
    static RequestTarget parse(String rt) {
        final int q = rt.indexOf('?');
        return q == -1 ?
                new RequestTarget(rt, rt, "") :
                new RequestTarget(rt, rt.substring(0, q), rt.substring(q + 1));
    }

    private final String raw, path, query;

    private RequestTarget(String raw, String path, String query) {
        this.raw   = raw;
        this.path  = path;
        this.query = query;
    }

    /**
     * Returns the request-target as received.
     *
     * @return the raw request-target
     */
    String raw() {
        return raw;
    }

    /**
     * Returns the path component.
     *
     * @return the path (never {@code null})
     */
    String path() {
        return path;
    }

    /**
     * Returns the query component, without the question mark.
     *
     * @return the query (never {@code null}, may be empty)
     */
    String query() {
        return query;
    }

    private Map<String, List<String>> queryMap;

    /**
     * Returns the parsed query.
     *
     * @return an unmodifiable map of unmodifiable lists
     */
    Map<String, List<String>> queryMap() {
        Map<String, List<String>> m = queryMap;
        return m != null ? m : (queryMap = parseQuery());
    }

    private Map<String, List<String>> parseQuery() {
        if (query.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> m = new LinkedHashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            final int eq = pair.indexOf('=');
            String k = eq == -1 ? pair : pair.substring(0, eq),
                   v = eq == -1 ? ""   : pair.substring(eq + 1);
            m.computeIfAbsent(decode(k), ignored -> new ArrayList<>())
             .add(decode(v));
        }
        m.replaceAll((k, v) -> unmodifiableList(v));
        return unmodifiableMap(m);
    }

    /**
     * Applies the given decoder, falling back to the input if the decoder
     * rejects it.
     *
     * @param str to decode
     * @param decoder to apply
     *
     * @return the decoded string, or {@code str} if malformed
     */
    static String decodeOrKeep(String str, UnaryOperator<String> decoder) {
        try {
            return decoder.apply(str);
        } catch (IllegalArgumentException e) {
            LOG.log(DEBUG, () -> "Malformed percent-encoding, keeping \"" + str + "\" as-is.");
            return str;
        }
    }

    private static String decode(String str) {
        return decodeOrKeep(str, PercentDecoder::decodeForm);
    }
}
