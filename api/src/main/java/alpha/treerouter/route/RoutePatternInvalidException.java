package alpha.treerouter.route;

/**
 * Thrown by {@link RouteRegistry} if a path pattern is not valid.
 *
 * @author TreeRouter authors
 */
public class RoutePatternInvalidException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code RoutePatternInvalidException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RoutePatternInvalidException(String message) {
        super(message);
    }
}
