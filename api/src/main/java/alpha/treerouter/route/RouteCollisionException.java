package alpha.treerouter.route;

/**
 * Thrown by {@link RouteRegistry} when an attempt is made to register a route
 * whose capture segment has a different name than the capture segment already
 * registered at the same hierarchical position.<p>
 *
 * For example, given the pattern "/user/:id", registering "/user/:name/files"
 * fails. The same applies when routes are merged or nested from another
 * router.
 *
 * @author TreeRouter authors
 */
public class RouteCollisionException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code RouteCollisionException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RouteCollisionException(String message) {
        super(message);
    }
}
