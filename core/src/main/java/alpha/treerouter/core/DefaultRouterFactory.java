package alpha.treerouter.core;

import alpha.treerouter.Config;
import alpha.treerouter.Router;
import alpha.treerouter.RouterFactory;

/**
 * Creates {@link DefaultRouter}s.<p>
 *
 * Registered as a service provider of {@link RouterFactory} and is found by
 * {@link Router#create(Config)}.
 *
 * @author TreeRouter authors
 */
public final class DefaultRouterFactory implements RouterFactory
{
    /**
     * Constructs a {@code DefaultRouterFactory}.
     */
    public DefaultRouterFactory() {
        // Empty
    }

    @Override
    public Router create(Config config) {
        return new DefaultRouter(config);
    }
}
