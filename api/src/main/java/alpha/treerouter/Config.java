package alpha.treerouter;

import alpha.treerouter.handler.PayloadHandler;

/**
 * Router configuration.<p>
 *
 * The configuration is immutable. Use {@link #configuration()} to start from
 * the {@link #DEFAULT} values, or {@link #toBuilder()} to derive a new
 * configuration from an existing one:
 *
 * <pre>
 *   Config config = Config.configuration()
 *                         .maxRequestBodySize(64 * 1_024)
 *                         .build();
 *   Router router = Router.create(config);
 * </pre>
 *
 * @author TreeRouter authors
 */
public interface Config
{
    /**
     * Values used:<p>
     *
     * Max request body size = 1,048,576 bytes (1 MiB)
     */
    Config DEFAULT = DefaultConfig.Builder.ROOT.build();

    /**
     * Returns the max number of bytes a payload route accepts in a request
     * body.<p>
     *
     * This is the cap used by payload registrations that do not specify their
     * own. A request declaring a larger {@code Content-Length} is rejected
     * with a 413 (Request Entity Too Large) response. A request whose body
     * turns out to be larger than declared has its connection closed as soon
     * as the cap is exceeded.
     *
     * @return max number of request body bytes
     *
     * @see Router#post(String, PayloadHandler)
     */
    long maxRequestBodySize();

    /**
     * Returns a builder pre-populated with the values of this configuration.
     *
     * @return a builder
     */
    Config.Builder toBuilder();

    /**
     * Returns a builder pre-populated with the {@link #DEFAULT} values.
     *
     * @return a builder
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Builder of {@link Config}.<p>
     *
     * The builder is immutable; every setter returns a new builder instance.
     */
    interface Builder {
        /**
         * Set a new value.
         *
         * @param newVal new value
         *
         * @return a new builder representing the new state
         *
         * @throws IllegalArgumentException if {@code newVal} is negative
         *
         * @see Config#maxRequestBodySize()
         */
        Builder maxRequestBodySize(long newVal);

        /**
         * Builds the configuration.
         *
         * @return a configuration
         */
        Config build();
    }
}
