package alpha.treerouter;

/**
 * Default implementation of {@link Config}.
 *
 * @author TreeRouter authors
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final long    maxRequestBodySize;

    private DefaultConfig(Builder b) {
        builder            = b;
        maxRequestBodySize = b.maxRequestBodySize;
    }

    @Override
    public long maxRequestBodySize() {
        return maxRequestBodySize;
    }

    @Override
    public Config.Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() +
                "{maxRequestBodySize=" + maxRequestBodySize + "}";
    }

    static final class Builder implements Config.Builder
    {
        static final Builder ROOT = new Builder(1_048_576);

        private final long maxRequestBodySize;

        private Builder(long maxRequestBodySize) {
            this.maxRequestBodySize = maxRequestBodySize;
        }

        @Override
        public Config.Builder maxRequestBodySize(long newVal) {
            if (newVal < 0) {
                throw new IllegalArgumentException(
                        "Max request body size is negative: " + newVal);
            }
            return new Builder(newVal);
        }

        @Override
        public Config build() {
            return new DefaultConfig(this);
        }
    }
}
