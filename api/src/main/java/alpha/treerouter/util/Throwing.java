package alpha.treerouter.util;

/**
 * Namespace for functions that throw checked exceptions.
 *
 * @author TreeRouter authors
 */
public final class Throwing {
    private Throwing() {
        // Empty
    }

    /**
     * Represents an operation that accepts two arguments and returns no
     * result.
     *
     * @param <T> the type of the first argument to the operation
     * @param <U> the type of the second argument to the operation
     * @param <X> the type of problem that can happen
     */
    @FunctionalInterface
    public interface BiConsumer<T, U, X extends Exception> {
        /**
         * Performs this operation on the given arguments.
         *
         * @param t the first input argument
         * @param u the second input argument
         * @throws X should be documented by implementation
         */
        void accept(T t, U u) throws X;
    }

    /**
     * Represents an operation that accepts three arguments and returns no
     * result.
     *
     * @param <T> the type of the first argument to the operation
     * @param <U> the type of the second argument to the operation
     * @param <V> the type of the third argument to the operation
     * @param <X> the type of problem that can happen
     */
    @FunctionalInterface
    public interface TriConsumer<T, U, V, X extends Exception> {
        /**
         * Performs this operation on the given arguments.
         *
         * @param t the first input argument
         * @param u the second input argument
         * @param v the third input argument
         * @throws X should be documented by implementation
         */
        void accept(T t, U u, V v) throws X;
    }
}
