package dev.fumaz.bracket.function;

/**
 * Operates on an acquired resource and produces a result.
 * <p>
 * Callers that only need the side effect return {@code null}.
 *
 * @param <R> the type of the resource
 * @param <T> the type of the result
 * @param <E> the type of the failure raised while using the resource
 */
@FunctionalInterface
public interface Use<R, T, E extends Exception> {

    T use(R resource) throws E;

}
