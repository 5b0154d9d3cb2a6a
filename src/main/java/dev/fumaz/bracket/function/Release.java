package dev.fumaz.bracket.function;

/**
 * Frees an acquired resource, possibly failing while doing so.
 *
 * @param <R> the type of the resource
 * @param <E> the type of the failure raised while releasing
 */
@FunctionalInterface
public interface Release<R, E extends Exception> {

    void release(R resource) throws E;

}
