package dev.fumaz.bracket.function;

/**
 * Obtains the resource managed by a bracket.
 *
 * @param <R> the type of the resource
 * @param <E> the type of the failure raised when the resource cannot be obtained
 */
@FunctionalInterface
public interface Acquire<R, E extends Exception> {

    R acquire() throws E;

}
