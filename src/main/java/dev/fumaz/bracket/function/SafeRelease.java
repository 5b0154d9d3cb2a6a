package dev.fumaz.bracket.function;

import org.jetbrains.annotations.NotNull;

/**
 * Frees an acquired resource without a failure channel.
 *
 * @param <R> the type of the resource
 */
@FunctionalInterface
public interface SafeRelease<R> {

    void release(R resource);

    /**
     * Adapts this release to the {@link Release} contract. The adapted release performs the effect and then
     * reports success.
     */
    default <E extends Exception> @NotNull Release<R, E> asRelease() {
        return resource -> release(resource);
    }

}
