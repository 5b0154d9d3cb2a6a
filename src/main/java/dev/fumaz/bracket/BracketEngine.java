package dev.fumaz.bracket;

import dev.fumaz.bracket.exception.CombinedFailureException;
import dev.fumaz.bracket.function.Acquire;
import dev.fumaz.bracket.function.Release;
import dev.fumaz.bracket.function.Use;
import dev.fumaz.bracket.outcome.Outcome;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the acquire, use and release steps of a single bracket invocation and classifies how it ended.
 * <p>
 * Once {@code acquire} returns, {@code release} runs exactly once, including when {@code use} exits with an
 * {@link Error}. Such throwables are not outcomes: they propagate after the release, carrying the failure of the
 * other step as a suppressed exception. A throwable with suppression disabled is replaced by a
 * {@link CombinedFailureException} holding both.
 */
final class BracketEngine {

    private static final Logger LOGGER = Logger.getLogger(BracketEngine.class.getName());

    private BracketEngine() {
    }

    static <R, T> @NotNull Outcome<T> execute(@NotNull Acquire<? extends R, ?> acquire,
                                              @NotNull Release<? super R, ?> release,
                                              @NotNull Use<? super R, ? extends T, ?> use) {
        Objects.requireNonNull(acquire, "acquire");
        Objects.requireNonNull(release, "release");
        Objects.requireNonNull(use, "use");

        R resource;
        try {
            resource = acquire.acquire();
        } catch (Exception failure) {
            return Outcome.acquireFailed(failure);
        }

        T value;
        try {
            value = use.use(resource);
        } catch (Exception useFailure) {
            Exception releaseFailure;
            try {
                releaseFailure = release(release, resource);
            } catch (Throwable releaseError) {
                LOGGER.log(Level.FINE, "Release of " + describe(resource) + " failed with "
                        + releaseError.getClass().getName() + " after use failed", releaseError);

                if (!attach(releaseError, useFailure)) {
                    throw new CombinedFailureException(useFailure, releaseError);
                }

                throw releaseError;
            }

            if (releaseFailure == null) {
                return Outcome.useFailed(useFailure);
            }

            LOGGER.log(Level.FINE, "Release failed after use failed for " + describe(resource)
                    + "; reporting both failures", releaseFailure);
            return Outcome.useAndReleaseFailed(useFailure, releaseFailure);
        } catch (Throwable abrupt) {
            Throwable releaseFailure = releaseAfterAbruptUse(release, resource, abrupt);

            if (releaseFailure != null && !attach(abrupt, releaseFailure)) {
                throw new CombinedFailureException(abrupt, releaseFailure);
            }

            throw abrupt;
        }

        Exception releaseFailure = release(release, resource);
        if (releaseFailure != null) {
            return Outcome.releaseFailed(releaseFailure);
        }

        return Outcome.succeeded(value);
    }

    private static <R> @Nullable Exception release(Release<? super R, ?> release, R resource) {
        try {
            release.release(resource);
            return null;
        } catch (Exception failure) {
            LOGGER.log(Level.FINE, "Failed to release " + describe(resource), failure);
            return failure;
        }
    }

    private static <R> @Nullable Throwable releaseAfterAbruptUse(Release<? super R, ?> release, R resource,
                                                                 Throwable abrupt) {
        try {
            release.release(resource);
            return null;
        } catch (Throwable releaseFailure) {
            LOGGER.log(Level.FINE, "Release of " + describe(resource) + " failed while "
                    + abrupt.getClass().getName() + " propagated from use", releaseFailure);
            return releaseFailure;
        }
    }

    /**
     * Records {@code other} as suppressed by {@code carrier}.
     *
     * @return whether {@code carrier} now reports {@code other}; {@code false} when its suppression is disabled
     */
    static boolean attach(@NotNull Throwable carrier, @NotNull Throwable other) {
        if (carrier == other) {
            return true;
        }

        carrier.addSuppressed(other);

        for (Throwable suppressed : carrier.getSuppressed()) {
            if (suppressed == other) {
                return true;
            }
        }

        return false;
    }

    private static String describe(Object resource) {
        return resource == null ? "null resource" : resource.getClass().getName();
    }
}
