package dev.fumaz.bracket;

import dev.fumaz.bracket.exception.CombinedFailureException;
import dev.fumaz.bracket.function.Acquire;
import dev.fumaz.bracket.function.Release;
import dev.fumaz.bracket.function.SafeRelease;
import dev.fumaz.bracket.function.Use;
import dev.fumaz.bracket.outcome.Outcome;
import dev.fumaz.bracket.resource.SafeCloseable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Entry point for the bracket pattern: acquire a resource, use it, and always release it exactly once.
 * <p>
 * Two families of operations are offered. The {@code bracket}/{@code withResource} methods report failures by
 * throwing them, inferring the thrown type from the callbacks. When both the use and the release fail, the use
 * failure is thrown and the release failure is attached to it with {@link Throwable#addSuppressed(Throwable)}.
 * The {@code attempt} methods never throw for callback failures and instead return an {@link Outcome} that keeps
 * every failure apart.
 * <pre>{@code
 * String firstLine = Bracket.bracket(
 *         () -> Files.newBufferedReader(path),
 *         BufferedReader::close,
 *         BufferedReader::readLine);
 * }</pre>
 */
public final class Bracket {

    private Bracket() {
    }

    /**
     * Acquires a resource, passes it to {@code use} and releases it with {@code release}, whatever {@code use} does.
     *
     * @return the value produced by {@code use}
     * @throws E the acquisition failure, the use failure (with any release failure suppressed on it), or the release
     *           failure when only the release failed
     * @throws CombinedFailureException when both failed and the use failure was created with suppression disabled
     */
    public static <R, T, E extends Exception> @Nullable T bracket(@NotNull Acquire<R, E> acquire,
                                                                  @NotNull Release<? super R, E> release,
                                                                  @NotNull Use<? super R, T, E> use) throws E {
        return Bracket.<T, E>unwrap(BracketEngine.<R, T>execute(acquire, release, use));
    }

    /**
     * Same as {@link #bracket(Acquire, Release, Use)} for a release that cannot report a failure.
     */
    public static <R, T, E extends Exception> @Nullable T bracketInfallible(@NotNull Acquire<R, E> acquire,
                                                                            @NotNull SafeRelease<? super R> release,
                                                                            @NotNull Use<? super R, T, E> use)
            throws E {
        Objects.requireNonNull(release, "release");
        return Bracket.<R, T, E>bracket(acquire, release.<E>asRelease(), use);
    }

    /**
     * Acquires an {@link AutoCloseable}, passes it to {@code use} and closes it afterwards.
     * <p>
     * Behaves like {@code bracket(acquire, AutoCloseable::close, use)} with one exception: a {@code null} resource is
     * reported as an acquisition failure and neither {@code use} nor {@code close} runs, whereas {@code bracket} would
     * pass it to {@code use} and fail in the release step.
     */
    public static <R extends AutoCloseable, T> @Nullable T withResource(@NotNull Acquire<R, ? extends Exception> acquire,
                                                                        @NotNull Use<? super R, T, ? extends Exception> use)
            throws Exception {
        Objects.requireNonNull(acquire, "acquire");
        Objects.requireNonNull(use, "use");

        return Bracket.<R, T, Exception>bracket(() -> requireResource(acquire.acquire()), AutoCloseable::close, use::use);
    }

    /**
     * Acquires a {@link SafeCloseable}, passes it to {@code use} and closes it afterwards.
     * <p>
     * Behaves like {@code bracketInfallible(acquire, SafeCloseable::close, use)} except that a {@code null} resource is
     * reported as an acquisition failure before {@code use} runs.
     */
    public static <R extends SafeCloseable, T, E extends Exception> @Nullable T withResourceInfallible(
            @NotNull Acquire<R, E> acquire,
            @NotNull Use<? super R, T, E> use) throws E {
        Objects.requireNonNull(acquire, "acquire");

        return Bracket.<R, T, E>bracketInfallible(() -> requireResource(acquire.acquire()), SafeCloseable::close, use);
    }

    /**
     * Runs the bracket and reports how it ended instead of throwing.
     */
    public static <R, T> @NotNull Outcome<T> attempt(@NotNull Acquire<R, ?> acquire,
                                                     @NotNull Release<? super R, ?> release,
                                                     @NotNull Use<? super R, T, ?> use) {
        return BracketEngine.<R, T>execute(acquire, release, use);
    }

    public static <R, T> @NotNull Outcome<T> attemptInfallible(@NotNull Acquire<R, ?> acquire,
                                                               @NotNull SafeRelease<? super R> release,
                                                               @NotNull Use<? super R, T, ?> use) {
        Objects.requireNonNull(release, "release");
        return BracketEngine.<R, T>execute(acquire, release.<RuntimeException>asRelease(), use);
    }

    /**
     * Outcome form of {@link #withResource(Acquire, Use)}, with the same handling of a {@code null} resource.
     */
    public static <R extends AutoCloseable, T> @NotNull Outcome<T> attemptWithResource(@NotNull Acquire<R, ?> acquire,
                                                                                       @NotNull Use<? super R, T, ?> use) {
        Objects.requireNonNull(acquire, "acquire");
        Release<R, Exception> close = AutoCloseable::close;

        return BracketEngine.<R, T>execute(() -> requireResource(acquire.acquire()), close, use);
    }

    public static <R extends SafeCloseable, T> @NotNull Outcome<T> attemptWithResourceInfallible(
            @NotNull Acquire<R, ?> acquire,
            @NotNull Use<? super R, T, ?> use) {
        Objects.requireNonNull(acquire, "acquire");
        SafeRelease<R> close = SafeCloseable::close;

        return Bracket.<R, T>attemptInfallible(() -> requireResource(acquire.acquire()), close, use);
    }

    private static <R> R requireResource(R resource) {
        return Objects.requireNonNull(resource, "acquire produced a null resource");
    }

    private static <T, E extends Exception> T unwrap(Outcome<T> outcome) throws E {
        switch (outcome.getStatus()) {
            case SUCCEEDED:
                return outcome.getValue();
            case ACQUIRE_FAILED:
                throw Bracket.<E>failure(outcome.getAcquireFailure());
            case USE_FAILED:
                throw Bracket.<E>failure(outcome.getUseFailure());
            case RELEASE_FAILED:
                throw Bracket.<E>failure(outcome.getReleaseFailure());
            case USE_AND_RELEASE_FAILED:
                Exception useFailure = outcome.getUseFailure();
                Exception releaseFailure = outcome.getReleaseFailure();

                if (!BracketEngine.attach(useFailure, releaseFailure)) {
                    throw new CombinedFailureException(useFailure, releaseFailure);
                }

                throw Bracket.<E>failure(useFailure);
            default:
                throw new IllegalStateException("Unknown outcome status " + outcome.getStatus());
        }
    }

    // Every failure in an outcome was thrown by a callback declared to throw E, or is unchecked.
    @SuppressWarnings("unchecked")
    private static <E extends Exception> E failure(Exception failure) {
        return (E) failure;
    }
}
