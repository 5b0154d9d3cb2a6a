package dev.fumaz.bracket.outcome;

import dev.fumaz.bracket.exception.CombinedFailureException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The result of a single bracket invocation, reported as a value instead of a thrown exception.
 * <p>
 * Each failure keeps the phase it came from, so callers can tell an acquisition failure from a use failure,
 * a release failure, or both of the latter at once.
 *
 * @param <T> the type of the value produced by the use step
 */
public final class Outcome<T> {

    private final Status status;
    private final T value;
    private final Exception acquireFailure;
    private final Exception useFailure;
    private final Exception releaseFailure;
    private final CombinedFailureException combinedFailure;

    private Outcome(Status status, T value, Exception acquireFailure, Exception useFailure, Exception releaseFailure) {
        this.status = status;
        this.value = value;
        this.acquireFailure = acquireFailure;
        this.useFailure = useFailure;
        this.releaseFailure = releaseFailure;
        this.combinedFailure = status == Status.USE_AND_RELEASE_FAILED
                ? new CombinedFailureException(useFailure, releaseFailure)
                : null;
    }

    public static <T> @NotNull Outcome<T> succeeded(@Nullable T value) {
        return new Outcome<>(Status.SUCCEEDED, value, null, null, null);
    }

    public static <T> @NotNull Outcome<T> acquireFailed(@NotNull Exception failure) {
        return new Outcome<>(Status.ACQUIRE_FAILED, null, Objects.requireNonNull(failure, "failure"), null, null);
    }

    public static <T> @NotNull Outcome<T> useFailed(@NotNull Exception failure) {
        return new Outcome<>(Status.USE_FAILED, null, null, Objects.requireNonNull(failure, "failure"), null);
    }

    public static <T> @NotNull Outcome<T> releaseFailed(@NotNull Exception failure) {
        return new Outcome<>(Status.RELEASE_FAILED, null, null, null, Objects.requireNonNull(failure, "failure"));
    }

    public static <T> @NotNull Outcome<T> useAndReleaseFailed(@NotNull Exception useFailure,
                                                             @NotNull Exception releaseFailure) {
        return new Outcome<>(Status.USE_AND_RELEASE_FAILED, null, null,
                Objects.requireNonNull(useFailure, "useFailure"),
                Objects.requireNonNull(releaseFailure, "releaseFailure"));
    }

    public @NotNull Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    /**
     * Returns the value produced by the use step, or {@code null} when the invocation did not succeed.
     */
    public @Nullable T getValue() {
        return value;
    }

    public @Nullable Exception getAcquireFailure() {
        return acquireFailure;
    }

    public @Nullable Exception getUseFailure() {
        return useFailure;
    }

    public @Nullable Exception getReleaseFailure() {
        return releaseFailure;
    }

    /**
     * Returns the single failure describing this outcome, or {@code null} on success.
     * <p>
     * Acquisition, use and release failures are returned as they were raised. When both the use and the release
     * failed, a {@link CombinedFailureException} carrying both is returned; it is created with the outcome, so every
     * call returns the same instance.
     */
    public @Nullable Exception getFailure() {
        switch (status) {
            case ACQUIRE_FAILED:
                return acquireFailure;
            case USE_FAILED:
                return useFailure;
            case RELEASE_FAILED:
                return releaseFailure;
            case USE_AND_RELEASE_FAILED:
                return combinedFailure;
            default:
                return null;
        }
    }

    /**
     * Returns the value on success, otherwise throws the failure returned by {@link #getFailure()}.
     */
    public @Nullable T orElseThrow() throws Exception {
        Exception failure = getFailure();

        if (failure != null) {
            throw failure;
        }

        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof Outcome)) {
            return false;
        }

        Outcome<?> that = (Outcome<?>) o;
        return status == that.status
                && Objects.equals(value, that.value)
                && Objects.equals(acquireFailure, that.acquireFailure)
                && Objects.equals(useFailure, that.useFailure)
                && Objects.equals(releaseFailure, that.releaseFailure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, value, acquireFailure, useFailure, releaseFailure);
    }

    @Override
    public String toString() {
        switch (status) {
            case SUCCEEDED:
                return "Outcome{succeeded, value=" + value + "}";
            case ACQUIRE_FAILED:
                return "Outcome{acquire failed: " + acquireFailure + "}";
            case USE_FAILED:
                return "Outcome{use failed: " + useFailure + "}";
            case RELEASE_FAILED:
                return "Outcome{release failed: " + releaseFailure + "}";
            default:
                return "Outcome{use failed: " + useFailure + ", release failed: " + releaseFailure + "}";
        }
    }

    /**
     * The terminal state of a bracket invocation.
     */
    public enum Status {
        SUCCEEDED,
        ACQUIRE_FAILED,
        USE_FAILED,
        RELEASE_FAILED,
        USE_AND_RELEASE_FAILED
    }
}
