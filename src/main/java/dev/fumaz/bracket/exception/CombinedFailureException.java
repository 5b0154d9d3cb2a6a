package dev.fumaz.bracket.exception;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Signals that both the use of a resource and its release failed.
 * <p>
 * Reported by {@code Outcome.getFailure()} for a combined outcome. The throwing bracket forms raise it in place of
 * the first failure only when that failure cannot record the second one as suppressed, for example when it was
 * created with suppression disabled.
 * <p>
 * The use failure is the cause; the release failure is attached as a suppressed exception. Both remain
 * available through {@link #getUseFailure()} and {@link #getReleaseFailure()}.
 */
public class CombinedFailureException extends BracketException {

    private final Throwable useFailure;
    private final Throwable releaseFailure;

    public CombinedFailureException(@NotNull Throwable useFailure, @NotNull Throwable releaseFailure) {
        super("Use failed (" + describe(useFailure) + ") and release failed (" + describe(releaseFailure) + ")",
                Objects.requireNonNull(useFailure, "useFailure"));

        this.useFailure = useFailure;
        this.releaseFailure = Objects.requireNonNull(releaseFailure, "releaseFailure");

        if (releaseFailure != useFailure) {
            addSuppressed(releaseFailure);
        }
    }

    public @NotNull Throwable getUseFailure() {
        return useFailure;
    }

    public @NotNull Throwable getReleaseFailure() {
        return releaseFailure;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "null";
        }

        String message = failure.getMessage();
        return message == null ? failure.getClass().getName() : failure.getClass().getName() + ": " + message;
    }
}
