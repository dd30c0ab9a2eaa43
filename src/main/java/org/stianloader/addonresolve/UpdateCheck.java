package org.stianloader.addonresolve;

import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of looking up a single installed add-on in an {@link AddonIndex}.
 *
 * <p>Callers that only care about whether there is something to install should use {@link #getUpdate()}.
 * The {@link #getStatus() status} and {@link #getSource() source} are there to tell apart the add-on not
 * being offered at all from it being offered but up to date.
 */
public final class UpdateCheck {

    /**
     * The lookup table the add-on was found in.
     */
    public static enum Source {
        OFFICIAL,
        PRIVATE;
    }

    public static enum Status {

        /**
         * None of the searched lookup tables offer the add-on.
         */
        NOT_FOUND,

        /**
         * The add-on is offered, but the offered version is not newer and the installed copy
         * does not need to be repaired.
         */
        UP_TO_DATE,

        /**
         * The offered version should be installed, either because it is newer or because the
         * installed copy was disabled as incompatible.
         */
        UPDATE_AVAILABLE;
    }

    @NotNull
    private static final UpdateCheck NOT_FOUND = new UpdateCheck(Status.NOT_FOUND, null, null);

    @NotNull
    @Contract(pure = true)
    public static UpdateCheck notFound() {
        return UpdateCheck.NOT_FOUND;
    }

    @NotNull
    @Contract(pure = true)
    public static UpdateCheck upToDate(@NotNull Source source) {
        return new UpdateCheck(Status.UP_TO_DATE, Objects.requireNonNull(source, "source may not be null"), null);
    }

    @NotNull
    @Contract(pure = true)
    public static UpdateCheck updateAvailable(@NotNull Source source, @NotNull AddonRecord update) {
        return new UpdateCheck(Status.UPDATE_AVAILABLE, Objects.requireNonNull(source, "source may not be null"), Objects.requireNonNull(update, "update may not be null"));
    }

    @Nullable
    private final Source source;
    @NotNull
    private final Status status;
    @Nullable
    private final AddonRecord update;

    private UpdateCheck(@NotNull Status status, @Nullable Source source, @Nullable AddonRecord update) {
        this.status = status;
        this.source = source;
        this.update = update;
    }

    /**
     * Obtains the lookup table the add-on was found in.
     *
     * @return The source, or null if the add-on was {@link Status#NOT_FOUND not found}
     */
    @Nullable
    @Contract(pure = true)
    public Source getSource() {
        return this.source;
    }

    @NotNull
    @Contract(pure = true)
    public Status getStatus() {
        return this.status;
    }

    @NotNull
    @Contract(pure = true)
    public Optional<AddonRecord> getUpdate() {
        return Optional.ofNullable(this.update);
    }

    @Contract(pure = true)
    public boolean isFound() {
        return this.status != Status.NOT_FOUND;
    }

    @Override
    public String toString() {
        if (this.update != null) {
            return "UpdateCheck[" + this.status + " from " + this.source + ": " + this.update + ']';
        }
        return "UpdateCheck[" + this.status + (this.source == null ? "" : " in " + this.source) + ']';
    }
}
