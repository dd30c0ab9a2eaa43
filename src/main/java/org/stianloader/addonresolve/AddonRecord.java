package org.stianloader.addonresolve;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.addonresolve.version.AddonVersion;

/**
 * A single published version of an add-on as stored in the catalog, or as installed on the system.
 *
 * <p>The add-on id alone is not unique: the same add-on may be published in several versions by several
 * repositories, each of which results in its own record. Records are immutable snapshots and are shared
 * by reference between all lookup maps of an {@link AddonIndex}.
 *
 * @param id The id of the add-on, stable across versions
 * @param origin The id of the repository the record comes from, or {@link #ORIGIN_SYSTEM} for add-ons
 * that ship with the application
 * @param path The location of the add-on, checked against the origin prefix of official repositories
 * @param version The version of the add-on
 */
public final record AddonRecord(@NotNull String id, @NotNull String origin, @NotNull String path, @NotNull AddonVersion version) {

    /**
     * The origin of add-ons that are bundled with the application itself.
     */
    @NotNull
    public static final String ORIGIN_SYSTEM = "b6a50484-93a0-4afb-a01c-8d17e059feda";

    public AddonRecord {
        Objects.requireNonNull(id, "id may not be null");
        Objects.requireNonNull(origin, "origin may not be null");
        Objects.requireNonNull(path, "path may not be null");
        Objects.requireNonNull(version, "version may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public static AddonRecord of(@NotNull String id, @NotNull String origin, @NotNull String path, @NotNull String version) {
        return new AddonRecord(id, origin, path, AddonVersion.parse(version));
    }

    @Contract(pure = true)
    public boolean isSystemAddon() {
        return AddonRecord.ORIGIN_SYSTEM.equals(this.origin);
    }

    @Override
    public String toString() {
        return this.id + ':' + this.version.getOriginText() + " (" + this.origin + ')';
    }
}
