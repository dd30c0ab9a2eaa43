package org.stianloader.addonresolve.repo;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * An official repository as defined by the trusted repository configuration.
 *
 * @param repoId The id of the repository add-on, which is also the origin of every add-on it publishes
 * @param origin The location prefix every add-on served by the genuine repository lives under
 * (e.g. {@code https://mirrors.kodi.tv})
 */
public final record RepoInfo(@NotNull String repoId, @NotNull String origin) {

    public RepoInfo {
        Objects.requireNonNull(repoId, "repoId may not be null");
        Objects.requireNonNull(origin, "origin may not be null");
    }

    /**
     * Checks whether a path is located below the {@link #origin() origin} of this repository.
     * The comparison ignores case.
     *
     * @param path The path to check
     * @return True if the path starts with the origin prefix
     */
    @Contract(pure = true)
    public boolean isBelowOrigin(@NotNull String path) {
        return path.regionMatches(true, 0, this.origin, 0, this.origin.length());
    }
}
