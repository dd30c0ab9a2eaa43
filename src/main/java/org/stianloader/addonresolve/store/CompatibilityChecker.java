package org.stianloader.addonresolve.store;

import org.jetbrains.annotations.NotNull;
import org.stianloader.addonresolve.AddonRecord;

/**
 * Answers questions about whether add-ons can run on this installation. Implemented by the
 * add-on management layer of the host application.
 *
 * <p>Both methods are queries and should have no side effects.
 */
public interface CompatibilityChecker {

    /**
     * Checks whether an add-on offered by a repository could be installed.
     *
     * @param addon The add-on
     * @return False if the add-on must not be considered by the resolver at all
     */
    boolean isCompatible(@NotNull AddonRecord addon);

    /**
     * Checks whether the installed add-on with the given id is disabled for the given reason.
     *
     * @param addonId The id of the installed add-on
     * @param reason The reason to check for
     * @return True if the add-on is installed, disabled and was disabled for exactly that reason
     */
    boolean isDisabledWithReason(@NotNull String addonId, @NotNull DisabledReason reason);
}
