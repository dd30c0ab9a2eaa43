package org.stianloader.addonresolve.test;

import java.util.HashSet;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.stianloader.addonresolve.AddonRecord;
import org.stianloader.addonresolve.store.CompatibilityChecker;
import org.stianloader.addonresolve.store.DisabledReason;

final class StubCompatibilityChecker implements CompatibilityChecker {

    final Set<@NotNull String> disabledAsIncompatible = new HashSet<>();
    final Set<@NotNull AddonRecord> incompatible = new HashSet<>();

    @Override
    public boolean isCompatible(@NotNull AddonRecord addon) {
        return !this.incompatible.contains(addon);
    }

    @Override
    public boolean isDisabledWithReason(@NotNull String addonId, @NotNull DisabledReason reason) {
        return reason == DisabledReason.INCOMPATIBLE && this.disabledAsIncompatible.contains(addonId);
    }
}
