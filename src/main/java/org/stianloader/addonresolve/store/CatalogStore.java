package org.stianloader.addonresolve.store;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.stianloader.addonresolve.AddonRecord;

/**
 * The persistent catalog that holds the add-ons offered by every installed repository.
 *
 * <p>Keeping the catalog up to date is not the responsibility of the resolver; the resolver
 * only ever reads whatever the store holds at the time of the call. Each call should return
 * a consistent snapshot, but no consistency across multiple calls is required.
 */
public interface CatalogStore {

    /**
     * Obtains every add-on version offered by any repository.
     *
     * @return The records, in no particular order
     * @throws CatalogStoreException If the store could not be read
     */
    @NotNull
    List<@NotNull AddonRecord> fetchAll() throws CatalogStoreException;

    /**
     * Obtains every version of a single add-on offered by any repository.
     *
     * @param addonId The id of the add-on
     * @return The records, in no particular order. Empty if no repository offers the add-on
     * @throws CatalogStoreException If the store could not be read
     */
    @NotNull
    List<@NotNull AddonRecord> fetchById(@NotNull String addonId) throws CatalogStoreException;
}
