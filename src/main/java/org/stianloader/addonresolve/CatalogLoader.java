package org.stianloader.addonresolve;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.addonresolve.logging.LoggingAdapter;
import org.stianloader.addonresolve.repo.OfficialRepositories;
import org.stianloader.addonresolve.store.CatalogStore;
import org.stianloader.addonresolve.store.CatalogStoreException;
import org.stianloader.addonresolve.store.CompatibilityChecker;

/**
 * Reads the add-ons offered by the repositories from the {@link CatalogStore} and turns them
 * into an {@link AddonIndex}. Add-ons the {@link CompatibilityChecker} rejects never make it into the index.
 *
 * <p>A loader holds no state of its own and may be used by multiple threads at once.
 */
public class CatalogLoader {

    @NotNull
    private final CompatibilityChecker compatibility;
    @NotNull
    private final OfficialRepositories registry;
    @NotNull
    private final CatalogStore store;

    public CatalogLoader(@NotNull CatalogStore store, @NotNull CompatibilityChecker compatibility, @NotNull OfficialRepositories registry) {
        this.store = Objects.requireNonNull(store, "store may not be null");
        this.compatibility = Objects.requireNonNull(compatibility, "compatibility may not be null");
        this.registry = Objects.requireNonNull(registry, "registry may not be null");
    }

    /**
     * Groups records by the repository they come from, dropping incompatible ones.
     *
     * @param records The records to group
     * @return The compatible records, keyed by their {@link AddonRecord#origin() origin}
     */
    @NotNull
    public Map<@NotNull String, @NotNull List<@NotNull AddonRecord>> groupByRepository(@NotNull List<@NotNull AddonRecord> records) {
        Map<@NotNull String, @NotNull List<@NotNull AddonRecord>> byRepo = new LinkedHashMap<>();
        for (AddonRecord record : records) {
            if (!this.compatibility.isCompatible(record)) {
                continue;
            }
            byRepo.computeIfAbsent(record.origin(), origin -> new ArrayList<>()).add(record);
        }
        return byRepo;
    }

    /**
     * Loads add-ons from the store and builds a new index from them.
     *
     * @param addonId The id of the only add-on to load, or null to load the entire catalog
     * @return The newly built index
     * @throws CatalogStoreException If the store could not be read
     */
    @NotNull
    public AddonIndex load(@Nullable String addonId) throws CatalogStoreException {
        List<@NotNull AddonRecord> records;
        if (addonId == null) {
            records = this.store.fetchAll();
        } else {
            records = this.store.fetchById(addonId);
        }

        Map<@NotNull String, @NotNull List<@NotNull AddonRecord>> byRepo = this.groupByRepository(records);
        LoggingAdapter logger = LoggingAdapter.getDefaultLogger();
        for (Map.Entry<@NotNull String, @NotNull List<@NotNull AddonRecord>> repo : byRepo.entrySet()) {
            logger.debug(CatalogLoader.class, "Repository {}: {} add-on(s) loaded", repo.getKey(), repo.getValue().size());
        }

        return AddonIndex.build(byRepo, this.registry);
    }

    @NotNull
    @Contract(pure = true)
    public OfficialRepositories getRegistry() {
        return this.registry;
    }
}
