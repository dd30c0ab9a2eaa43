package org.stianloader.addonresolve.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.addonresolve.AddonRecord;

/**
 * A {@link CatalogStore} that keeps its records in memory. Mainly of use to hosts that
 * decode repository indices by themselves and do not have a persistent catalog.
 *
 * <p>The store is safe to modify while it is being read from. Every fetch operates on a snapshot
 * of the records.
 */
public class InMemoryCatalogStore implements CatalogStore {

    @NotNull
    private final List<@NotNull AddonRecord> records = new CopyOnWriteArrayList<>();

    public InMemoryCatalogStore() {
    }

    public InMemoryCatalogStore(@NotNull Collection<@NotNull AddonRecord> records) {
        this.addAll(records);
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public InMemoryCatalogStore add(@NotNull AddonRecord record) {
        this.records.add(Objects.requireNonNull(record, "record may not be null"));
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public InMemoryCatalogStore addAll(@NotNull Collection<@NotNull AddonRecord> records) {
        for (AddonRecord record : records) {
            Objects.requireNonNull(record, "records may not contain null");
        }
        this.records.addAll(records);
        return this;
    }

    @Contract(mutates = "this", pure = false)
    public void clear() {
        this.records.clear();
    }

    @Override
    @NotNull
    public List<@NotNull AddonRecord> fetchAll() {
        return new ArrayList<>(this.records);
    }

    @Override
    @NotNull
    public List<@NotNull AddonRecord> fetchById(@NotNull String addonId) {
        List<@NotNull AddonRecord> matching = new ArrayList<>();
        for (AddonRecord record : this.records) {
            if (record.id().equals(addonId)) {
                matching.add(record);
            }
        }
        return matching;
    }

    /**
     * Removes every record that belongs to the given repository, for example because
     * the repository was uninstalled.
     *
     * @param repoId The id of the repository
     * @return True if any record was removed
     */
    @Contract(mutates = "this", pure = false)
    public boolean removeRepository(@NotNull String repoId) {
        return this.records.removeIf(record -> record.origin().equals(repoId));
    }

    @Contract(pure = true)
    public int size() {
        return this.records.size();
    }
}
