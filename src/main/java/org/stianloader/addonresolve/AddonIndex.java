package org.stianloader.addonresolve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;
import org.stianloader.addonresolve.logging.LoggingAdapter;
import org.stianloader.addonresolve.repo.OfficialRepositories;
import org.stianloader.addonresolve.repo.OriginCheck;

/**
 * An immutable snapshot of the add-ons offered by the repositories, together with the
 * latest-version lookup tables derived from them.
 *
 * <p>An index is never modified after {@link #build(Map, OfficialRepositories) being built}. Reloading the
 * catalog produces a new index instead, which means that an index can be shared freely between threads.
 *
 * <p>The lookup tables hold, per add-on id, only the record with the highest version:
 * <ul>
 * <li>{@link #latestOfficialVersions()} among all records classified as official,</li>
 * <li>{@link #latestPrivateVersions()} among all other records and</li>
 * <li>{@link #latestVersionsByRepo()} within each individual repository, regardless of classification.</li>
 * </ul>
 */
public final class AddonIndex {

    // Records are visited in this order so that ties between equal versions always resolve the same way
    @NotNull
    private static final Comparator<@NotNull AddonRecord> CANONICAL_ORDER = Comparator.comparing(AddonRecord::id)
            .thenComparing(AddonRecord::version)
            .thenComparing(AddonRecord::path)
            .thenComparing(record -> record.version().getOriginText());

    @NotNull
    public static final AddonIndex EMPTY = new AddonIndex(Collections.emptyList(), Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap());

    private static void addIfLatest(@NotNull Map<String, AddonRecord> latest, @NotNull AddonRecord candidate) {
        AddonRecord known = latest.get(candidate.id());
        if (known == null || candidate.version().isNewerThan(known.version())) {
            latest.put(candidate.id(), candidate);
        }
    }

    /**
     * Builds an index from the add-ons offered by each repository.
     *
     * <p>Records are classified as official or private using
     * {@link OriginCheck#STRICT_WITH_PATH_PREFIX strict origin checks}. The result does not depend on
     * the order in which repositories or records are supplied.
     *
     * <p>A repository offering the same version of an add-on more than once is considered anomalous and
     * a warning is logged. Records that only differ in how their version is written are collapsed into one,
     * while records with different paths are all kept and classified individually.
     *
     * @param recordsByRepo The records offered by each repository, keyed by repository id
     * @param registry The registry used for classifying records
     * @return The newly built index
     */
    @NotNull
    public static AddonIndex build(@NotNull Map<@NotNull String, ? extends Collection<@NotNull AddonRecord>> recordsByRepo, @NotNull OfficialRepositories registry) {
        List<@NotNull AddonRecord> records = new ArrayList<>();
        Map<String, Map<String, List<AddonRecord>>> addonsByRepo = new TreeMap<>();
        Map<String, AddonRecord> latestOfficial = new HashMap<>();
        Map<String, AddonRecord> latestPrivate = new HashMap<>();
        Map<String, Map<String, AddonRecord>> latestByRepo = new TreeMap<>();

        Map<@NotNull String, Collection<@NotNull AddonRecord>> orderedRepos = new TreeMap<>(recordsByRepo);
        for (Map.Entry<@NotNull String, Collection<@NotNull AddonRecord>> repo : orderedRepos.entrySet()) {
            String repoId = repo.getKey();
            List<@NotNull AddonRecord> sorted = new ArrayList<>(repo.getValue());
            sorted.sort(AddonIndex.CANONICAL_ORDER);

            Map<String, List<AddonRecord>> addons = new TreeMap<>();
            for (AddonRecord record : sorted) {
                List<AddonRecord> versions = addons.computeIfAbsent(record.id(), id -> new ArrayList<>());
                AddonRecord previous = versions.isEmpty() ? null : versions.get(versions.size() - 1);
                if (previous != null && previous.equals(record)) {
                    LoggingAdapter.getDefaultLogger().warn(AddonIndex.class, "Repository {} lists add-on {} in version {} at {} more than once", repoId, record.id(), record.version(), record.path());
                    versions.set(versions.size() - 1, record);
                } else {
                    if (previous != null && previous.version().equals(record.version())) {
                        LoggingAdapter.getDefaultLogger().warn(AddonIndex.class, "Repository {} offers add-on {} in version {} from multiple locations: {} and {}", repoId, record.id(), record.version(), previous.path(), record.path());
                    }
                    versions.add(record);
                }
            }

            Map<String, AddonRecord> latestOfRepo = new HashMap<>();
            for (List<AddonRecord> versions : addons.values()) {
                for (AddonRecord record : versions) {
                    records.add(record);
                    if (registry.isOfficial(record, OriginCheck.STRICT_WITH_PATH_PREFIX)) {
                        AddonIndex.addIfLatest(latestOfficial, record);
                    } else {
                        AddonIndex.addIfLatest(latestPrivate, record);
                    }
                    AddonIndex.addIfLatest(latestOfRepo, record);
                }
            }

            addons.replaceAll((id, versions) -> Collections.unmodifiableList(versions));
            addonsByRepo.put(repoId, Collections.unmodifiableMap(addons));
            latestByRepo.put(repoId, Collections.unmodifiableMap(latestOfRepo));
        }

        return new AddonIndex(records, addonsByRepo, latestOfficial, latestPrivate, latestByRepo);
    }

    @NotNull
    @Unmodifiable
    private final Map<@NotNull String, @NotNull Map<@NotNull String, @NotNull List<@NotNull AddonRecord>>> addonsByRepo;
    @NotNull
    @Unmodifiable
    private final Map<@NotNull String, @NotNull AddonRecord> latestOfficial;
    @NotNull
    @Unmodifiable
    private final Map<@NotNull String, @NotNull AddonRecord> latestPrivate;
    @NotNull
    @Unmodifiable
    private final Map<@NotNull String, @NotNull Map<@NotNull String, @NotNull AddonRecord>> latestByRepo;
    @NotNull
    @Unmodifiable
    private final List<@NotNull AddonRecord> records;

    private AddonIndex(@NotNull List<@NotNull AddonRecord> records,
            @NotNull Map<String, Map<String, List<AddonRecord>>> addonsByRepo,
            @NotNull Map<String, AddonRecord> latestOfficial,
            @NotNull Map<String, AddonRecord> latestPrivate,
            @NotNull Map<String, Map<String, AddonRecord>> latestByRepo) {
        this.records = Collections.unmodifiableList(records);
        this.addonsByRepo = Collections.unmodifiableMap(addonsByRepo);
        this.latestOfficial = Collections.unmodifiableMap(latestOfficial);
        this.latestPrivate = Collections.unmodifiableMap(latestPrivate);
        this.latestByRepo = Collections.unmodifiableMap(latestByRepo);
    }

    /**
     * Obtains all versions of every add-on offered by a repository.
     *
     * @param repoId The id of the repository
     * @return The versions of each add-on keyed by add-on id, in ascending version order. Empty if the
     * repository is not known to the index
     */
    @NotNull
    @Unmodifiable
    @Contract(pure = true)
    public Map<@NotNull String, @NotNull List<@NotNull AddonRecord>> getAddonsByRepo(@NotNull String repoId) {
        return this.addonsByRepo.getOrDefault(repoId, Collections.emptyMap());
    }

    @Nullable
    @Contract(pure = true)
    public AddonRecord getLatestByRepo(@NotNull String repoId, @NotNull String addonId) {
        Map<String, AddonRecord> latest = this.latestByRepo.get(repoId);
        if (latest == null) {
            return null;
        }
        return latest.get(addonId);
    }

    @Nullable
    @Contract(pure = true)
    public AddonRecord getLatestOfficial(@NotNull String addonId) {
        return this.latestOfficial.get(addonId);
    }

    @Nullable
    @Contract(pure = true)
    public AddonRecord getLatestPrivate(@NotNull String addonId) {
        return this.latestPrivate.get(addonId);
    }

    /**
     * Obtains every record held by this index, grouped by repository.
     *
     * @return The records
     */
    @NotNull
    @Unmodifiable
    @Contract(pure = true)
    public List<@NotNull AddonRecord> getRecords() {
        return this.records;
    }

    @NotNull
    @Unmodifiable
    @Contract(pure = true)
    public Set<@NotNull String> getRepositoryIds() {
        return this.addonsByRepo.keySet();
    }

    @NotNull
    @Unmodifiable
    @Contract(pure = true)
    public Map<@NotNull String, @NotNull AddonRecord> latestOfficialVersions() {
        return this.latestOfficial;
    }

    @NotNull
    @Unmodifiable
    @Contract(pure = true)
    public Map<@NotNull String, @NotNull AddonRecord> latestPrivateVersions() {
        return this.latestPrivate;
    }

    @NotNull
    @Unmodifiable
    @Contract(pure = true)
    public Map<@NotNull String, @NotNull Map<@NotNull String, @NotNull AddonRecord>> latestVersionsByRepo() {
        return this.latestByRepo;
    }

    @Contract(pure = true)
    public int size() {
        return this.records.size();
    }

    @Override
    public String toString() {
        return "AddonIndex[repositories=" + this.addonsByRepo.keySet() + ", records=" + this.records.size()
                + ", official=" + this.latestOfficial.size() + ", private=" + this.latestPrivate.size() + ']';
    }
}
