package org.stianloader.addonresolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.addonresolve.UpdateCheck.Source;
import org.stianloader.addonresolve.internal.ConcurrencyUtil;
import org.stianloader.addonresolve.logging.LoggingAdapter;
import org.stianloader.addonresolve.repo.OfficialRepositories;
import org.stianloader.addonresolve.repo.OriginCheck;
import org.stianloader.addonresolve.store.CatalogStore;
import org.stianloader.addonresolve.store.CatalogStoreException;
import org.stianloader.addonresolve.store.CompatibilityChecker;
import org.stianloader.addonresolve.store.DisabledReason;

/**
 * Determines which installed add-ons can be updated, obeying the trust rules between official
 * and private repositories.
 *
 * <p>The resolver works in two phases. First the catalog is loaded through {@link #loadAll()},
 * {@link #load(String)} or {@link #loadAsync(String, Executor)}, which builds a new {@link AddonIndex}.
 * Afterwards updates are looked up against that index through {@link #checkUpdate(AddonRecord)} or
 * {@link #buildUpdateList(List)}. Until the first load completes every lookup reports that no update
 * is available.
 *
 * <p>Lookups may be performed by any number of threads at once, including while a load is in progress:
 * a new index is only published once it was built completely, so lookups that started earlier finish
 * against the previous index. Loads on the same resolver are performed one after another. If a load
 * fails, the previous index is kept and the failure is reported to the caller; the resolver does
 * not retry.
 *
 * <p>Update policy for an installed add-on:
 * <ol>
 * <li>Add-ons bundled with the application are only ever updated from official repositories.</li>
 * <li>Any other add-on is looked up among the official repositories first. Only if no official
 * repository offers the add-on at all are the private repositories consulted. An official repository offering
 * the add-on in a version that is not newer hence prevents an update from a private repository.</li>
 * <li>The latest offered version is installed if it is newer than the installed one, or if the installed
 * add-on was {@link DisabledReason#INCOMPATIBLE disabled as incompatible}. In the latter case the offered
 * version may be equal to or even older than the installed one.</li>
 * </ol>
 */
public class AddonUpdateResolver {

    @NotNull
    private final CompatibilityChecker compatibility;
    @NotNull
    private final AtomicReference<@NotNull AddonIndex> index = new AtomicReference<>(AddonIndex.EMPTY);
    @NotNull
    private final Object loadLock = new Object();
    @NotNull
    private final CatalogLoader loader;

    /**
     * Creates a resolver that classifies add-ons using the process-wide {@link OfficialRepositories#get() registry}.
     *
     * @param store The catalog to load add-ons from
     * @param compatibility The compatibility checks of the host application
     * @throws IllegalStateException If the process-wide registry was not yet initialized
     */
    public AddonUpdateResolver(@NotNull CatalogStore store, @NotNull CompatibilityChecker compatibility) {
        this(store, compatibility, OfficialRepositories.get());
    }

    public AddonUpdateResolver(@NotNull CatalogStore store, @NotNull CompatibilityChecker compatibility, @NotNull OfficialRepositories registry) {
        this.compatibility = Objects.requireNonNull(compatibility, "compatibility may not be null");
        this.loader = new CatalogLoader(store, compatibility, registry);
    }

    /**
     * Builds the list of add-ons that should be installed in order to update the given installed add-ons.
     *
     * <p>The returned list contains at most one entry per installed add-on, in the order of the installed
     * add-ons. All lookups are performed against the same index, even if a load completes in the meantime.
     *
     * @param installed The installed add-ons
     * @return The add-on versions to install
     */
    @NotNull
    public List<@NotNull AddonRecord> buildUpdateList(@NotNull List<@NotNull AddonRecord> installed) {
        LoggingAdapter.getDefaultLogger().debug(AddonUpdateResolver.class, "Building update list for {} installed add-on(s)", installed.size());
        AddonIndex snapshot = this.index.get();
        List<@NotNull AddonRecord> updates = new ArrayList<>();
        for (AddonRecord addon : installed) {
            this.lookupUpdate(snapshot, addon).getUpdate().ifPresent(updates::add);
        }
        return updates;
    }

    /**
     * Checks whether an update is available for a single installed add-on.
     *
     * @param installed The installed add-on
     * @return The add-on version to install, or an empty optional if the add-on is up to date or not offered
     */
    @NotNull
    public Optional<AddonRecord> checkUpdate(@NotNull AddonRecord installed) {
        return this.lookupUpdate(installed).getUpdate();
    }

    @NotNull
    private UpdateCheck findAndCheck(@NotNull AddonRecord installed, @NotNull Map<@NotNull String, @NotNull AddonRecord> latestVersions, @NotNull Source source) {
        AddonRecord remote = latestVersions.get(installed.id());
        if (remote == null) {
            return UpdateCheck.notFound();
        }
        if (remote.version().isNewerThan(installed.version())
                || this.compatibility.isDisabledWithReason(installed.id(), DisabledReason.INCOMPATIBLE)) {
            return UpdateCheck.updateAvailable(source, remote);
        }
        return UpdateCheck.upToDate(source);
    }

    /**
     * Obtains the index lookups are currently performed against.
     *
     * @return The index built by the last successful load, or {@link AddonIndex#EMPTY} if nothing was loaded yet
     */
    @NotNull
    @Contract(pure = true)
    public AddonIndex getIndex() {
        return this.index.get();
    }

    @NotNull
    @Contract(pure = true)
    public OfficialRepositories getRegistry() {
        return this.loader.getRegistry();
    }

    /**
     * Checks whether the repository id of an add-on belongs to an official repository, without
     * verifying its path.
     *
     * @param addon The add-on to check
     * @return True if the add-on is from an official repository or bundled with the application
     */
    @Contract(pure = true)
    public boolean isFromOfficialRepo(@NotNull AddonRecord addon) {
        return this.isFromOfficialRepo(addon, OriginCheck.LENIENT_REPO_ID_ONLY);
    }

    @Contract(pure = true)
    public boolean isFromOfficialRepo(@NotNull AddonRecord addon, @NotNull OriginCheck check) {
        return this.getRegistry().isOfficial(addon, check);
    }

    /**
     * Loads every version of every add-on from the catalog, replacing the current index.
     *
     * @return The new index
     * @throws CatalogStoreException If the catalog could not be read. The current index is kept in that case
     */
    @NotNull
    public AddonIndex loadAll() throws CatalogStoreException {
        return this.load0(null);
    }

    /**
     * Loads every version of a single add-on from the catalog, replacing the current index.
     * Lookups for any other add-on will report that it is not offered until the next load.
     *
     * @param addonId The id of the add-on to load
     * @return The new index
     * @throws CatalogStoreException If the catalog could not be read. The current index is kept in that case
     */
    @NotNull
    public AddonIndex load(@NotNull String addonId) throws CatalogStoreException {
        return this.load0(Objects.requireNonNull(addonId, "addonId may not be null"));
    }

    /**
     * Loads the catalog asynchronously on the given executor, replacing the current index once done.
     *
     * @param addonId The id of the only add-on to load, or null to load the entire catalog
     * @param executor The executor to load on
     * @return A future completing with the new index, or exceptionally if the catalog could not be read
     */
    @NotNull
    public CompletableFuture<AddonIndex> loadAsync(@Nullable String addonId, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> this.load0(addonId), executor);
    }

    @NotNull
    private AddonIndex load0(@Nullable String addonId) throws CatalogStoreException {
        synchronized (this.loadLock) {
            AddonIndex loaded;
            try {
                loaded = this.loader.load(addonId);
            } catch (CatalogStoreException | RuntimeException e) {
                LoggingAdapter.getDefaultLogger().warn(AddonUpdateResolver.class, "Unable to load {} from the catalog, keeping the previous index", addonId == null ? "all add-ons" : addonId, e);
                throw e;
            }
            this.index.set(loaded);
            return loaded;
        }
    }

    /**
     * Looks up a single installed add-on, reporting whether and where it was found.
     *
     * @param installed The installed add-on
     * @return The outcome of the lookup
     */
    @NotNull
    public UpdateCheck lookupUpdate(@NotNull AddonRecord installed) {
        return this.lookupUpdate(this.index.get(), installed);
    }

    @NotNull
    private UpdateCheck lookupUpdate(@NotNull AddonIndex snapshot, @NotNull AddonRecord installed) {
        LoggingAdapter logger = LoggingAdapter.getDefaultLogger();
        logger.debug(AddonUpdateResolver.class, "Update check: id = {} / origin = {}", installed.id(), installed.origin());

        UpdateCheck result = this.findAndCheck(installed, snapshot.latestOfficialVersions(), Source.OFFICIAL);
        if (!result.isFound() && !installed.isSystemAddon()) {
            result = this.findAndCheck(installed, snapshot.latestPrivateVersions(), Source.PRIVATE);
        }

        result.getUpdate().ifPresent(update -> {
            logger.debug(AddonUpdateResolver.class, "Found update: id = {} / origin = {} / version = {}", update.id(), update.origin(), update.version());
        });
        return result;
    }
}
