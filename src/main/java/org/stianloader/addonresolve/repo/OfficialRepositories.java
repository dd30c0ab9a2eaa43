package org.stianloader.addonresolve.repo;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;
import org.stianloader.addonresolve.AddonRecord;
import org.stianloader.addonresolve.logging.LoggingAdapter;

/**
 * The registry of repositories whose add-ons are considered official, that is trusted
 * more than add-ons served by any other (private) repository.
 *
 * <p>The registry is immutable. Applications usually construct it once while starting up and install it
 * as the process-wide registry through {@link #initialize(OfficialRepositories)}, after which it can be
 * obtained through {@link #get()}. The process-wide registry cannot be refreshed
 * later on.
 *
 * <p>The textual form of the registry is a comma-separated list of {@code repoId|originPrefix} pairs,
 * for example {@code repository.xbmc.org|https://mirrors.kodi.tv}.
 */
public final class OfficialRepositories {

    /**
     * The key under which the repository list is stored in a {@link Properties} file.
     */
    @NotNull
    public static final String PROPERTY_KEY = "official.repositories";

    /**
     * Name of the classpath resource, relative to this class, that holds the default repository list.
     */
    @NotNull
    public static final String DEFAULTS_RESOURCE = "official-repositories.properties";

    @Nullable
    private static volatile OfficialRepositories instance;

    @NotNull
    private static final Object INIT_LOCK = new Object();

    @NotNull
    @Unmodifiable
    private final List<@NotNull RepoInfo> repositories;

    public OfficialRepositories(@NotNull Collection<@NotNull RepoInfo> repositories) {
        this.repositories = Collections.unmodifiableList(new ArrayList<>(repositories));
        if (this.repositories.isEmpty()) {
            LoggingAdapter.getDefaultLogger().warn(OfficialRepositories.class, "No official repositories are configured. Every add-on not bundled with the application will be treated as coming from a private repository.");
        }
    }

    /**
     * Obtains the process-wide registry.
     *
     * @return The registry that was passed to {@link #initialize(OfficialRepositories)}
     * @throws IllegalStateException If the process-wide registry was not yet initialized
     */
    @NotNull
    public static OfficialRepositories get() {
        OfficialRepositories registry = OfficialRepositories.instance;
        if (registry == null) {
            throw new IllegalStateException("The official repository registry has not been initialized yet.");
        }
        return registry;
    }

    /**
     * Installs the process-wide registry. Must be called exactly once, before any call to {@link #get()}.
     *
     * @param registry The registry to install
     * @throws IllegalStateException If a registry was already installed
     */
    public static void initialize(@NotNull OfficialRepositories registry) {
        Objects.requireNonNull(registry, "registry may not be null");
        synchronized (OfficialRepositories.INIT_LOCK) {
            if (OfficialRepositories.instance != null) {
                throw new IllegalStateException("The official repository registry was already initialized.");
            }
            OfficialRepositories.instance = registry;
        }
        LoggingAdapter.getDefaultLogger().info(OfficialRepositories.class, "Initialized official repositories: {}", registry.repositories);
    }

    @Contract(pure = true)
    public static boolean isInitialized() {
        return OfficialRepositories.instance != null;
    }

    /**
     * Parses a comma-separated list of {@code repoId|originPrefix} pairs.
     * Whitespace around entries is ignored, as are empty entries.
     *
     * @param pairList The textual repository list
     * @return The parsed registry
     * @throws RepositoryConfigurationException If an entry lacks the '|' delimiter or one of its halves is empty
     */
    @NotNull
    public static OfficialRepositories parse(@NotNull String pairList) {
        List<@NotNull RepoInfo> parsed = new ArrayList<>();
        for (String entry : pairList.split(",")) {
            entry = entry.trim();
            if (entry.isEmpty()) {
                continue;
            }
            int delimiter = entry.indexOf('|');
            if (delimiter == -1) {
                throw new RepositoryConfigurationException("Official repository entry \"" + entry + "\" is missing the '|' delimiter between repository id and origin.");
            }
            String repoId = entry.substring(0, delimiter).trim();
            String origin = entry.substring(delimiter + 1).trim();
            if (repoId.isEmpty() || origin.isEmpty()) {
                throw new RepositoryConfigurationException("Official repository entry \"" + entry + "\" has an empty repository id or origin.");
            }
            parsed.add(new RepoInfo(repoId, origin));
        }
        return new OfficialRepositories(parsed);
    }

    /**
     * Reads the repository list stored under {@link #PROPERTY_KEY}. A missing key yields an empty registry.
     *
     * @param properties The properties to read from
     * @return The parsed registry
     */
    @NotNull
    public static OfficialRepositories fromProperties(@NotNull Properties properties) {
        return OfficialRepositories.parse(properties.getProperty(OfficialRepositories.PROPERTY_KEY, ""));
    }

    /**
     * Reads the repository list bundled with the library.
     *
     * @return The default registry
     * @throws RepositoryConfigurationException If the bundled resource is missing or unreadable
     */
    @NotNull
    public static OfficialRepositories loadDefaults() {
        try (InputStream in = OfficialRepositories.class.getResourceAsStream(OfficialRepositories.DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new RepositoryConfigurationException("Resource " + OfficialRepositories.DEFAULTS_RESOURCE + " not found");
            }
            Properties properties = new Properties();
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            return OfficialRepositories.fromProperties(properties);
        } catch (IOException e) {
            throw new RepositoryConfigurationException("Unable to read " + OfficialRepositories.DEFAULTS_RESOURCE, e);
        }
    }

    @NotNull
    @Unmodifiable
    @Contract(pure = true)
    public List<@NotNull RepoInfo> getRepositories() {
        return this.repositories;
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.repositories.isEmpty();
    }

    /**
     * Checks whether an add-on originates from an official repository. Add-ons bundled with the
     * application ({@link AddonRecord#ORIGIN_SYSTEM}) are always official.
     *
     * @param origin The repository id of the add-on
     * @param path The path of the add-on, only consulted when strictly checking
     * @param check Whether the path of the add-on also needs to match the origin of the repository
     * @return True if the add-on is official
     */
    @Contract(pure = true)
    public boolean isOfficial(@NotNull String origin, @NotNull String path, @NotNull OriginCheck check) {
        if (AddonRecord.ORIGIN_SYSTEM.equals(origin)) {
            return true;
        }
        for (RepoInfo repo : this.repositories) {
            if (!repo.repoId().equals(origin)) {
                continue;
            }
            if (check == OriginCheck.LENIENT_REPO_ID_ONLY || repo.isBelowOrigin(path)) {
                return true;
            }
        }
        return false;
    }

    @Contract(pure = true)
    public boolean isOfficial(@NotNull AddonRecord addon, @NotNull OriginCheck check) {
        return this.isOfficial(addon.origin(), addon.path(), check);
    }

    @Override
    public String toString() {
        return "OfficialRepositories" + this.repositories;
    }
}
