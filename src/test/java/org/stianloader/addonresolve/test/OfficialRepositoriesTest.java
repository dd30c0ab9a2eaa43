package org.stianloader.addonresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.stianloader.addonresolve.AddonRecord;
import org.stianloader.addonresolve.repo.OfficialRepositories;
import org.stianloader.addonresolve.repo.OriginCheck;
import org.stianloader.addonresolve.repo.RepoInfo;
import org.stianloader.addonresolve.repo.RepositoryConfigurationException;

public class OfficialRepositoriesTest {

    private static final OfficialRepositories KODI = OfficialRepositories.parse("repository.xbmc.org|https://mirrors.kodi.tv");

    @Test
    public void testParse() {
        OfficialRepositories registry = OfficialRepositories.parse(" repo.a|https://a.example , ,repo.b | https://b.example/addons ");
        assertEquals(Arrays.asList(new RepoInfo("repo.a", "https://a.example"), new RepoInfo("repo.b", "https://b.example/addons")), registry.getRepositories());
        assertFalse(registry.isEmpty());

        assertTrue(OfficialRepositories.parse("").isEmpty());
        assertTrue(OfficialRepositories.parse(" , ").isEmpty());
    }

    @Test
    public void testMalformedEntries() {
        assertThrows(RepositoryConfigurationException.class, () -> OfficialRepositories.parse("repo.a|https://a.example,repo.b"));
        assertThrows(RepositoryConfigurationException.class, () -> OfficialRepositories.parse("|https://a.example"));
        assertThrows(RepositoryConfigurationException.class, () -> OfficialRepositories.parse("repo.a|"));
    }

    @Test
    public void testProperties() {
        Properties properties = new Properties();
        properties.setProperty(OfficialRepositories.PROPERTY_KEY, "repo.a|https://a.example");
        assertEquals(Arrays.asList(new RepoInfo("repo.a", "https://a.example")), OfficialRepositories.fromProperties(properties).getRepositories());
        assertTrue(OfficialRepositories.fromProperties(new Properties()).isEmpty());
    }

    @Test
    public void testBundledDefaults() {
        OfficialRepositories defaults = OfficialRepositories.loadDefaults();
        assertEquals(KODI.getRepositories(), defaults.getRepositories());
    }

    @Test
    public void testSystemOriginIsAlwaysOfficial() {
        OfficialRepositories empty = OfficialRepositories.parse("");
        for (OriginCheck check : OriginCheck.values()) {
            assertTrue(empty.isOfficial(AddonRecord.ORIGIN_SYSTEM, "", check));
            assertTrue(KODI.isOfficial(AddonRecord.ORIGIN_SYSTEM, "/usr/share/kodi/addons/skin.estuary", check));
        }
    }

    @Test
    public void testLenientAndStrictChecks() {
        AddonRecord genuine = AddonRecord.of("plugin.video.foo", "repository.xbmc.org", "https://mirrors.kodi.tv/addons/omega/plugin.video.foo/plugin.video.foo-1.0.zip", "1.0");
        AddonRecord upperCase = AddonRecord.of("plugin.video.foo", "repository.xbmc.org", "HTTPS://MIRRORS.KODI.TV/addons/omega/plugin.video.foo-1.0.zip", "1.0");
        AddonRecord spoofed = AddonRecord.of("plugin.video.foo", "repository.xbmc.org", "https://evil.example/plugin.video.foo-1.0.zip", "1.0");
        AddonRecord thirdParty = AddonRecord.of("plugin.video.foo", "repository.thirdparty", "https://mirrors.kodi.tv/addons/omega/plugin.video.foo-1.0.zip", "1.0");

        assertTrue(KODI.isOfficial(genuine, OriginCheck.LENIENT_REPO_ID_ONLY));
        assertTrue(KODI.isOfficial(genuine, OriginCheck.STRICT_WITH_PATH_PREFIX));
        assertTrue(KODI.isOfficial(upperCase, OriginCheck.STRICT_WITH_PATH_PREFIX));

        assertTrue(KODI.isOfficial(spoofed, OriginCheck.LENIENT_REPO_ID_ONLY));
        assertFalse(KODI.isOfficial(spoofed, OriginCheck.STRICT_WITH_PATH_PREFIX));

        assertFalse(KODI.isOfficial(thirdParty, OriginCheck.LENIENT_REPO_ID_ONLY));
        assertFalse(KODI.isOfficial(thirdParty, OriginCheck.STRICT_WITH_PATH_PREFIX));
    }

    @Test
    public void testProcessWideRegistry() {
        OfficialRepositories registry = OfficialRepositories.parse("repo.a|https://a.example");
        if (!OfficialRepositories.isInitialized()) {
            assertThrows(IllegalStateException.class, OfficialRepositories::get);
            OfficialRepositories.initialize(registry);
            assertSame(registry, OfficialRepositories.get());
        }
        assertTrue(OfficialRepositories.isInitialized());
        assertThrows(IllegalStateException.class, () -> OfficialRepositories.initialize(registry));
    }
}
