package org.stianloader.addonresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.addonresolve.version.AddonVersion;

public class AddonVersionTest {

    private boolean isNewer(@NotNull String newer, @NotNull String older) {
        return AddonVersion.parse(newer).isNewerThan(AddonVersion.parse(older));
    }

    @Test
    public void testNumericOrdering() {
        assertTrue(isNewer("1.0.1", "1.0.0"));
        assertFalse(isNewer("1.0.0", "1.0.1"));
        assertTrue(isNewer("1.10", "1.9"));
        assertTrue(isNewer("2.0", "1.99.99"));
        assertTrue(isNewer("1.0.0", "1.0"));
        assertFalse(isNewer("1.0", "1.0"));
        assertFalse(isNewer("1.0", "1.00"));
        assertFalse(isNewer("1.00", "1.0"));
        assertTrue(isNewer("1.99999999999999999999", "1.99999999999999999998"));
        assertTrue(isNewer("1.100000000000000000000", "1.99999999999999999999"));
    }

    @Test
    public void testTildeSortsFirst() {
        assertTrue(isNewer("1.0", "1.0~beta1"));
        assertFalse(isNewer("1.0~beta1", "1.0"));
        assertTrue(isNewer("1.0~beta2", "1.0~beta1"));
        assertTrue(isNewer("1.0~beta", "1.0~alpha"));
        assertTrue(isNewer("1.0~beta1", "0.9"));
    }

    @Test
    public void testLetters() {
        assertTrue(isNewer("1.0a", "1.0"));
        assertTrue(isNewer("1.0b", "1.0a"));
    }

    @Test
    public void testEpochAndRevision() {
        assertTrue(isNewer("1:0.1", "9.9"));
        assertFalse(isNewer("9.9", "1:0.1"));
        assertFalse(isNewer("0:1.0", "1.0"));
        assertTrue(isNewer("1.0+1", "1.0"));
        assertTrue(isNewer("1.0.0+matrix.2", "1.0.0+matrix.1"));
        assertTrue(isNewer("1.0.1", "1.0+5"));

        AddonVersion version = AddonVersion.parse("2:1.4.0+matrix.3");
        assertEquals(2, version.getEpoch());
        assertEquals("1.4.0", version.getUpstream());
        assertEquals("matrix.3", version.getRevision());
        assertEquals("2:1.4.0+matrix.3", version.getOriginText());
    }

    @Test
    public void testEquality() {
        assertEquals(AddonVersion.parse("1.0"), AddonVersion.parse("1.00"));
        assertEquals(AddonVersion.parse("1.0").hashCode(), AddonVersion.parse("1.00").hashCode());
        assertEquals(AddonVersion.parse("1.01"), AddonVersion.parse("1.1"));
        assertEquals(AddonVersion.parse("0:1.0"), AddonVersion.parse("1.0"));
        assertEquals(AddonVersion.parse(""), AddonVersion.parse("0.0.0"));
        assertEquals(AddonVersion.EMPTY, AddonVersion.parse("  "));
        assertNotEquals(AddonVersion.parse("1.0"), AddonVersion.parse("1.0.0"));
        assertNotEquals(AddonVersion.parse("1.0"), AddonVersion.parse("1.0+1"));
        assertEquals("1.00", AddonVersion.parse("1.00").toString());
    }

    @Test
    public void testTotalOrder() {
        List<AddonVersion> expected = new ArrayList<>();
        for (String s : Arrays.asList("0.9", "1.0~alpha", "1.0~beta1", "1.0", "1.0+1", "1.0a", "1.0.1", "1.2", "1.10", "1:0.1")) {
            expected.add(AddonVersion.parse(s));
        }

        Random random = new Random(42L);
        for (int i = 0; i < 20; i++) {
            List<AddonVersion> shuffled = new ArrayList<>(expected);
            Collections.shuffle(shuffled, random);
            Collections.sort(shuffled);
            assertEquals(expected, shuffled);
        }

        for (AddonVersion a : expected) {
            for (AddonVersion b : expected) {
                assertEquals(Integer.signum(a.compareTo(b)), -Integer.signum(b.compareTo(a)));
                assertEquals(a.compareTo(b) == 0, a.equals(b));
            }
        }
    }

    @Test
    public void testMalformedEpoch() {
        assertEquals(0, AddonVersion.parse("a:1.0").getEpoch());
        assertEquals(AddonVersion.parse("1.0"), AddonVersion.parse("a:1.0"));
        assertEquals("1.0", AddonVersion.parse(":1.0").getUpstream());
        assertEquals(0, AddonVersion.parse(":1.0").getEpoch());
        assertEquals(2, AddonVersion.parse("2a:1.0").getEpoch());
        assertEquals(Long.MAX_VALUE, AddonVersion.parse("99999999999999999999:1.0").getEpoch());
        assertTrue(isNewer("1:0.1", "x:9.9"));
        assertEquals("a:1.0", AddonVersion.parse("a:1.0").getOriginText());
    }
}
