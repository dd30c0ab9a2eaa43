package org.stianloader.addonresolve.version;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The version of an add-on, in the form {@code [epoch:]upstream[+revision]}.
 *
 * <p>Versions are ordered first by their numeric epoch (defaulting to 0), then by their upstream part
 * and lastly by their revision. Upstream and revision are compared the way dpkg compares version strings:
 * runs of digits are compared numerically while everything else is compared character by character.
 * The tilde character sorts before anything else, including the end of the string, so that
 * {@code 1.0~beta1} is older than {@code 1.0}.
 *
 * <p>The ordering is total and {@link #equals(Object)} is consistent with it, meaning that
 * {@code 1.0} and {@code 1.00} are the same version. The text a version was parsed from is retained
 * through {@link #getOriginText()} and is what should be shown to users.
 */
public final class AddonVersion implements Comparable<AddonVersion> {

    @NotNull
    public static final AddonVersion EMPTY = AddonVersion.parse("");

    @NotNull
    @Contract(pure = true)
    public static AddonVersion parse(@NotNull String text) {
        Objects.requireNonNull(text, "text may not be null");
        String remaining = text.trim();
        if (remaining.isEmpty()) {
            remaining = "0.0.0";
        }

        long epoch = 0;
        int colon = remaining.indexOf(':');
        if (colon != -1) {
            epoch = AddonVersion.parseEpoch(remaining.substring(0, colon));
            remaining = remaining.substring(colon + 1);
        }

        String revision = "";
        int plus = remaining.indexOf('+');
        if (plus != -1) {
            revision = remaining.substring(plus + 1);
            remaining = remaining.substring(0, plus);
        }

        return new AddonVersion(text, epoch, remaining, revision);
    }

    /**
     * Reads the leading digits of an epoch. Text that does not start with a digit yields epoch 0,
     * anything after the leading digits is ignored and values beyond the range of a long are clamped.
     */
    private static long parseEpoch(@NotNull String epochText) {
        int end = 0;
        while (end < epochText.length() && AddonVersion.isAsciiDigit(epochText.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return 0;
        }
        try {
            return Long.parseLong(epochText.substring(0, end));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Compares two version components.
     *
     * @param a The first component
     * @param b The second component
     * @return A negative number if a is older than b, 0 if they are the same and a positive number otherwise
     */
    static int compareComponent(@NotNull String a, @NotNull String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() || j < b.length()) {
            // Non-digit run
            while ((i < a.length() && !isAsciiDigit(a.charAt(i))) || (j < b.length() && !isAsciiDigit(b.charAt(j)))) {
                int ca = i < a.length() ? AddonVersion.order(a.charAt(i)) : 0;
                int cb = j < b.length() ? AddonVersion.order(b.charAt(j)) : 0;
                if (ca != cb) {
                    return ca - cb;
                }
                i++;
                j++;
            }

            // Digit run
            int startA = i;
            int startB = j;
            while (i < a.length() && a.charAt(i) == '0') {
                i++;
            }
            while (j < b.length() && b.charAt(j) == '0') {
                j++;
            }
            int digitsA = i;
            int digitsB = j;
            while (i < a.length() && isAsciiDigit(a.charAt(i))) {
                i++;
            }
            while (j < b.length() && isAsciiDigit(b.charAt(j))) {
                j++;
            }
            if (startA == i && startB == j) {
                continue;
            }
            int lengthA = i - digitsA;
            int lengthB = j - digitsB;
            if (lengthA != lengthB) {
                return lengthA - lengthB;
            }
            for (int k = 0; k < lengthA; k++) {
                int diff = a.charAt(digitsA + k) - b.charAt(digitsB + k);
                if (diff != 0) {
                    return diff;
                }
            }
        }
        return 0;
    }

    private static boolean isZeros(@NotNull String s, int start, int end) {
        for (int i = start; i < end; i++) {
            if (s.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // Same weights as dpkg: '~' < end of string and digits < letters < everything else
    private static int order(char c) {
        if (isAsciiDigit(c)) {
            return 0;
        } else if (c == '~') {
            return -1;
        } else if (Character.isLetter(c)) {
            return c;
        } else {
            return c + 0x10000;
        }
    }

    /**
     * Builds a representation of a component that is equal for two components exactly if
     * {@link #compareComponent(String, String)} considers them the same.
     */
    @NotNull
    private static String normalize(@NotNull String component) {
        StringBuilder builder = new StringBuilder(component.length());
        int i = 0;
        while (i < component.length()) {
            char c = component.charAt(i);
            if (!isAsciiDigit(c)) {
                builder.append(c);
                i++;
                continue;
            }
            int end = i;
            while (end < component.length() && isAsciiDigit(component.charAt(end))) {
                end++;
            }
            if (end == component.length() && AddonVersion.isZeros(component, i, end)) {
                // a trailing run of zeros compares equal to no run at all
                break;
            }
            int start = i;
            while (start < end - 1 && component.charAt(start) == '0') {
                start++;
            }
            builder.append(component, start, end);
            i = end;
        }
        return builder.toString();
    }

    private final long epoch;
    @NotNull
    private final String normalized;
    @NotNull
    private final String originText;
    @NotNull
    private final String revision;
    @NotNull
    private final String upstream;

    private AddonVersion(@NotNull String originText, long epoch, @NotNull String upstream, @NotNull String revision) {
        this.originText = originText;
        this.epoch = epoch;
        this.upstream = upstream;
        this.revision = revision;
        this.normalized = epoch + ":" + AddonVersion.normalize(upstream) + '+' + AddonVersion.normalize(revision);
    }

    @Override
    public int compareTo(@NotNull AddonVersion other) {
        if (this.epoch != other.epoch) {
            return Long.compare(this.epoch, other.epoch);
        }
        int result = AddonVersion.compareComponent(this.upstream, other.upstream);
        if (result != 0) {
            return result;
        }
        return AddonVersion.compareComponent(this.revision, other.revision);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof AddonVersion) {
            return ((AddonVersion) obj).normalized.equals(this.normalized);
        }
        return false;
    }

    @Contract(pure = true)
    public long getEpoch() {
        return this.epoch;
    }

    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @NotNull
    @Contract(pure = true)
    public String getRevision() {
        return this.revision;
    }

    @NotNull
    @Contract(pure = true)
    public String getUpstream() {
        return this.upstream;
    }

    @Override
    public int hashCode() {
        return this.normalized.hashCode();
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull AddonVersion other) {
        return this.compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return this.originText;
    }
}
