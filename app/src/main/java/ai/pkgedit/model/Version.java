package ai.pkgedit.model;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * A semantic version, ordered by semver precedence. Build metadata has no precedence of its own; it only breaks ties
 * between otherwise equal versions so that ordering stays consistent with {@link #equals}.
 */
public record Version(int major, int minor, int patch, List<String> prerelease, List<String> build)
        implements Comparable<Version> {

    private static final Pattern SEMVER = Pattern.compile(
            "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$");

    public Version {
        prerelease = ImmutableList.copyOf(prerelease);
        build = ImmutableList.copyOf(build);
    }

    public static Version of(int major, int minor, int patch) {
        return new Version(major, minor, patch, List.of(), List.of());
    }

    /** Parses {@code text}, or returns null if it is not a semantic version (including components beyond int range). */
    @Nullable
    public static Version tryParse(String text) {
        var m = SEMVER.matcher(text.trim());
        if (!m.matches()) {
            return null;
        }
        try {
            return new Version(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    m.group(4) == null ? List.of() : Splitter.on('.').splitToList(m.group(4)),
                    m.group(5) == null ? List.of() : Splitter.on('.').splitToList(m.group(5)));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Like {@link #tryParse} but also accepts a git tag with a leading {@code v}, e.g. {@code v1.2.3}. */
    @Nullable
    public static Version fromTag(String tag) {
        if (tag.startsWith("v") || tag.startsWith("V")) {
            return tryParse(tag.substring(1));
        }
        return tryParse(tag);
    }

    public static Version parse(String text) {
        var version = tryParse(text);
        if (version == null) {
            throw new IllegalArgumentException("not a semantic version: '" + text + "'");
        }
        return version;
    }

    public boolean isPrerelease() {
        return !prerelease.isEmpty();
    }

    @Override
    public int compareTo(Version other) {
        int c = Integer.compare(major, other.major);
        if (c != 0) return c;
        c = Integer.compare(minor, other.minor);
        if (c != 0) return c;
        c = Integer.compare(patch, other.patch);
        if (c != 0) return c;

        // a release ranks above any of its prereleases
        if (prerelease.isEmpty() != other.prerelease.isEmpty()) {
            return Boolean.compare(prerelease.isEmpty(), other.prerelease.isEmpty());
        }
        c = compareIdentifierLists(prerelease, other.prerelease);
        if (c != 0) return c;
        return compareIdentifierLists(build, other.build);
    }

    private static int compareIdentifierLists(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = compareIdentifiers(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private static int compareIdentifiers(String a, String b) {
        boolean aNumeric = a.chars().allMatch(Character::isDigit);
        boolean bNumeric = b.chars().allMatch(Character::isDigit);
        if (aNumeric && bNumeric) {
            // numeric identifiers may exceed any primitive range
            String x = stripLeadingZeros(a);
            String y = stripLeadingZeros(b);
            int c = Integer.compare(x.length(), y.length());
            c = c != 0 ? c : x.compareTo(y);
            return c != 0 ? c : a.compareTo(b);
        }
        if (aNumeric != bNumeric) {
            return aNumeric ? -1 : 1;
        }
        return a.compareTo(b);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder().append(major).append('.').append(minor).append('.').append(patch);
        if (!prerelease.isEmpty()) {
            sb.append('-').append(String.join(".", prerelease));
        }
        if (!build.isEmpty()) {
            sb.append('+').append(String.join(".", build));
        }
        return sb.toString();
    }
}
