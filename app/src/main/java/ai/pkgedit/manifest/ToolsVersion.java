package ai.pkgedit.manifest;

import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** The {@code swift-tools-version} a manifest declares in its first line. */
public record ToolsVersion(int major, int minor, int patch) implements Comparable<ToolsVersion> {

    private static final Pattern HEADER =
            Pattern.compile("^//\\s*swift-tools-version\\s*:\\s*(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?\\s*(?:;.*)?$");

    private static final Pattern VALUE = Pattern.compile("^(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?$");

    /** Parses a bare version such as {@code 5.2} or {@code 5.2.1}. */
    public static ToolsVersion parse(String text) {
        var m = VALUE.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("not a tools version: '" + text + "'");
        }
        var version = fromGroups(m.group(1), m.group(2), m.group(3));
        if (version == null) {
            throw new IllegalArgumentException("tools version out of range: '" + text + "'");
        }
        return version;
    }

    /** Reads the tools version from a manifest's first line; null if the header is missing or out of range. */
    @Nullable
    public static ToolsVersion fromManifest(String manifestText) {
        int newline = manifestText.indexOf('\n');
        String firstLine = (newline >= 0 ? manifestText.substring(0, newline) : manifestText).strip();
        var m = HEADER.matcher(firstLine);
        if (!m.matches()) {
            return null;
        }
        return fromGroups(m.group(1), m.group(2), m.group(3));
    }

    @Nullable
    private static ToolsVersion fromGroups(String major, @Nullable String minor, @Nullable String patch) {
        try {
            return new ToolsVersion(
                    Integer.parseInt(major),
                    minor == null ? 0 : Integer.parseInt(minor),
                    patch == null ? 0 : Integer.parseInt(patch));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isAtLeast(ToolsVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(ToolsVersion other) {
        int c = Integer.compare(major, other.major);
        if (c != 0) return c;
        c = Integer.compare(minor, other.minor);
        if (c != 0) return c;
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return patch == 0 ? major + "." + minor : major + "." + minor + "." + patch;
    }
}
