package ai.pkgedit.model;

import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** Classifies dependency and artifact locations as remote URLs or local paths. */
public final class Locations {
    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*)://");

    private Locations() {}

    /** The URL scheme of {@code location}, or null if it has none and is therefore a local path. */
    @Nullable
    public static String scheme(String location) {
        var m = SCHEME.matcher(location);
        return m.find() ? m.group(1) : null;
    }

    public static boolean isRemote(String location) {
        return scheme(location) != null;
    }
}
