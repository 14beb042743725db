package ai.pkgedit.model;

import java.util.Locale;

/**
 * Identity of a package derived from its location: the last path component, without a {@code .git} suffix,
 * lower-cased. Two dependencies with the same identity refer to the same package.
 */
public record PackageIdentity(String value) {

    public static PackageIdentity fromLocation(String location) {
        String trimmed = location.trim();
        while (trimmed.endsWith("/") && trimmed.length() > 1) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        String last = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        // scp-style git locations: git@host:org/repo.git
        int colon = last.lastIndexOf(':');
        if (colon >= 0) {
            last = last.substring(colon + 1);
        }
        if (last.endsWith(".git")) {
            last = last.substring(0, last.length() - ".git".length());
        }
        return new PackageIdentity(last.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return value;
    }
}
