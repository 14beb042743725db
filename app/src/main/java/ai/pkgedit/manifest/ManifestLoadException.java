package ai.pkgedit.manifest;

/** The manifest parsed, or failed to parse, but does not describe a valid package. */
public class ManifestLoadException extends Exception {
    public ManifestLoadException(String message) {
        super(message);
    }

    public ManifestLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
