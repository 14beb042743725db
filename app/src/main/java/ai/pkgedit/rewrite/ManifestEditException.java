package ai.pkgedit.rewrite;

import java.util.Objects;

/** A requested manifest edit could not be made. {@link #getReason()} classifies why. */
public class ManifestEditException extends Exception {

    public enum Reason {
        /** The Package initializer, or a labeled argument the edit needs, is absent. */
        STRUCTURE_NOT_FOUND,
        /** More than one Package initializer, or an argument value that is not an array or array concatenation. */
        STRUCTURE_AMBIGUOUS,
        /** A named target or product does not exist. */
        ENTITY_NOT_FOUND,
        /** Tools version too old, duplicate names, or an inconsistent binary target location and checksum. */
        PRECONDITION_FAILED,
        /** The edited manifest did not reparse or did not load. */
        VERIFICATION_FAILED
    }

    private final Reason reason;

    public ManifestEditException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason);
    }

    public ManifestEditException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason);
    }

    public Reason getReason() {
        return reason;
    }
}
