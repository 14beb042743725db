package ai.pkgedit.session;

import ai.pkgedit.manifest.Manifest;
import ai.pkgedit.rewrite.ManifestEditException;
import ai.pkgedit.rewrite.ManifestRewriter;
import ai.pkgedit.syntax.Syntax.SourceFile;
import ai.pkgedit.syntax.parser.ManifestParseException;
import ai.pkgedit.syntax.parser.ManifestParser;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Owns the committed tree of one manifest while a sequence of edits is applied to it.
 *
 * <p>Each {@link #apply} builds a candidate tree, verifies it and only then makes it current. A failed edit leaves the
 * committed tree exactly as it was. Sessions are not thread-safe.
 */
public class EditSession {
    private static final Logger logger = LogManager.getLogger(EditSession.class);

    private final ManifestRewriter rewriter;
    private final ManifestVerifier verifier;
    private SourceFile current;
    private @Nullable Manifest manifest;
    private int committedEdits;

    public EditSession(SourceFile initial, ManifestRewriter rewriter, ManifestVerifier verifier) {
        this.current = Objects.requireNonNull(initial);
        this.rewriter = Objects.requireNonNull(rewriter);
        this.verifier = Objects.requireNonNull(verifier);
    }

    public static EditSession open(String text, ManifestRewriter rewriter, ManifestVerifier verifier)
            throws ManifestParseException {
        return new EditSession(ManifestParser.parse(text), rewriter, verifier);
    }

    /**
     * Applies one edit.
     *
     * @return the manifest described by the new committed tree
     */
    public Manifest apply(ManifestEdit edit) throws ManifestEditException {
        logger.debug("Applying edit: {}", edit.describe());
        SourceFile candidate = edit.applyTo(rewriter, current);
        Manifest manifest = verifier.verify(candidate);
        current = candidate;
        this.manifest = manifest;
        committedEdits++;
        logger.debug("Committed edit #{}: {}", committedEdits, edit.describe());
        return manifest;
    }

    public SourceFile current() {
        return current;
    }

    /** The manifest verified with the last committed edit, or null before the first one. */
    public @Nullable Manifest manifest() {
        return manifest;
    }

    public String currentText() {
        return current.toSource();
    }

    public int committedEdits() {
        return committedEdits;
    }
}
