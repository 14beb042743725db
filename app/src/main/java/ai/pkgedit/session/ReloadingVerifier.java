package ai.pkgedit.session;

import ai.pkgedit.manifest.Manifest;
import ai.pkgedit.manifest.ManifestLoadException;
import ai.pkgedit.manifest.ManifestLoader;
import ai.pkgedit.rewrite.ManifestEditException;
import ai.pkgedit.rewrite.ManifestEditException.Reason;
import ai.pkgedit.syntax.Syntax.SourceFile;
import ai.pkgedit.syntax.parser.ManifestParseException;
import ai.pkgedit.syntax.parser.ManifestParser;
import java.util.Objects;

/**
 * Prints the candidate, parses the text again from scratch and runs it through the {@link ManifestLoader}. The
 * candidate tree itself is never handed to the loader, so a tree that only looks right in memory cannot pass.
 */
public class ReloadingVerifier implements ManifestVerifier {
    private final ManifestLoader loader;

    public ReloadingVerifier(ManifestLoader loader) {
        this.loader = Objects.requireNonNull(loader);
    }

    public ReloadingVerifier() {
        this(new ManifestLoader());
    }

    @Override
    public Manifest verify(SourceFile candidate) throws ManifestEditException {
        String text = candidate.toSource();
        try {
            return loader.load(ManifestParser.parse(text));
        } catch (ManifestParseException | ManifestLoadException e) {
            throw new ManifestEditException(
                    Reason.VERIFICATION_FAILED, "failed to verify edited manifest: " + e.getMessage(), e);
        }
    }
}
