package ai.pkgedit.session;

import ai.pkgedit.manifest.Manifest;
import ai.pkgedit.rewrite.ManifestEditException;
import ai.pkgedit.syntax.Syntax.SourceFile;

/** Decides whether an edited tree may replace the committed one. */
public interface ManifestVerifier {

    /**
     * @return the manifest the candidate describes
     * @throws ManifestEditException with reason {@code VERIFICATION_FAILED} when the candidate must be rejected
     */
    Manifest verify(SourceFile candidate) throws ManifestEditException;
}
