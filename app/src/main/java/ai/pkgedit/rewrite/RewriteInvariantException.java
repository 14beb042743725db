package ai.pkgedit.rewrite;

/**
 * The rewriter broke one of its own guarantees, e.g. a node it just inserted cannot be located again. Never caused by
 * manifest content.
 */
public class RewriteInvariantException extends IllegalStateException {
    public RewriteInvariantException(String message) {
        super(message);
    }
}
