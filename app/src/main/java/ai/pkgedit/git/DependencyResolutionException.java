package ai.pkgedit.git;

/** A dependency's versions or manifest could not be obtained from where it lives. */
public class DependencyResolutionException extends Exception {
    public DependencyResolutionException(String message) {
        super(message);
    }

    public DependencyResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
