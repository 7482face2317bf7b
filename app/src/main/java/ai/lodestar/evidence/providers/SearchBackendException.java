package ai.lodestar.evidence.providers;

/** A search backend could not complete a request. */
public class SearchBackendException extends Exception {
    public SearchBackendException(String message) {
        super(message);
    }

    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
