package org.cortexview.observatory.api.stores;

/**
 * Thrown by a store reader when the external store could not be reached, rejected the
 * request or answered with something that could not be interpreted.
 * <p>
 * Callers treat this as a transient condition: the last successfully read state is reused
 * and the source is marked stale.
 */
public class SourceUnavailableException extends Exception {

    private final String source;

    public SourceUnavailableException(final String source, final String message) {
        super(message);
        this.source = source;
    }

    public SourceUnavailableException(final String source, final String message, final Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * @return The name of the store reader that failed.
     */
    public String getSource() {
        return source;
    }
}
