package org.netpreserve.archivescope.index;

/**
 * An index server request that could not be completed.
 */
public class IndexQueryException extends Exception {
    private final int statusCode;

    public IndexQueryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public IndexQueryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed request or -1 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
