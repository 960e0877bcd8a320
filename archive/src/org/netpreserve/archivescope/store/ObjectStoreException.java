package org.netpreserve.archivescope.store;

/**
 * An object store request failed for a reason other than the object not existing.
 */
public class ObjectStoreException extends RuntimeException {
    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public ObjectStoreException(String message) {
        super(message);
    }
}
