package org.netpreserve.archivescope.cache;

public class RemoteTierException extends Exception {
    public RemoteTierException(String message, Throwable cause) {
        super(message, cause);
    }
}
