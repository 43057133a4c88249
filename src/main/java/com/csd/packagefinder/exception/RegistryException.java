package com.csd.packagefinder.exception;

import com.csd.packagefinder.model.ErrorReason;

/**
 * Raised inside a registry adapter when the registry cannot be checked.
 * Converted into a {@link com.csd.packagefinder.model.RegistrySearchError} before it reaches the searcher.
 */
public class RegistryException extends Exception {

    private final ErrorReason reason;

    public RegistryException(ErrorReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RegistryException(ErrorReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ErrorReason getReason() {
        return reason;
    }
}
