package com.csd.packagefinder.exception;

/**
 * Usage error: the search request itself is malformed (no names, blank name, no registries).
 * Unlike per-registry failures, this aborts the call.
 */
public class InvalidSearchRequestException extends IllegalArgumentException {

    public InvalidSearchRequestException(String message) {
        super(message);
    }
}
