package com.csd.packagefinder.model;

public enum ErrorReason {
    NETWORK_FAILURE,  // connection, DNS, TLS or unexpected HTTP status
    PARSE_FAILURE,    // response shape not what the adapter expects
    RATE_LIMITED,
    TIMEOUT,
    UNSUPPORTED       // adapter declines, e.g. missing credentials
}
