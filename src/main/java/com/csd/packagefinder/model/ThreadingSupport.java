package com.csd.packagefinder.model;

public enum ThreadingSupport {
    EXPLICIT("Supported"),           // thread flags or parallelism keywords found
    NONE_DETECTED("No explicit support found"),
    UNKNOWN("Unknown");              // nothing to scan

    private final String label;

    ThreadingSupport(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
