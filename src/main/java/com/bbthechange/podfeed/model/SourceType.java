package com.bbthechange.podfeed.model;

/**
 * Kind of Vimeo source a feed is built from.
 * Each kind maps to the API path segment its metadata and videos live under.
 */
public enum SourceType {
    CHANNEL("channels"),
    GROUP("groups"),
    USER("users");

    private final String pathSegment;

    SourceType(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String getPathSegment() {
        return pathSegment;
    }
}
