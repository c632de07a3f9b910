package com.crossreview.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * Stable, content-independent identifier of a file within a project.
 * Built by {@link com.crossreview.core.identity.FileIdentityService}; used as the cache partition key.
 */
public record FileIdentity(String value) implements Serializable {

    public FileIdentity {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("File identity must not be blank");
        }
    }

    @JsonCreator
    public static FileIdentity of(String value) {
        return new FileIdentity(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
