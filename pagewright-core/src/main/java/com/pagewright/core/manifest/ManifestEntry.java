package com.pagewright.core.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Cached state for one source file.
 *
 * @param modified modification time recorded at the last successful build
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestEntry(@JsonProperty("modified") FileTimestamp modified) {

    public ManifestEntry {
        Objects.requireNonNull(modified, "modified must not be null");
    }
}
