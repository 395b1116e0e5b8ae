package com.pagewright.core.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.attribute.FileTime;
import java.time.Instant;

/**
 * Modification time as persisted in the manifest: whole seconds plus nanoseconds since the epoch.
 *
 * @param secsSinceEpoch seconds since the Unix epoch
 * @param nanosSinceEpoch nanosecond adjustment within the second
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileTimestamp(
    @JsonProperty("secs_since_epoch") long secsSinceEpoch,
    @JsonProperty("nanos_since_epoch") int nanosSinceEpoch
) implements Comparable<FileTimestamp> {

    public static FileTimestamp of(FileTime time) {
        Instant instant = time.toInstant();
        return new FileTimestamp(instant.getEpochSecond(), instant.getNano());
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(secsSinceEpoch, nanosSinceEpoch);
    }

    public boolean isAfter(FileTimestamp other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(FileTimestamp other) {
        return toInstant().compareTo(other.toInstant());
    }
}
