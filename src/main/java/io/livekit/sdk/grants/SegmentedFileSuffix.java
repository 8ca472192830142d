package io.livekit.sdk.grants;

/**
 * Naming of individual segments: by index or by wall-clock timestamp.
 */
public enum SegmentedFileSuffix {
    INDEX,
    TIMESTAMP
}
