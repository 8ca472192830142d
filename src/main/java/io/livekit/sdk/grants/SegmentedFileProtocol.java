package io.livekit.sdk.grants;

public enum SegmentedFileProtocol {
    DEFAULT_SEGMENTED_FILE_PROTOCOL,
    HLS_PROTOCOL
}
