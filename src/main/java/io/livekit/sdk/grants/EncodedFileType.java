package io.livekit.sdk.grants;

/**
 * Container format of a recorded file.
 */
public enum EncodedFileType {
    DEFAULT_FILETYPE,
    MP4,
    OGG,
    MP3
}
