package io.livekit.sdk.grants;

public enum AudioCodec {
    DEFAULT_AC,
    OPUS,
    AAC,
    AC_MP3
}
