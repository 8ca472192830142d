package io.livekit.sdk.grants;

public enum StreamProtocol {
    DEFAULT_PROTOCOL,
    RTMP,
    SRT
}
