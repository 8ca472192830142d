package io.livekit.sdk.grants;

public enum VideoCodec {
    DEFAULT_VC,
    H264_BASELINE,
    H264_MAIN,
    H264_HIGH,
    VP8
}
