package io.livekit.sdk.grants;

public enum ImageCodec {
    IC_DEFAULT,
    IC_JPEG
}
