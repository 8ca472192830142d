package io.livekit.sdk.grants;

/**
 * Explicit encoder settings, used instead of a named preset.
 */
public record EncodingOptions(
    Integer width,
    Integer height,
    Integer depth,
    Integer framerate,
    AudioCodec audioCodec,
    Integer audioBitrate,
    Integer audioFrequency,
    VideoCodec videoCodec,
    Integer videoBitrate,
    Double keyFrameInterval
) {
}
