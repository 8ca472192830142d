package io.livekit.sdk.grants;

/**
 * Periodic thumbnail capture. {@code captureInterval} is in seconds.
 */
public record ImageOutput(
    Integer captureInterval,
    Integer width,
    Integer height,
    String filenamePrefix,
    ImageFileSuffix filenameSuffix,
    ImageCodec imageCodec,
    Boolean disableManifest,
    S3Upload s3,
    GCPUpload gcp,
    AzureBlobUpload azure,
    AliOSSUpload aliOss
) {
}
