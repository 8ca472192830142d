package io.livekit.sdk.grants;

/**
 * Alibaba Cloud OSS destination.
 */
public record AliOSSUpload(
    String accessKey,
    String secret,
    String region,
    String endpoint,
    String bucket
) {
}
