package io.livekit.sdk.grants;

/**
 * Google Cloud Storage destination. {@code credentials} is the service account JSON.
 */
public record GCPUpload(
    String credentials,
    String bucket
) {
}
