package io.livekit.sdk.grants;

public record AzureBlobUpload(
    String accountName,
    String accountKey,
    String containerName
) {
}
