package io.livekit.sdk.grants;

/**
 * Recording of every published track, one file per track.
 */
public record AutoTrackEgress(
    String filepath,
    Boolean disableManifest,
    S3Upload s3,
    GCPUpload gcp,
    AzureBlobUpload azure,
    AliOSSUpload aliOss
) {
}
