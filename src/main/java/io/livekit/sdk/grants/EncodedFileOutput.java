package io.livekit.sdk.grants;

/**
 * Single recorded file. At most one of the upload destinations is expected to be set.
 */
public record EncodedFileOutput(
    EncodedFileType fileType,
    String filepath,
    Boolean disableManifest,
    S3Upload s3,
    GCPUpload gcp,
    AzureBlobUpload azure,
    AliOSSUpload aliOss
) {
}
