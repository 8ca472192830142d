package io.livekit.sdk.grants;

/**
 * HLS-style segmented recording.
 */
public record SegmentedFileOutput(
    SegmentedFileProtocol protocol,
    String filenamePrefix,
    String playlistName,
    String livePlaylistName,
    Integer segmentDuration,
    SegmentedFileSuffix filenameSuffix,
    Boolean disableManifest,
    S3Upload s3,
    GCPUpload gcp,
    AzureBlobUpload azure,
    AliOSSUpload aliOss
) {
}
