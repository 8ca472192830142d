package io.livekit.sdk.grants;

import java.util.Map;

/**
 * S3 (or S3-compatible) destination for egress output.
 *
 * <p>{@code accessKey}, {@code secret} and {@code sessionToken} are credentials; a token carrying them is only signed
 * when sensitive credentials are explicitly allowed.
 */
public record S3Upload(
    String accessKey,
    String secret,
    String sessionToken,
    String region,
    String endpoint,
    String bucket,
    Boolean forcePathStyle,
    Map<String, String> metadata,
    String tagging,
    String contentDisposition
) {

    public S3Upload {
        metadata = Copies.map(metadata);
    }
}
