package io.livekit.sdk.grants;

import java.util.List;

/**
 * Live stream output, e.g. RTMP ingest endpoints.
 */
public record StreamOutput(
    StreamProtocol protocol,
    List<String> urls
) {

    public StreamOutput {
        urls = Copies.list(urls);
    }
}
