package io.livekit.sdk.grants;

import java.util.List;

/**
 * Composite recording of a whole room, started automatically when the room is created.
 *
 * <p>Either {@code preset} or {@code advanced} selects the encoding. Outputs of each kind are independent lists.
 */
public record RoomCompositeEgressRequest(
    String roomName,
    String layout,
    Boolean audioOnly,
    Boolean videoOnly,
    String customBaseUrl,
    String preset,
    EncodingOptions advanced,
    List<EncodedFileOutput> fileOutputs,
    List<StreamOutput> streamOutputs,
    List<SegmentedFileOutput> segmentOutputs,
    List<ImageOutput> imageOutputs,
    List<WebhookConfig> webhooks
) {

    public RoomCompositeEgressRequest {
        fileOutputs = Copies.list(fileOutputs);
        streamOutputs = Copies.list(streamOutputs);
        segmentOutputs = Copies.list(segmentOutputs);
        imageOutputs = Copies.list(imageOutputs);
        webhooks = Copies.list(webhooks);
    }
}
