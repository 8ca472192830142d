package io.livekit.sdk.grants;

import java.util.List;

/**
 * Recording started for every participant that joins the room.
 */
public record AutoParticipantEgress(
    String preset,
    EncodingOptions advanced,
    List<EncodedFileOutput> fileOutputs,
    List<SegmentedFileOutput> segmentOutputs
) {

    public AutoParticipantEgress {
        fileOutputs = Copies.list(fileOutputs);
        segmentOutputs = Copies.list(segmentOutputs);
    }
}
