package io.livekit.sdk.grants;

/**
 * Egress started automatically for a room created from the token's configuration.
 */
public record RoomEgress(
    RoomCompositeEgressRequest room,
    AutoParticipantEgress participant,
    AutoTrackEgress tracks
) {
}
