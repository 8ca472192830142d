package io.livekit.sdk.grants;

/**
 * Agent dispatched into the room when it is created.
 */
public record RoomAgentDispatch(
    String agentName,
    String metadata
) {
}
