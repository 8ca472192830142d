package io.livekit.sdk.grants;

import io.livekit.sdk.internal.RecordHydrator;

import java.util.Map;

/**
 * Grants carried by an access token, next to the registered JWT claims.
 *
 * <p>{@code name} is the participant's display name, {@code kind} the participant kind ({@code standard},
 * {@code agent}, {@code sip}, ...) and {@code sha256} an integrity hash of the token's intended payload.
 */
public record ClaimGrants(
    String identity,
    String name,
    String kind,
    VideoGrant video,
    SipGrant sip,
    AgentGrant agent,
    InferenceGrant inference,
    ObservabilityGrant observability,
    RoomConfiguration roomConfig,
    String roomPreset,
    String sha256,
    String metadata,
    Map<String, String> attributes
) {

    private static final ClaimGrants EMPTY = new ClaimGrants(
        null, null, null, null, null, null, null, null, null, null, null, null, null);

    public ClaimGrants {
        attributes = Copies.map(attributes);
    }

    public static ClaimGrants empty() {
        return EMPTY;
    }

    /**
     * Hydrates grants from a map keyed by internal (snake_case) field names. Unknown keys are ignored and
     * malformed values are left unset.
     */
    public static ClaimGrants fromMap(Map<String, ?> fields) {
        return RecordHydrator.hydrate(ClaimGrants.class, fields);
    }

    public ClaimGrants withIdentity(String identity) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withName(String name) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withKind(String kind) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withVideo(VideoGrant video) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withSip(SipGrant sip) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withAgent(AgentGrant agent) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withInference(InferenceGrant inference) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withObservability(ObservabilityGrant observability) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withRoomConfig(RoomConfiguration roomConfig) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withRoomPreset(String roomPreset) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withSha256(String sha256) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withMetadata(String metadata) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }

    public ClaimGrants withAttributes(Map<String, String> attributes) {
        return new ClaimGrants(identity, name, kind, video, sip, agent, inference, observability, roomConfig,
            roomPreset, sha256, metadata, attributes);
    }
}
