package io.livekit.sdk.grants;

/**
 * Permission to manage agent dispatches.
 */
public record AgentGrant(
    Boolean admin
) {

    public static AgentGrant ofAdmin() {
        return new AgentGrant(true);
    }
}
