package io.livekit.sdk.grants;

/**
 * Permission to run inference through the platform.
 */
public record InferenceGrant(
    Boolean perform
) {

    public static InferenceGrant ofPerform() {
        return new InferenceGrant(true);
    }
}
