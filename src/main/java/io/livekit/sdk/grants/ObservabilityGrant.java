package io.livekit.sdk.grants;

/**
 * Permission to write observability data (traces, logs) for a session.
 */
public record ObservabilityGrant(
    Boolean write
) {

    public static ObservabilityGrant ofWrite() {
        return new ObservabilityGrant(true);
    }
}
