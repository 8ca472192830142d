package io.livekit.sdk.grants;

/**
 * Permissions for SIP trunk and call management.
 */
public record SipGrant(
    Boolean admin,
    Boolean call
) {

    public static SipGrant ofAdmin() {
        return new SipGrant(true, null);
    }

    public static SipGrant ofCall() {
        return new SipGrant(null, true);
    }
}
