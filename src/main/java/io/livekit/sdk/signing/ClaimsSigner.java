package io.livekit.sdk.signing;

import java.util.Map;

/**
 * Signs claim maps into compact tokens and recovers claims from them.
 *
 * <p>Implementations check signatures only. Registered time claims such as {@code exp} are returned as-is and
 * enforced by the caller.
 */
public interface ClaimsSigner {

    String sign(Map<String, Object> claims, byte[] secret) throws SigningException;

    /**
     * @throws InvalidSignatureException when the signature does not match {@code secret}.
     */
    Map<String, Object> verify(String token, byte[] secret) throws SigningException;

    /**
     * Decodes the claims without checking the signature. For inspection only.
     */
    Map<String, Object> decode(String token) throws SigningException;
}
