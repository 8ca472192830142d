package io.livekit.sdk.signing;

import io.livekit.sdk.LivekitException;

/**
 * Raised by a {@link ClaimsSigner} when a token cannot be signed, decoded or verified.
 */
public class SigningException extends LivekitException {

    private static final long serialVersionUID = 1L;

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
