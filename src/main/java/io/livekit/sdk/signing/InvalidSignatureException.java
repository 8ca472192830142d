package io.livekit.sdk.signing;

/**
 * The token is well formed but its signature does not match the secret.
 */
public final class InvalidSignatureException extends SigningException {

    private static final long serialVersionUID = 1L;

    public InvalidSignatureException(String message) {
        super(message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
