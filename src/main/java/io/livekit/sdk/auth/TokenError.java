package io.livekit.sdk.auth;

import java.util.Locale;
import java.util.Objects;

/**
 * Reason an access token could not be signed or parsed.
 */
public record TokenError(
    Kind kind,
    String message,
    Throwable cause
) {

    public enum Kind {
        MISSING_ISSUER,
        MISSING_SECRET,
        SENSITIVE_CREDENTIALS,
        SIGNER_FAILURE,
        INVALID_SIGNATURE,
        INVALID_ISSUER,
        VERIFIER_FAILURE,
        TOKEN_EXPIRED
    }

    public TokenError {
        Objects.requireNonNull(kind, "kind");
        if (message == null || message.isBlank()) {
            message = kind.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        }
    }

    public static TokenError of(Kind kind, String message) {
        return new TokenError(kind, message, null);
    }
}
