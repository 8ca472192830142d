package io.livekit.sdk.auth;

import io.livekit.sdk.LivekitException;

/**
 * Thrown by the {@code ...OrThrow} variants of the token operations.
 */
public final class AccessTokenException extends LivekitException {

    private static final long serialVersionUID = 1L;

    private final transient TokenError error;

    public AccessTokenException(TokenError error) {
        super(error.message(), error.cause());
        this.error = error;
    }

    public TokenError getError() {
        return error;
    }

    public TokenError.Kind getKind() {
        return error.kind();
    }
}
