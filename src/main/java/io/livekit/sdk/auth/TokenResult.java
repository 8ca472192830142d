package io.livekit.sdk.auth;

import java.util.Objects;

/**
 * Outcome of a token operation: either a value or a {@link TokenError}.
 */
public final class TokenResult<T> {

    private final T value;
    private final TokenError error;

    private TokenResult(T value, TokenError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> TokenResult<T> ok(T value) {
        return new TokenResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> TokenResult<T> failure(TokenError error) {
        return new TokenResult<>(null, Objects.requireNonNull(error, "error"));
    }

    static <T> TokenResult<T> failure(TokenError.Kind kind, String message) {
        return failure(TokenError.of(kind, message));
    }

    static <T> TokenResult<T> failure(TokenError.Kind kind, String message, Throwable cause) {
        return failure(new TokenError(kind, message, cause));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @throws IllegalStateException when this result is a failure.
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("token result is a failure: " + error.message());
        }
        return value;
    }

    /**
     * @return the failure, or {@code null} for a successful result.
     */
    public TokenError error() {
        return error;
    }

    public T orElseThrow() throws AccessTokenException {
        if (error != null) {
            throw new AccessTokenException(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "TokenResult[ok]" : "TokenResult[" + error.kind() + ": " + error.message() + "]";
    }
}
