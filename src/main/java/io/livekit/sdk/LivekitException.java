package io.livekit.sdk;

/**
 * Base exception thrown by the LiveKit Java SDK.
 */
public class LivekitException extends Exception {

    private static final long serialVersionUID = 1L;

    public LivekitException(String message) {
        super(message);
    }

    public LivekitException(String message, Throwable cause) {
        super(message, cause);
    }
}
