package io.livekit.sdk.auth;

/**
 * Checks applied when parsing a signed token, on top of the signature.
 *
 * @param verifyExpiry   reject tokens whose {@code exp} claim is in the past
 * @param expectedIssuer when set, the {@code iss} claim must equal this API key
 */
public record ParseOptions(
    boolean verifyExpiry,
    String expectedIssuer
) {

    private static final ParseOptions DEFAULTS = new ParseOptions(true, null);

    public static ParseOptions defaults() {
        return DEFAULTS;
    }

    public ParseOptions withVerifyExpiry(boolean verifyExpiry) {
        return new ParseOptions(verifyExpiry, expectedIssuer);
    }

    public ParseOptions withExpectedIssuer(String expectedIssuer) {
        return new ParseOptions(verifyExpiry, expectedIssuer);
    }
}
