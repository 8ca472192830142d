package io.livekit.sdk.auth;

import io.livekit.sdk.Config;
import io.livekit.sdk.grants.ClaimGrants;
import io.livekit.sdk.grants.SensitiveCredentials;
import io.livekit.sdk.signing.ClaimsSigner;
import io.livekit.sdk.signing.InvalidSignatureException;
import io.livekit.sdk.signing.SigningException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Signs {@link AccessToken}s into JWTs and rebuilds them from signed strings.
 *
 * <p>Instances are immutable and safe to share between threads. The clock is read once per operation.
 */
public final class AccessTokenCodec {

    private static final Logger LOGGER = Logger.getLogger(AccessTokenCodec.class.getName());

    static final String CLAIM_ISSUER = "iss";
    static final String CLAIM_SUBJECT = "sub";
    static final String CLAIM_NOT_BEFORE = "nbf";
    static final String CLAIM_EXPIRES_AT = "exp";

    /**
     * Registered claims that never map onto grants.
     */
    static final List<String> REGISTERED_CLAIMS = List.of(
        CLAIM_ISSUER, CLAIM_SUBJECT, CLAIM_NOT_BEFORE, CLAIM_EXPIRES_AT, "iat", "jti");

    private final Clock clock;
    private final Duration defaultTtl;
    private final ClaimsSigner signer;

    public AccessTokenCodec() {
        this(Config.builder().build());
    }

    public AccessTokenCodec(Config config) {
        Objects.requireNonNull(config, "config");
        this.clock = config.getClock();
        this.defaultTtl = config.getDefaultTtl();
        this.signer = config.getSigner();
    }

    static AccessTokenCodec defaultCodec() {
        return DefaultHolder.INSTANCE;
    }

    public TokenResult<String> sign(AccessToken token) {
        Objects.requireNonNull(token, "token");
        if (isBlank(token.getApiKey())) {
            return TokenResult.failure(TokenError.Kind.MISSING_ISSUER, "api key is required");
        }
        if (isBlank(token.getApiSecret())) {
            return TokenResult.failure(TokenError.Kind.MISSING_SECRET, "api secret is required");
        }

        long issuedAt = clock.instant().getEpochSecond();
        Duration validFor = Optional.ofNullable(token.getTtl()).orElse(defaultTtl);
        if (validFor.isNegative()) {
            validFor = Duration.ZERO;
        }
        long expiresAt = issuedAt + validFor.getSeconds();

        ClaimGrants grants = token.getGrants();
        if (grants.roomConfig() != null && !token.isAllowSensitiveCredentials()) {
            Optional<String> leaked = SensitiveCredentials.find(grants.roomConfig());
            if (leaked.isPresent()) {
                LOGGER.fine(() -> "[livekit-sdk] refusing to sign token with credentials at " + leaked.get());
                return TokenResult.failure(TokenError.Kind.SENSITIVE_CREDENTIALS,
                    "room configuration contains credentials at " + leaked.get()
                        + "; allow sensitive credentials explicitly to sign it");
            }
        }

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(CLAIM_ISSUER, token.getApiKey());
        if (grants.identity() != null) {
            claims.put(CLAIM_SUBJECT, grants.identity());
        }
        claims.put(CLAIM_NOT_BEFORE, issuedAt);
        claims.put(CLAIM_EXPIRES_AT, expiresAt);
        claims.putAll(GrantClaims.toClaims(grants));

        try {
            String jwt = signer.sign(claims, token.getApiSecret().getBytes(StandardCharsets.UTF_8));
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[livekit-sdk] signed token for identity %s valid until %d", grants.identity(), expiresAt));
            return TokenResult.ok(jwt);
        } catch (SigningException ex) {
            return TokenResult.failure(TokenError.Kind.SIGNER_FAILURE, ex.getMessage(), ex);
        }
    }

    public String signOrThrow(AccessToken token) throws AccessTokenException {
        return sign(token).orElseThrow();
    }

    public TokenResult<AccessToken> parse(String jwt, String apiSecret) {
        return parse(jwt, apiSecret, ParseOptions.defaults());
    }

    /**
     * Verifies the signature of {@code jwt} with {@code apiSecret}, applies {@code options} and rebuilds the token.
     * The returned token carries {@code apiSecret}.
     */
    public TokenResult<AccessToken> parse(String jwt, String apiSecret, ParseOptions options) {
        ParseOptions resolved = options == null ? ParseOptions.defaults() : options;
        if (isBlank(apiSecret)) {
            return TokenResult.failure(TokenError.Kind.MISSING_SECRET, "api secret is required");
        }

        Map<String, Object> claims;
        try {
            claims = signer.verify(jwt, apiSecret.getBytes(StandardCharsets.UTF_8));
        } catch (InvalidSignatureException ex) {
            LOGGER.fine(() -> "[livekit-sdk] rejecting token: " + ex.getMessage());
            return TokenResult.failure(TokenError.Kind.INVALID_SIGNATURE, ex.getMessage(), ex);
        } catch (SigningException ex) {
            return TokenResult.failure(TokenError.Kind.VERIFIER_FAILURE, ex.getMessage(), ex);
        }

        long now = clock.instant().getEpochSecond();
        Long expiresAt = longClaim(claims, CLAIM_EXPIRES_AT);
        if (resolved.verifyExpiry() && expiresAt != null && expiresAt < now) {
            return TokenResult.failure(TokenError.Kind.TOKEN_EXPIRED, String.format(Locale.ROOT,
                "token expired at %d (now %d)", expiresAt, now));
        }

        String issuer = stringClaim(claims, CLAIM_ISSUER);
        if (resolved.expectedIssuer() != null && !resolved.expectedIssuer().equals(issuer)) {
            return TokenResult.failure(TokenError.Kind.INVALID_ISSUER,
                "token issuer " + issuer + " does not match the expected api key");
        }

        return TokenResult.ok(toToken(claims, apiSecret, now));
    }

    public AccessToken parseOrThrow(String jwt, String apiSecret) throws AccessTokenException {
        return parse(jwt, apiSecret).orElseThrow();
    }

    public AccessToken parseOrThrow(String jwt, String apiSecret, ParseOptions options) throws AccessTokenException {
        return parse(jwt, apiSecret, options).orElseThrow();
    }

    /**
     * Rebuilds a token without verifying its signature. Only for inspecting tokens; the result never carries a
     * secret.
     */
    public TokenResult<AccessToken> parseUnverified(String jwt) {
        Map<String, Object> claims;
        try {
            claims = signer.decode(jwt);
        } catch (SigningException ex) {
            return TokenResult.failure(TokenError.Kind.VERIFIER_FAILURE, ex.getMessage(), ex);
        }
        return TokenResult.ok(toToken(claims, null, clock.instant().getEpochSecond()));
    }

    public AccessToken parseUnverifiedOrThrow(String jwt) throws AccessTokenException {
        return parseUnverified(jwt).orElseThrow();
    }

    private static AccessToken toToken(Map<String, Object> claims, String apiSecret, long now) {
        String subject = stringClaim(claims, CLAIM_SUBJECT);
        Duration ttl = validity(longClaim(claims, CLAIM_NOT_BEFORE), longClaim(claims, CLAIM_EXPIRES_AT), now);

        Map<String, Object> grantClaims = new LinkedHashMap<>(claims);
        REGISTERED_CLAIMS.forEach(grantClaims::remove);
        ClaimGrants grants = GrantClaims.toGrants(grantClaims).withIdentity(subject);

        return new AccessToken(stringClaim(claims, CLAIM_ISSUER), apiSecret, grants, ttl, false);
    }

    /**
     * The signed duration when {@code nbf} is known, otherwise the time left until {@code exp}. Never negative.
     */
    static Duration validity(Long notBefore, Long expiresAt, long now) {
        if (expiresAt == null) {
            return null;
        }
        if (notBefore != null && notBefore > 0) {
            return Duration.ofSeconds(Math.max(0L, expiresAt - notBefore));
        }
        return Duration.ofSeconds(Math.max(0L, expiresAt - now));
    }

    private static Long longClaim(Map<String, Object> claims, String name) {
        Object value = claims.get(name);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    private static String stringClaim(Map<String, Object> claims, String name) {
        Object value = claims.get(name);
        return value instanceof String ? (String) value : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class DefaultHolder {
        private static final AccessTokenCodec INSTANCE = new AccessTokenCodec();
    }
}
