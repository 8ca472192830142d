package io.livekit.sdk.auth;

import io.livekit.sdk.Config;
import io.livekit.sdk.grants.AgentGrant;
import io.livekit.sdk.grants.ClaimGrants;
import io.livekit.sdk.grants.InferenceGrant;
import io.livekit.sdk.grants.ObservabilityGrant;
import io.livekit.sdk.grants.RoomConfiguration;
import io.livekit.sdk.grants.SipGrant;
import io.livekit.sdk.grants.VideoGrant;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Access token for a participant or service: an API key, its secret, the grants and a validity window.
 *
 * <p>Instances are immutable; every {@code with...} method returns a modified copy. Nothing is validated until
 * the token is signed.
 */
public final class AccessToken {

    private final String apiKey;
    private final String apiSecret;
    private final ClaimGrants grants;
    private final Duration ttl;
    private final boolean allowSensitiveCredentials;

    AccessToken(String apiKey, String apiSecret, ClaimGrants grants, Duration ttl,
                boolean allowSensitiveCredentials) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.grants = grants == null ? ClaimGrants.empty() : grants;
        this.ttl = ttl;
        this.allowSensitiveCredentials = allowSensitiveCredentials;
    }

    public static AccessToken create(String apiKey, String apiSecret) {
        return new AccessToken(apiKey, apiSecret, ClaimGrants.empty(), null, false);
    }

    public static AccessToken create(Config config) {
        Objects.requireNonNull(config, "config");
        return create(config.getApiKey(), config.getApiSecret());
    }

    /**
     * Signs this token with the default codec: HS256, system clock, six hour validity unless a ttl is set.
     */
    public TokenResult<String> toJwt() {
        return AccessTokenCodec.defaultCodec().sign(this);
    }

    public String toJwtOrThrow() throws AccessTokenException {
        return toJwt().orElseThrow();
    }

    /**
     * Verifies and parses {@code jwt}, rejecting expired tokens.
     */
    public static TokenResult<AccessToken> fromJwt(String jwt, String apiSecret) {
        return AccessTokenCodec.defaultCodec().parse(jwt, apiSecret);
    }

    public static TokenResult<AccessToken> fromJwt(String jwt, String apiSecret, ParseOptions options) {
        return AccessTokenCodec.defaultCodec().parse(jwt, apiSecret, options);
    }

    /**
     * Verifies {@code jwt} and additionally requires it to be issued by {@code apiKey}.
     */
    public static TokenResult<AccessToken> fromJwt(String jwt, String apiKey, String apiSecret) {
        return fromJwt(jwt, apiSecret, ParseOptions.defaults().withExpectedIssuer(apiKey));
    }

    public static AccessToken fromJwtOrThrow(String jwt, String apiSecret) throws AccessTokenException {
        return fromJwt(jwt, apiSecret).orElseThrow();
    }

    public static AccessToken fromJwtOrThrow(String jwt, String apiSecret, ParseOptions options)
        throws AccessTokenException {
        return fromJwt(jwt, apiSecret, options).orElseThrow();
    }

    /**
     * Reads a token without checking its signature. Use for inspection only.
     */
    public static TokenResult<AccessToken> fromJwtUnverified(String jwt) {
        return AccessTokenCodec.defaultCodec().parseUnverified(jwt);
    }

    public static AccessToken fromJwtUnverifiedOrThrow(String jwt) throws AccessTokenException {
        return fromJwtUnverified(jwt).orElseThrow();
    }

    public String getApiKey() {
        return apiKey;
    }

    /**
     * @return the signing secret; {@code null} for tokens read without verification.
     */
    public String getApiSecret() {
        return apiSecret;
    }

    public ClaimGrants getGrants() {
        return grants;
    }

    public String getIdentity() {
        return grants.identity();
    }

    /**
     * @return the validity requested for this token, or {@code null} to use the codec default.
     */
    public Duration getTtl() {
        return ttl;
    }

    public boolean isAllowSensitiveCredentials() {
        return allowSensitiveCredentials;
    }

    public AccessToken withApiKey(String apiKey) {
        return new AccessToken(apiKey, apiSecret, grants, ttl, allowSensitiveCredentials);
    }

    public AccessToken withApiSecret(String apiSecret) {
        return new AccessToken(apiKey, apiSecret, grants, ttl, allowSensitiveCredentials);
    }

    public AccessToken withGrants(ClaimGrants grants) {
        return new AccessToken(apiKey, apiSecret, grants, ttl, allowSensitiveCredentials);
    }

    public AccessToken withTtl(Duration ttl) {
        return new AccessToken(apiKey, apiSecret, grants, ttl, allowSensitiveCredentials);
    }

    public AccessToken withTtl(long seconds) {
        return withTtl(Duration.ofSeconds(seconds));
    }

    /**
     * Permits signing a room configuration that embeds storage credentials or webhook signing keys.
     */
    public AccessToken withAllowSensitiveCredentials(boolean allowSensitiveCredentials) {
        return new AccessToken(apiKey, apiSecret, grants, ttl, allowSensitiveCredentials);
    }

    public AccessToken withIdentity(String identity) {
        return withGrants(grants.withIdentity(identity));
    }

    public AccessToken withName(String name) {
        return withGrants(grants.withName(name));
    }

    public AccessToken withKind(String kind) {
        return withGrants(grants.withKind(kind));
    }

    public AccessToken withMetadata(String metadata) {
        return withGrants(grants.withMetadata(metadata));
    }

    public AccessToken withAttributes(Map<String, String> attributes) {
        return withGrants(grants.withAttributes(attributes));
    }

    public AccessToken withVideoGrant(VideoGrant video) {
        return withGrants(grants.withVideo(video));
    }

    public AccessToken withSipGrant(SipGrant sip) {
        return withGrants(grants.withSip(sip));
    }

    public AccessToken withAgentGrant(AgentGrant agent) {
        return withGrants(grants.withAgent(agent));
    }

    public AccessToken withInferenceGrant(InferenceGrant inference) {
        return withGrants(grants.withInference(inference));
    }

    public AccessToken withObservabilityGrant(ObservabilityGrant observability) {
        return withGrants(grants.withObservability(observability));
    }

    public AccessToken withRoomConfig(RoomConfiguration roomConfig) {
        return withGrants(grants.withRoomConfig(roomConfig));
    }

    public AccessToken withRoomPreset(String roomPreset) {
        return withGrants(grants.withRoomPreset(roomPreset));
    }

    public AccessToken withSha256(String sha256) {
        return withGrants(grants.withSha256(sha256));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccessToken)) {
            return false;
        }
        AccessToken other = (AccessToken) o;
        return allowSensitiveCredentials == other.allowSensitiveCredentials
            && Objects.equals(apiKey, other.apiKey)
            && Objects.equals(apiSecret, other.apiSecret)
            && grants.equals(other.grants)
            && Objects.equals(ttl, other.ttl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiKey, apiSecret, grants, ttl, allowSensitiveCredentials);
    }

    @Override
    public String toString() {
        return "AccessToken[apiKey=" + apiKey
            + ", identity=" + grants.identity()
            + ", ttl=" + ttl
            + ", secret=" + (apiSecret == null ? "absent" : "***") + "]";
    }
}
