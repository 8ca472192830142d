package io.livekit.sdk.auth;

import io.livekit.sdk.Config;
import io.livekit.sdk.grants.AutoTrackEgress;
import io.livekit.sdk.grants.ClaimGrants;
import io.livekit.sdk.grants.RoomConfiguration;
import io.livekit.sdk.grants.RoomEgress;
import io.livekit.sdk.grants.S3Upload;
import io.livekit.sdk.grants.VideoGrant;
import io.livekit.sdk.signing.ClaimsSigner;
import io.livekit.sdk.signing.HmacJwtSigner;
import io.livekit.sdk.signing.SigningException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AccessTokenCodecTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void signedTokenParsesBackToSameGrants() throws Exception {
        AccessToken token = AccessToken.create("k", "s")
            .withIdentity("user123")
            .withVideoGrant(VideoGrant.builder().roomJoin(true).room("my-room").canPublish(true).build())
            .withTtl(3600);

        String jwt = codecAt(NOW).signOrThrow(token);
        AccessToken parsed = codecAt(NOW.plusSeconds(5)).parseOrThrow(jwt, "s");

        assertEquals("my-room", parsed.getGrants().video().room());
        assertEquals("user123", parsed.getGrants().identity());
        assertEquals(Duration.ofSeconds(3600), parsed.getTtl());
        assertEquals("k", parsed.getApiKey());
        assertEquals("s", parsed.getApiSecret());
        assertEquals(token.getGrants(), parsed.getGrants());
    }

    @Test
    void writesRegisteredClaimsAndWireCasedGrants() throws Exception {
        AccessToken token = AccessToken.create("k", "s")
            .withIdentity("user123")
            .withVideoGrant(VideoGrant.builder().roomJoin(true).build());

        String jwt = codecAt(NOW).signOrThrow(token);
        Map<String, Object> claims = new HmacJwtSigner().decode(jwt);

        assertEquals("k", claims.get("iss"));
        assertEquals("user123", claims.get("sub"));
        assertEquals(NOW.getEpochSecond(), ((Number) claims.get("nbf")).longValue());
        assertEquals(NOW.getEpochSecond() + Config.DEFAULT_TTL.getSeconds(), ((Number) claims.get("exp")).longValue());
        assertEquals(Map.of("roomJoin", true), claims.get("video"));
        assertFalse(claims.containsKey("sip"));
        assertFalse(claims.containsKey("roomConfig"));
    }

    @Test
    void omitsSubjectWithoutIdentity() throws Exception {
        String jwt = codecAt(NOW).signOrThrow(AccessToken.create("k", "s"));

        assertFalse(new HmacJwtSigner().decode(jwt).containsKey("sub"));
    }

    @Test
    void rejectsExpiredTokenOnlyWhenAsked() throws Exception {
        String jwt = codecAt(NOW).signOrThrow(AccessToken.create("k", "s").withIdentity("u").withTtl(1));
        AccessTokenCodec later = codecAt(NOW.plusSeconds(2));

        TokenResult<AccessToken> strict = later.parse(jwt, "s", ParseOptions.defaults());
        assertFalse(strict.isOk());
        assertEquals(TokenError.Kind.TOKEN_EXPIRED, strict.error().kind());

        TokenResult<AccessToken> lenient = later.parse(jwt, "s", ParseOptions.defaults().withVerifyExpiry(false));
        assertTrue(lenient.isOk());
        assertEquals("u", lenient.value().getIdentity());
        assertEquals(Duration.ofSeconds(1), lenient.value().getTtl());
    }

    @Test
    void tokenIsValidUntilExpiry() throws Exception {
        String jwt = codecAt(NOW).signOrThrow(AccessToken.create("k", "s").withTtl(10));

        assertTrue(codecAt(NOW.plusSeconds(10)).parse(jwt, "s").isOk());
    }

    @Test
    void requiresIssuerAndSecretToSign() {
        TokenResult<String> noIssuer = codecAt(NOW).sign(AccessToken.create("", "s"));
        assertEquals(TokenError.Kind.MISSING_ISSUER, noIssuer.error().kind());

        TokenResult<String> noSecret = codecAt(NOW).sign(AccessToken.create("k", ""));
        assertEquals(TokenError.Kind.MISSING_SECRET, noSecret.error().kind());

        AccessTokenException ex = assertThrows(AccessTokenException.class,
            () -> codecAt(NOW).signOrThrow(AccessToken.create(null, "s")));
        assertEquals(TokenError.Kind.MISSING_ISSUER, ex.getKind());
    }

    @Test
    void rejectsWrongSecret() throws Exception {
        String jwt = codecAt(NOW).signOrThrow(AccessToken.create("k", "s"));

        TokenResult<AccessToken> result = codecAt(NOW).parse(jwt, "other");

        assertEquals(TokenError.Kind.INVALID_SIGNATURE, result.error().kind());
        assertThrows(IllegalStateException.class, result::value);
    }

    @Test
    void reportsMalformedTokenAsVerifierFailure() {
        assertEquals(TokenError.Kind.VERIFIER_FAILURE, codecAt(NOW).parse("not-a-jwt", "s").error().kind());
        assertEquals(TokenError.Kind.VERIFIER_FAILURE, codecAt(NOW).parseUnverified("not-a-jwt").error().kind());
    }

    @Test
    void checksIssuerWhenExpected() throws Exception {
        String jwt = codecAt(NOW).signOrThrow(AccessToken.create("k", "s"));

        assertTrue(codecAt(NOW).parse(jwt, "s", ParseOptions.defaults().withExpectedIssuer("k")).isOk());
        assertEquals(TokenError.Kind.INVALID_ISSUER,
            codecAt(NOW).parse(jwt, "s", ParseOptions.defaults().withExpectedIssuer("other")).error().kind());
    }

    @Test
    void parsesWithoutVerificationAndWithoutSecret() throws Exception {
        String jwt = codecAt(NOW).signOrThrow(AccessToken.create("k", "s")
            .withIdentity("user123")
            .withVideoGrant(VideoGrant.joinRoom("my-room")));

        AccessToken parsed = codecAt(NOW).parseUnverifiedOrThrow(jwt);

        assertNull(parsed.getApiSecret());
        assertEquals("k", parsed.getApiKey());
        assertEquals("user123", parsed.getIdentity());
        assertEquals(VideoGrant.joinRoom("my-room"), parsed.getGrants().video());
    }

    @Test
    void toleratesUnknownClaims() throws Exception {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iss", "k");
        claims.put("sub", "user123");
        claims.put("nbf", NOW.getEpochSecond());
        claims.put("exp", NOW.getEpochSecond() + 600);
        claims.put("jti", "id-1");
        claims.put("futureFeature", true);
        claims.put("video", Map.of("roomJoin", true, "room", "my-room", "futureFlag", "x"));
        String jwt = new HmacJwtSigner().sign(claims, "s".getBytes(StandardCharsets.UTF_8));

        AccessToken parsed = codecAt(NOW).parseOrThrow(jwt, "s");

        assertEquals(ClaimGrants.empty()
            .withIdentity("user123")
            .withVideo(VideoGrant.builder().roomJoin(true).room("my-room").build()), parsed.getGrants());
        assertEquals(Duration.ofSeconds(600), parsed.getTtl());
    }

    @Test
    void derivesRemainingValidityWithoutNotBefore() throws Exception {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iss", "k");
        claims.put("exp", NOW.getEpochSecond() + 100);
        String jwt = new HmacJwtSigner().sign(claims, "s".getBytes(StandardCharsets.UTF_8));

        AccessToken parsed = codecAt(NOW.plusSeconds(40)).parseOrThrow(jwt, "s");

        assertEquals(Duration.ofSeconds(60), parsed.getTtl());
    }

    @Test
    void identityComesOnlyFromSubject() throws Exception {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iss", "k");
        claims.put("identity", "forged");
        String jwt = new HmacJwtSigner().sign(claims, "s".getBytes(StandardCharsets.UTF_8));

        assertNull(codecAt(NOW).parseOrThrow(jwt, "s").getIdentity());
        assertNull(codecAt(NOW).parseUnverifiedOrThrow(jwt).getIdentity());

        claims.put("sub", "user123");
        String withSubject = new HmacJwtSigner().sign(claims, "s".getBytes(StandardCharsets.UTF_8));
        assertEquals("user123", codecAt(NOW).parseOrThrow(withSubject, "s").getIdentity());
    }

    @Test
    void computesValidityWindow() {
        long now = NOW.getEpochSecond();

        assertNull(AccessTokenCodec.validity(null, null, now));
        assertNull(AccessTokenCodec.validity(now, null, now));
        assertEquals(Duration.ofSeconds(3600), AccessTokenCodec.validity(now - 100, now + 3500, now));
        assertEquals(Duration.ofSeconds(30), AccessTokenCodec.validity(0L, now + 30, now));
        assertEquals(Duration.ZERO, AccessTokenCodec.validity(null, now - 30, now));
        assertEquals(Duration.ZERO, AccessTokenCodec.validity(now, now - 1, now));
    }

    @Test
    void refusesEmbeddedCredentialsUnlessAllowed() throws Exception {
        S3Upload s3 = new S3Upload("AKIA", "top-secret", null, null, null, "bucket", null, null, null, null);
        AccessToken token = AccessToken.create("k", "s")
            .withRoomConfig(RoomConfiguration.builder()
                .egress(new RoomEgress(null, null, new AutoTrackEgress("tracks/", null, s3, null, null, null)))
                .build());

        TokenResult<String> refused = codecAt(NOW).sign(token);
        assertEquals(TokenError.Kind.SENSITIVE_CREDENTIALS, refused.error().kind());
        assertTrue(refused.error().message().contains("room_config.egress.tracks.s3.access_key"));

        String jwt = codecAt(NOW).signOrThrow(token.withAllowSensitiveCredentials(true));
        AccessToken parsed = codecAt(NOW).parseOrThrow(jwt, "s");
        assertEquals(s3, parsed.getGrants().roomConfig().egress().tracks().s3());
    }

    @Test
    void signsRoomConfigurationWithoutCredentials() throws Exception {
        AccessToken token = AccessToken.create("k", "s")
            .withRoomConfig(RoomConfiguration.builder().name("my-room").maxParticipants(4).build());

        AccessToken parsed = codecAt(NOW).parseOrThrow(codecAt(NOW).signOrThrow(token), "s");

        assertEquals(token.getGrants().roomConfig(), parsed.getGrants().roomConfig());
    }

    @Test
    void roundTripsFullGrantTree() throws Exception {
        AccessToken token = AccessToken.create("k", "s")
            .withGrants(GrantClaimsTest.fullGrants())
            .withAllowSensitiveCredentials(true)
            .withTtl(Duration.ofMinutes(10));

        AccessToken parsed = codecAt(NOW).parseOrThrow(codecAt(NOW).signOrThrow(token), "s");

        assertEquals(token.getGrants(), parsed.getGrants());
        assertEquals(Duration.ofMinutes(10), parsed.getTtl());
    }

    @Test
    void honoursConfiguredDefaultTtl() throws Exception {
        AccessTokenCodec codec = new AccessTokenCodec(Config.builder()
            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
            .defaultTtl(Duration.ofMinutes(5))
            .build());

        AccessToken parsed = codec.parseOrThrow(codec.signOrThrow(AccessToken.create("k", "s")), "s");

        assertEquals(Duration.ofMinutes(5), parsed.getTtl());
    }

    @Test
    void propagatesSignerFailure() {
        ClaimsSigner failing = new ClaimsSigner() {
            @Override
            public String sign(Map<String, Object> claims, byte[] secret) throws SigningException {
                throw new SigningException("hsm unavailable");
            }

            @Override
            public Map<String, Object> verify(String token, byte[] secret) throws SigningException {
                throw new SigningException("hsm unavailable");
            }

            @Override
            public Map<String, Object> decode(String token) throws SigningException {
                throw new SigningException("hsm unavailable");
            }
        };
        AccessTokenCodec codec = new AccessTokenCodec(Config.builder().signer(failing).build());

        TokenResult<String> signed = codec.sign(AccessToken.create("k", "s"));
        assertEquals(TokenError.Kind.SIGNER_FAILURE, signed.error().kind());
        assertEquals("hsm unavailable", signed.error().message());
        assertTrue(signed.error().cause() instanceof SigningException);

        assertEquals(TokenError.Kind.VERIFIER_FAILURE, codec.parse("a.b.c", "s").error().kind());
    }

    private static AccessTokenCodec codecAt(Instant instant) {
        return new AccessTokenCodec(Config.builder().clock(Clock.fixed(instant, ZoneOffset.UTC)).build());
    }
}
