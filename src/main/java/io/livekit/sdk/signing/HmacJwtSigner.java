package io.livekit.sdk.signing;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import io.livekit.sdk.internal.Json;

import java.io.IOException;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ClaimsSigner} producing HS256 JSON Web Tokens.
 */
public final class HmacJwtSigner implements ClaimsSigner {

    public static final String ALGORITHM = "HS256";

    @Override
    public String sign(Map<String, Object> claims, byte[] secret) throws SigningException {
        Objects.requireNonNull(claims, "claims");
        try {
            return JWT.create()
                .withPayload(claims)
                .sign(Algorithm.HMAC256(secret));
        } catch (JWTCreationException | IllegalArgumentException ex) {
            throw new SigningException("sign token: " + ex.getMessage(), ex);
        }
    }

    @Override
    public Map<String, Object> verify(String token, byte[] secret) throws SigningException {
        DecodedJWT decoded = decodeJwt(token);
        if (!ALGORITHM.equals(decoded.getAlgorithm())) {
            throw new InvalidSignatureException("unexpected token algorithm " + decoded.getAlgorithm());
        }
        try {
            Algorithm.HMAC256(secret).verify(decoded);
        } catch (SignatureVerificationException ex) {
            throw new InvalidSignatureException("token signature mismatch", ex);
        } catch (IllegalArgumentException ex) {
            throw new SigningException("verify token: " + ex.getMessage(), ex);
        }
        return payload(decoded);
    }

    @Override
    public Map<String, Object> decode(String token) throws SigningException {
        return payload(decodeJwt(token));
    }

    private static DecodedJWT decodeJwt(String token) throws SigningException {
        if (token == null || token.isBlank()) {
            throw new SigningException("token is required");
        }
        try {
            return JWT.decode(token.trim());
        } catch (JWTDecodeException ex) {
            throw new SigningException("decode token: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> payload(DecodedJWT decoded) throws SigningException {
        try {
            byte[] json = Base64.getUrlDecoder().decode(decoded.getPayload());
            return Json.mapper().readValue(json, Json.MAP_TYPE);
        } catch (IOException | IllegalArgumentException ex) {
            throw new SigningException("decode token payload: " + ex.getMessage(), ex);
        }
    }
}
