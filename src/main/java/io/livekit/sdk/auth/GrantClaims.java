package io.livekit.sdk.auth;

import io.livekit.sdk.grants.ClaimGrants;
import io.livekit.sdk.internal.Json;
import io.livekit.sdk.internal.KeyCase;

import java.util.Map;

/**
 * Converts {@link ClaimGrants} to and from the wire-cased claim map that gets signed.
 */
public final class GrantClaims {

    private GrantClaims() {
    }

    /**
     * Flattens grants into nested maps and lists, omitting every unset field at any depth, with keys in wire
     * (camelCase) form.
     */
    public static Map<String, Object> toClaims(ClaimGrants grants) {
        if (grants == null) {
            return Map.of();
        }
        Map<String, Object> internal = Json.grantsMapper().convertValue(grants, Json.MAP_TYPE);
        return KeyCase.renameMap(internal, KeyCase::toCamel);
    }

    /**
     * Rebuilds grants from wire-cased claims. Registered JWT claims must already be removed; unknown keys are
     * dropped.
     */
    public static ClaimGrants toGrants(Map<String, ?> claims) {
        if (claims == null || claims.isEmpty()) {
            return ClaimGrants.empty();
        }
        return ClaimGrants.fromMap(KeyCase.renameMap(claims, KeyCase::toSnake));
    }
}
