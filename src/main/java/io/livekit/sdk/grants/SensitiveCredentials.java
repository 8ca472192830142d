package io.livekit.sdk.grants;

import io.livekit.sdk.internal.Json;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Detects credentials embedded in a room configuration, such as storage keys of egress upload targets or webhook
 * signing keys. Tokens are handed to clients, so such values would leak to every holder of the token.
 */
public final class SensitiveCredentials {

    static final Set<String> CREDENTIAL_FIELDS = Set.of(
        "access_key",
        "secret",
        "session_token",
        "credentials",
        "account_key",
        "signing_key"
    );

    private SensitiveCredentials() {
    }

    /**
     * @return path of the first non-empty credential field, e.g.
     *     {@code room_config.egress.room.file_outputs[0].s3.secret}; empty when the configuration is clean.
     */
    public static Optional<String> find(RoomConfiguration config) {
        if (config == null) {
            return Optional.empty();
        }
        Object tree = Json.grantsMapper().convertValue(config, Json.MAP_TYPE);
        return Optional.ofNullable(scan(tree, "room_config"));
    }

    private static String scan(Object node, String path) {
        if (node instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
                String key = String.valueOf(entry.getKey());
                if ("metadata".equals(key)) {
                    // caller-defined keys
                    continue;
                }
                String childPath = path + "." + key;
                Object value = entry.getValue();
                if (CREDENTIAL_FIELDS.contains(key) && value instanceof String && !((String) value).isBlank()) {
                    return childPath;
                }
                String hit = scan(value, childPath);
                if (hit != null) {
                    return hit;
                }
            }
        } else if (node instanceof List) {
            List<?> list = (List<?>) node;
            for (int i = 0; i < list.size(); i++) {
                String hit = scan(list.get(i), path + "[" + i + "]");
                if (hit != null) {
                    return hit;
                }
            }
        }
        return null;
    }
}
