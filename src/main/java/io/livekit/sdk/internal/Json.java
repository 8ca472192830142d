package io.livekit.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import java.util.Map;

/**
 * Centralised ObjectMapper configuration.
 */
public final class Json {

    public static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    /**
     * Naming strategy of the grant model's internal field names.
     */
    public static final PropertyNamingStrategies.NamingBase INTERNAL_NAMING =
        new PropertyNamingStrategies.SnakeCaseStrategy();

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final ObjectMapper GRANTS_MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(INTERNAL_NAMING)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Mapper converting grant records to and from maps keyed by internal (snake_case) field names.
     */
    public static ObjectMapper grantsMapper() {
        return GRANTS_MAPPER;
    }
}
