package io.livekit.sdk.internal;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.lang.reflect.Constructor;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds record instances from untyped nested maps keyed by internal field names.
 *
 * <p>Nested records and lists of records are hydrated recursively; every other component is converted with the
 * grants mapper. Unknown keys are ignored and a value of the wrong shape leaves its component {@code null}, so
 * hydration of a partially trusted payload never fails on data.
 */
public final class RecordHydrator {

    private static final Logger LOGGER = Logger.getLogger(RecordHydrator.class.getName());

    private RecordHydrator() {
    }

    public static <T extends Record> T hydrate(Class<T> type, Map<?, ?> input) {
        return hydrate(type, input, type.getSimpleName());
    }

    private static <T extends Record> T hydrate(Class<T> type, Map<?, ?> input, String path) {
        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        Object[] args = new Object[components.length];

        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            parameterTypes[i] = component.getType();
            String key = Json.INTERNAL_NAMING.translate(component.getName());
            Object raw = input == null ? null : input.get(key);
            if (raw != null) {
                args[i] = hydrateValue(component.getGenericType(), raw, path + "." + key);
            }
        }

        try {
            Constructor<T> constructor = type.getDeclaredConstructor(parameterTypes);
            return constructor.newInstance(args);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException("cannot instantiate " + type.getName(), ex);
        }
    }

    private static Object hydrateValue(Type type, Object raw, String path) {
        Class<?> rawClass = rawClass(type);

        if (rawClass.isRecord()) {
            if (!(raw instanceof Map)) {
                return dropped(path, raw);
            }
            return hydrate(rawClass.asSubclass(Record.class), (Map<?, ?>) raw, path);
        }

        Class<?> elementClass = listElementClass(type);
        if (elementClass != null && elementClass.isRecord()) {
            if (!(raw instanceof List)) {
                return dropped(path, raw);
            }
            List<Object> elements = new ArrayList<>();
            int index = 0;
            for (Object element : (List<?>) raw) {
                String elementPath = path + "[" + index++ + "]";
                if (element instanceof Map) {
                    elements.add(hydrate(elementClass.asSubclass(Record.class), (Map<?, ?>) element, elementPath));
                } else {
                    dropped(elementPath, element);
                }
            }
            return Collections.unmodifiableList(elements);
        }

        ObjectMapper mapper = Json.grantsMapper();
        JavaType javaType = mapper.getTypeFactory().constructType(type);
        try {
            return mapper.convertValue(raw, javaType);
        } catch (IllegalArgumentException ex) {
            return dropped(path, raw);
        }
    }

    private static Object dropped(String path, Object raw) {
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[livekit-sdk] dropping malformed field %s (%s)", path,
            raw == null ? "null" : raw.getClass().getSimpleName()));
        return null;
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        return Object.class;
    }

    private static Class<?> listElementClass(Type type) {
        if (!(type instanceof ParameterizedType)) {
            return null;
        }
        ParameterizedType parameterized = (ParameterizedType) type;
        if (!List.class.isAssignableFrom(rawClass(parameterized.getRawType()))) {
            return null;
        }
        Type[] arguments = parameterized.getActualTypeArguments();
        return arguments.length == 1 && arguments[0] instanceof Class ? (Class<?>) arguments[0] : null;
    }
}
