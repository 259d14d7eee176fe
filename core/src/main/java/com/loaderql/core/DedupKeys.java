package com.loaderql.core;

import com.google.gson.JsonElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Stock {@link DedupKeyFunction}s.
 * <p>
 * Reference identity is never enough to deduplicate: the same logical entity is
 * routinely materialised as separate instances (one per parent row, one per JSON
 * decode). Both strategies here compare by value.
 */
public final class DedupKeys {
    private static final Logger logger = LoggerFactory.getLogger(DedupKeys.class);

    private static final DedupKeyFunction STRUCTURAL = query -> Arrays.asList(
            normalize(query.source()),
            normalize(query.arguments())
    );

    private DedupKeys() {
    }

    /**
     * Source object and arguments compared structurally.
     * <ul>
     *     <li>Maps, collections and arrays compare element by element.</li>
     *     <li>Numbers compare by value, so {@code 1}, {@code 1L} and {@code 1.0} are equal.</li>
     *     <li>Objects whose class overrides {@code equals} ({@code LocalDate}, {@code UUID},
     *     user value types) use it.</li>
     *     <li>Records and other objects compare by class and field values.</li>
     * </ul>
     * Objects whose fields cannot be read fall back to identity.
     */
    public static DedupKeyFunction structural() {
        return STRUCTURAL;
    }

    /**
     * Key on a value extracted from the source object (an id, typically) plus the arguments.
     */
    public static DedupKeyFunction of(Function<Object, ?> sourceKey) {
        return query -> Arrays.asList(
                normalize(sourceKey.apply(query.source())),
                normalize(query.arguments())
        );
    }

    static Object normalize(Object value) {
        return normalize(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static Object normalize(Object value, Set<Object> visiting) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum
                || value instanceof JsonElement) {
            return value;
        }
        if (value instanceof Number) {
            return normalizeNumber((Number) value);
        }
        // cyclic graphs compare by identity from the point where they loop
        if (!visiting.add(value)) {
            return new IdentityKey(value);
        }
        try {
            return normalizeComposite(value, visiting);
        } finally {
            visiting.remove(value);
        }
    }

    private static Object normalizeComposite(Object value, Set<Object> visiting) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new HashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(normalize(k, visiting), normalize(v, visiting)));
            return copy;
        }
        if (value instanceof Set) {
            Set<Object> copy = new HashSet<>();
            for (Object item : (Set<?>) value) {
                copy.add(normalize(item, visiting));
            }
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                copy.add(normalize(item, visiting));
            }
            return copy;
        }

        Class<?> type = value.getClass();
        if (type.isArray()) {
            List<Object> copy = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                copy.add(normalize(Array.get(value, i), visiting));
            }
            return copy;
        }
        if (type.isRecord()) {
            return recordKey(value, type, visiting);
        }
        if (overridesEquals(type)) {
            return value;
        }
        return fieldKey(value, type, visiting);
    }

    private static Object recordKey(Object value, Class<?> type, Set<Object> visiting) {
        List<Object> components = new ArrayList<>();
        try {
            for (RecordComponent component : type.getRecordComponents()) {
                Method accessor = component.getAccessor();
                accessor.setAccessible(true);
                components.add(normalize(accessor.invoke(value), visiting));
            }
        } catch (ReflectiveOperationException | InaccessibleObjectException | SecurityException e) {
            logger.debug("Comparing {} with its own equals: {}", type.getName(), e.getMessage());
            return value;
        }
        return new StructuralKey(type, components);
    }

    private static Object fieldKey(Object value, Class<?> type, Set<Object> visiting) {
        List<Object> fields = new ArrayList<>();
        try {
            for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
                for (Field field : current.getDeclaredFields()) {
                    int modifiers = field.getModifiers();
                    if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                        continue;
                    }
                    field.setAccessible(true);
                    fields.add(normalize(field.get(value), visiting));
                }
            }
        } catch (IllegalAccessException | InaccessibleObjectException | SecurityException e) {
            logger.debug("Comparing {} by identity: {}", type.getName(), e.getMessage());
            return new IdentityKey(value);
        }
        return new StructuralKey(type, fields);
    }

    private static boolean overridesEquals(Class<?> type) {
        try {
            return type.getMethod("equals", Object.class).getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("every class has equals", e);
        }
    }

    // 1, 1L and 1.0 are the same argument once a request has been through JSON
    private static Object normalizeNumber(Number number) {
        try {
            return new BigDecimal(number.toString()).stripTrailingZeros();
        } catch (NumberFormatException e) {
            return number;
        }
    }

    private record StructuralKey(Class<?> type, List<Object> values) {
    }

    private static final class IdentityKey {
        private final Object value;

        IdentityKey(Object value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IdentityKey && ((IdentityKey) o).value == value;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(value);
        }
    }
}
