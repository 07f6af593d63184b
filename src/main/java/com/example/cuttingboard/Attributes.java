package com.example.cuttingboard;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Reads named attributes from opaque dataset records.
 *
 * <p>A {@link Map} record is read by key. Any other record is read through
 * the properties Jackson would serialize: the components of a Java
 * {@code record}, the {@code getName()} / {@code isName()} getters of a
 * JavaBean and its public fields.
 *
 * <p>Properties are introspected once per record class.
 */
public final class Attributes {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<Class<?>, Map<String, AnnotatedMember>> PROPERTIES = new ConcurrentHashMap<>();

    private Attributes() {
    }

    /**
     * Returns {@code true} if the record has the attribute.
     */
    public static boolean has(Object record, String name) {
        if (record instanceof Map) {
            return ((Map<?, ?>) record).containsKey(name);
        }
        return record != null && accessor(record.getClass(), name).isPresent();
    }

    /**
     * Returns the value of an attribute of the record.
     *
     * @throws DataException if the record has no such attribute
     */
    public static Object get(Object record, String name) {
        if (record instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) record;
            if (!map.containsKey(name)) {
                throw new DataException("record has no attribute '" + name + "'");
            }
            return map.get(name);
        }
        if (record == null) {
            throw new DataException("can't read attribute '" + name + "' from a null record");
        }
        AnnotatedMember accessor = accessor(record.getClass(), name)
                .orElseThrow(() -> new DataException(
                        "record of type " + record.getClass().getName() + " has no attribute '" + name + "'"));
        try {
            return accessor.getValue(record);
        } catch (IllegalArgumentException e) {
            throw new DataException("error reading attribute '" + name + "' of " + record.getClass().getName(), e);
        }
    }

    /**
     * Returns an extraction function reading the named attribute.
     */
    public static Function<Object, Object> getter(String name) {
        return record -> get(record, name);
    }

    private static Optional<AnnotatedMember> accessor(Class<?> type, String name) {
        return Optional.ofNullable(PROPERTIES.computeIfAbsent(type, Attributes::introspect).get(name));
    }

    private static Map<String, AnnotatedMember> introspect(Class<?> type) {
        BeanDescription description = MAPPER.getSerializationConfig().introspect(MAPPER.constructType(type));
        Map<String, AnnotatedMember> rv = new ConcurrentHashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor != null) {
                accessor.fixAccess(true);
                rv.put(property.getName(), accessor);
            }
        }
        return rv;
    }
}
