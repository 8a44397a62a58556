package com.entity.reconciliation.codec;

import com.entity.reconciliation.core.model.GraphExcluded;
import com.entity.reconciliation.core.model.GraphModel;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.JacksonAnnotationIntrospector;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Property map written to the graph store for a node: the serialized fields of the model
 * minus those marked {@link GraphExcluded}, restricted to scalars and lists of scalars.
 */
public final class GraphProperties {

    private static final TypeReference<LinkedHashMap<String, Object>> PROPERTIES = new TypeReference<>() {
    };

    private static final ObjectMapper MAPPER = Mappers.json()
            .setAnnotationIntrospector(new JacksonAnnotationIntrospector() {
                @Override
                public boolean hasIgnoreMarker(AnnotatedMember member) {
                    return member.hasAnnotation(GraphExcluded.class) || super.hasIgnoreMarker(member);
                }
            });

    private GraphProperties() {
    }

    public static Map<String, Object> of(GraphModel model) {
        Map<String, Object> properties = MAPPER.convertValue(model, PROPERTIES);
        properties.values().removeIf(value -> !isGraphValue(value));
        return properties;
    }

    private static boolean isGraphValue(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream().allMatch(GraphProperties::isScalar);
        }
        return isScalar(value);
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
