package com.entity.reconciliation.codec;

import com.entity.reconciliation.core.model.GraphModel;
import com.entity.reconciliation.core.model.GraphRelationship;
import com.entity.reconciliation.logging.LogContext;
import com.entity.reconciliation.metrics.MetricsService;
import com.entity.reconciliation.metrics.NoOpMetricsService;
import com.entity.reconciliation.registry.HookException;
import com.entity.reconciliation.registry.HookPipeline;
import com.entity.reconciliation.registry.Model;
import com.entity.reconciliation.registry.TypeRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON and key-value codec for registered models.
 *
 * <p>Encoding writes the wrapper shape {@code {"type": ..., "model": {...}}} or, for
 * {@link #encodeFlat}, the payload fields next to {@code type}. Decoding accepts the
 * wrapper, the flat shape and a bare payload whose {@code key} starts with
 * {@code #<type>#}. The concrete class always comes from the {@link TypeRegistry}; an
 * envelope that cannot be resolved fails with {@link DecodeException} and never yields an
 * empty model.</p>
 */
public class EntityCodec {
    private static final Logger log = LoggerFactory.getLogger(EntityCodec.class);

    static final String FORMAT_JSON = "json";
    static final String FORMAT_ITEM = "item";

    private static final String SOURCE_FIELD = "source";
    private static final String TARGET_FIELD = "target";
    private static final TypeReference<Map<String, Object>> ITEM_TYPE = new TypeReference<>() {
    };

    private final TypeRegistry registry;
    private final CodecConfig config;
    private final MetricsService metricsService;
    private final ObjectMapper mapper;

    public EntityCodec(TypeRegistry registry) {
        this(registry, CodecConfig.defaults(), new NoOpMetricsService());
    }

    public EntityCodec(TypeRegistry registry, CodecConfig config, MetricsService metricsService) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.mapper = Mappers.json();
    }

    // ========== JSON ==========

    /**
     * Encodes a model in the wrapper shape.
     */
    public String encode(Model model) {
        return write(wrapperNode(Wrapper.of(model)));
    }

    /**
     * Encodes a model as its payload fields plus {@code type}.
     */
    public String encodeFlat(Model model) {
        return write(flatNode(model));
    }

    /**
     * Encodes a heterogeneous list as a JSON array of wrappers.
     */
    public String encodeAll(List<? extends Model> models) {
        ArrayNode array = mapper.createArrayNode();
        for (Model model : models) {
            array.add(wrapperNode(Wrapper.of(model)));
        }
        return write(array);
    }

    /**
     * Decodes any supported envelope into a model assignable to {@code expected}.
     *
     * @throws DecodeException if the envelope is malformed, its type is unknown or not an
     *                         {@code expected}, or the payload does not fit the type
     */
    public <T extends Model> T decode(String json, Class<T> expected) {
        return decodeWrapper(json, expected).model();
    }

    /**
     * Decodes an envelope and keeps the resolved discriminator.
     */
    public <T extends Model> Wrapper<T> decodeWrapper(String json, Class<T> expected) {
        try (LogContext ctx = LogContext.forDecode(LogContext.generateCorrelationId(), FORMAT_JSON)) {
            return decodeNode(readTree(json, FORMAT_JSON), expected, FORMAT_JSON);
        }
    }

    /**
     * Decodes a JSON array of envelopes. Elements may be of different types.
     */
    public <T extends Model> List<T> decodeAll(String json, Class<T> expected) {
        try (LogContext ctx = LogContext.forDecode(LogContext.generateCorrelationId(), FORMAT_JSON)) {
            JsonNode root = readTree(json, FORMAT_JSON);
            if (!root.isArray()) {
                throw failure(FORMAT_JSON, "expected a JSON array of envelopes", null);
            }
            List<T> models = new ArrayList<>(root.size());
            for (JsonNode element : root) {
                models.add(decodeNode(element, expected, FORMAT_JSON).model());
            }
            return models;
        }
    }

    // ========== Relationships ==========

    /**
     * Encodes a relationship as {@code {"type", "model", "source", "target"}}, where the
     * endpoints are wrappers of their own. Missing endpoints are omitted.
     */
    public String encodeRelationship(GraphRelationship relationship) {
        ObjectNode node = wrapperNode(Wrapper.of(relationship));
        GraphRelationship.Nodes nodes = relationship.nodes();
        if (nodes.source() != null) {
            node.set(SOURCE_FIELD, wrapperNode(Wrapper.of(nodes.source())));
        }
        if (nodes.target() != null) {
            node.set(TARGET_FIELD, wrapperNode(Wrapper.of(nodes.target())));
        }
        return write(node);
    }

    /**
     * Decodes a relationship envelope and reattaches its endpoints.
     */
    public GraphRelationship decodeRelationship(String json) {
        try (LogContext ctx = LogContext.forDecode(LogContext.generateCorrelationId(), FORMAT_JSON)) {
            JsonNode root = readTree(json, FORMAT_JSON);
            GraphRelationship relationship = decodeNode(root, GraphRelationship.class, FORMAT_JSON).model();
            GraphModel source = endpoint(root, SOURCE_FIELD);
            GraphModel target = endpoint(root, TARGET_FIELD);
            relationship.base().setNodes(source, target);
            return relationship;
        }
    }

    private GraphModel endpoint(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return decodeNode(node, GraphModel.class, FORMAT_JSON).model();
    }

    // ========== Key-value items ==========

    /**
     * Converts a model to a document-store item: its fields plus {@code type}.
     */
    public Map<String, Object> toItem(Model model) {
        return mapper.convertValue(flatNode(model), ITEM_TYPE);
    }

    /**
     * Decodes a document-store item.
     */
    public <T extends Model> T fromItem(Map<String, ?> item, Class<T> expected) {
        try (LogContext ctx = LogContext.forDecode(LogContext.generateCorrelationId(), FORMAT_ITEM)) {
            if (item == null) {
                throw failure(FORMAT_ITEM, "item is null", null);
            }
            JsonNode node;
            try {
                node = mapper.valueToTree(item);
            } catch (IllegalArgumentException e) {
                throw failure(FORMAT_ITEM, "item is not convertible: " + e.getMessage(), e);
            }
            return decodeNode(node, expected, FORMAT_ITEM).model();
        }
    }

    // ========== Internals ==========

    private <T extends Model> Wrapper<T> decodeNode(JsonNode node, Class<T> expected, String format) {
        if (node == null || !node.isObject()) {
            throw failure(format, "envelope is not a JSON object", null);
        }
        String type = DiscriminatorResolver.resolve(node)
                .orElseThrow(() -> failure(format, "envelope carries neither a type nor a typed key", null));
        Class<? extends Model> concrete = registry.getType(type)
                .orElseThrow(() -> failure(format, "unknown type: " + type, null));
        if (!expected.isAssignableFrom(concrete)) {
            throw failure(format, String.format("type %s is not a %s", type, expected.getSimpleName()), null);
        }

        ObjectNode payload = payload((ObjectNode) node, format);
        Model model = registry.makeType(type)
                .orElseThrow(() -> failure(format, "unknown type: " + type, null));
        try {
            mapper.readerForUpdating(model).readValue(payload);
        } catch (IOException | IllegalArgumentException e) {
            throw failure(format, String.format("cannot decode %s: %s", type, e.getMessage()), e);
        }

        if (!config.skipDefaulting()) {
            model.defaulted();
        }
        if (config.runHooks()) {
            try {
                model = HookPipeline.callHooks(model);
            } catch (HookException e) {
                metricsService.incrementHookFailure(type);
                throw e;
            }
        }

        metricsService.incrementDecoded(format, type);
        log.debug("decode.completed format={} type={}", format, type);
        return new Wrapper<>(type, expected.cast(model));
    }

    private ObjectNode payload(ObjectNode node, String format) {
        JsonNode model = node.get(DiscriminatorResolver.MODEL_FIELD);
        if (model != null && !model.isNull()) {
            if (!model.isObject()) {
                throw failure(format, "model is not a JSON object", null);
            }
            return (ObjectNode) model;
        }
        ObjectNode flat = node.deepCopy();
        flat.remove(DiscriminatorResolver.TYPE_FIELD);
        return flat;
    }

    private ObjectNode wrapperNode(Wrapper<?> wrapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put(DiscriminatorResolver.TYPE_FIELD, wrapper.type());
        node.set(DiscriminatorResolver.MODEL_FIELD, mapper.valueToTree(wrapper.model()));
        return node;
    }

    private ObjectNode flatNode(Model model) {
        ObjectNode node = mapper.createObjectNode();
        node.put(DiscriminatorResolver.TYPE_FIELD, TypeRegistry.name(model));
        node.setAll((ObjectNode) mapper.valueToTree(model));
        return node;
    }

    private JsonNode readTree(String json, String format) {
        if (json == null || json.isBlank()) {
            throw failure(format, "empty envelope", null);
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw failure(format, "malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write JSON", e);
        }
    }

    private DecodeException failure(String format, String message, Throwable cause) {
        metricsService.incrementDecodeFailure(format);
        log.warn("decode.failed format={} reason={}", format, message);
        return new DecodeException(message, cause);
    }
}
