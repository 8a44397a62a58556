package com.entity.reconciliation.codec;

import com.entity.reconciliation.metrics.MetricsService;
import com.entity.reconciliation.metrics.NoOpMetricsService;
import com.entity.reconciliation.registry.Model;
import com.entity.reconciliation.registry.TypeRegistry;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CBOR encoding of heterogeneous model lists. Every element is written as
 * {@code [typeName, {fields}]}.
 *
 * <p>The codec keeps its own table of concrete classes, separate from the
 * {@link TypeRegistry}: a class must be {@link #register registered} here before it can
 * be encoded or decoded. {@link #registerAll(TypeRegistry)} copies a registry's types.</p>
 */
public class BinaryCodec {
    private static final Logger log = LoggerFactory.getLogger(BinaryCodec.class);

    static final String FORMAT_BINARY = "cbor";

    private static final TypeReference<List<Model>> MODEL_LIST = new TypeReference<>() {
    };

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_ARRAY)
    private interface PolymorphicModel {
    }

    private final CBORMapper mapper;
    private final Map<Class<?>, String> registered = new ConcurrentHashMap<>();
    private final MetricsService metricsService;

    public BinaryCodec() {
        this(new NoOpMetricsService());
    }

    public BinaryCodec(MetricsService metricsService) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.mapper = Mappers.configure(new CBORMapper());
        this.mapper.addMixIn(Model.class, PolymorphicModel.class);
    }

    /**
     * Registers a concrete class under its discriminator.
     */
    public void register(Class<? extends Model> type) {
        register(type, TypeRegistry.name(type));
    }

    /**
     * Registers a concrete class under an explicit name.
     *
     * @throws IllegalArgumentException if the name is already used by another class
     */
    public synchronized void register(Class<? extends Model> type, String name) {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(name, "name is required");
        String existing = registered.get(type);
        if (name.equals(existing)) {
            return;
        }
        if (existing != null || registered.containsValue(name)) {
            throw new IllegalArgumentException(String.format("binary name %s or class %s already registered",
                    name, type.getName()));
        }
        mapper.registerSubtypes(new NamedType(type, name));
        registered.put(type, name);
        log.debug("binary.registered name={} class={}", name, type.getName());
    }

    /**
     * Registers every type of a registry.
     */
    public void registerAll(TypeRegistry registry) {
        for (String name : registry.getAllTypes()) {
            registry.getType(name).ifPresent(type -> register(type, name));
        }
    }

    public boolean isRegistered(Class<?> type) {
        return registered.containsKey(type);
    }

    /**
     * Encodes a list of models.
     *
     * @throws IllegalArgumentException if an element's class is not registered
     */
    public byte[] encode(List<? extends Model> models) {
        for (Model model : models) {
            if (!isRegistered(model.getClass())) {
                throw new IllegalArgumentException("type not registered with the binary codec: "
                        + model.getClass().getName());
            }
        }
        try {
            ObjectWriter writer = mapper.writerFor(MODEL_LIST);
            return writer.writeValueAsBytes(models);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write CBOR", e);
        }
    }

    /**
     * Decodes a list of models.
     *
     * @throws DecodeException if the input is malformed or names an unregistered type
     */
    public List<Model> decode(byte[] data) {
        if (data == null || data.length == 0) {
            metricsService.incrementDecodeFailure(FORMAT_BINARY);
            throw new DecodeException("empty binary payload");
        }
        try {
            ObjectReader reader = mapper.readerFor(MODEL_LIST);
            List<Model> models = reader.readValue(data);
            for (Model model : models) {
                metricsService.incrementDecoded(FORMAT_BINARY, registered.get(model.getClass()));
            }
            log.debug("decode.completed format={} count={}", FORMAT_BINARY, models.size());
            return models;
        } catch (IOException e) {
            metricsService.incrementDecodeFailure(FORMAT_BINARY);
            log.warn("decode.failed format={} reason={}", FORMAT_BINARY, e.getMessage());
            throw new DecodeException("cannot decode binary payload: " + e.getMessage(), e);
        }
    }
}
