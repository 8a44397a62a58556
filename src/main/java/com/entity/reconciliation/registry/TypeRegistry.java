package com.entity.reconciliation.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Maps discriminator strings to model constructors.
 *
 * <p>The discriminator of a model is its lower-cased simple class name. A type may be
 * registered under additional aliases; allocating it through an alias hands the alias to
 * {@link Aliasable} instances so they can specialize themselves.</p>
 *
 * <p>Registration is single-threaded and happens before any lookup. Once
 * {@link #freeze()} is called the registry is read-only and safe to share.</p>
 */
public class TypeRegistry {
    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    private Map<String, Class<? extends Model>> types = new HashMap<>();
    private Map<String, Supplier<? extends Model>> constructors = new HashMap<>();
    private Map<String, String> aliasTargets = new HashMap<>();
    private Map<String, List<String>> aliases = new HashMap<>();
    private Map<String, String> labels = new HashMap<>();
    private volatile boolean frozen;

    /**
     * Returns the discriminator of a model instance.
     */
    public static String name(Model model) {
        return name(model.getClass());
    }

    /**
     * Returns the discriminator for a model class.
     */
    public static String name(Class<?> type) {
        return type.getSimpleName().toLowerCase(Locale.ROOT);
    }

    /**
     * Registers a constructor under its discriminator and the given aliases.
     * Registering the same class twice is a no-op.
     *
     * @throws RegistrationException if the discriminator, an alias or a label is already
     *                               claimed by a different type
     * @throws IllegalStateException if the registry is frozen
     */
    public void register(Supplier<? extends Model> constructor, String... aliasNames) {
        Objects.requireNonNull(constructor, "constructor is required");
        ensureMutable();

        Model prototype = constructor.get();
        Class<? extends Model> type = prototype.getClass();
        String name = name(type);

        Class<? extends Model> existing = types.get(name);
        if (existing != null) {
            if (existing.equals(type)) {
                return;
            }
            throw new RegistrationException(String.format("type %s already registered to %s",
                    name, existing.getName()));
        }
        if (aliasTargets.containsKey(name)) {
            throw new RegistrationException(String.format("type %s already registered as an alias of %s",
                    name, aliasTargets.get(name)));
        }

        List<String> registeredAliases = new ArrayList<>();
        for (String alias : aliasNames) {
            String lower = alias.toLowerCase(Locale.ROOT);
            if (lower.equals(name)) {
                continue;
            }
            String target = aliasTargets.get(lower);
            if (types.containsKey(lower) || (target != null && !target.equals(name))) {
                throw new RegistrationException(String.format("alias %s already registered", lower));
            }
            registeredAliases.add(lower);
        }

        Map<String, String> newLabels = new LinkedHashMap<>();
        List<String> candidates = new ArrayList<>(List.of(aliasNames));
        if (prototype instanceof Labeled labeled) {
            candidates.addAll(labeled.getLabels());
        }
        for (String label : candidates) {
            String lower = label.toLowerCase(Locale.ROOT);
            String existingLabel = labels.containsKey(lower) ? labels.get(lower) : newLabels.get(lower);
            checkLabel(label, existingLabel);
            newLabels.put(lower, label);
        }

        types.put(name, type);
        constructors.put(name, constructor);
        for (String alias : registeredAliases) {
            aliasTargets.put(alias, name);
        }
        aliases.put(name, List.copyOf(registeredAliases));
        labels.putAll(newLabels);
        log.debug("type.registered name={} class={} aliases={}", name, type.getName(), registeredAliases);
    }

    /**
     * Records the canonical spelling of a label. Labels are matched case-insensitively.
     *
     * @throws RegistrationException if a different spelling is already registered
     */
    public void registerLabel(String label) {
        Objects.requireNonNull(label, "label is required");
        ensureMutable();
        String lower = label.toLowerCase(Locale.ROOT);
        checkLabel(label, labels.get(lower));
        labels.put(lower, label);
    }

    private static void checkLabel(String label, String existing) {
        if (existing != null && !existing.equals(label)) {
            throw new RegistrationException(String.format("label %s conflicts with registered label %s",
                    label, existing));
        }
    }

    /**
     * Makes the registry read-only. Further registrations fail.
     */
    public void freeze() {
        if (frozen) {
            return;
        }
        types = Map.copyOf(types);
        constructors = Map.copyOf(constructors);
        aliasTargets = Map.copyOf(aliasTargets);
        aliases = Map.copyOf(aliases);
        labels = Map.copyOf(labels);
        frozen = true;
        log.info("registry.frozen types={} aliases={} labels={}", types.size(), aliasTargets.size(), labels.size());
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Allocates a zero-value instance for a discriminator or alias.
     */
    public Optional<Model> makeType(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        String target = resolve(lower);
        if (target == null) {
            return Optional.empty();
        }
        Model model = constructors.get(target).get();
        if (model instanceof Aliasable aliasable) {
            aliasable.setAlias(lower);
        }
        return Optional.of(model);
    }

    /**
     * Returns the class registered for a discriminator or alias.
     */
    public Optional<Class<? extends Model>> getType(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String target = resolve(name.toLowerCase(Locale.ROOT));
        return target == null ? Optional.empty() : Optional.of(types.get(target));
    }

    /**
     * Returns true when the name is a registered discriminator or alias.
     */
    public boolean contains(String name) {
        return getType(name).isPresent();
    }

    /**
     * Returns all registered discriminators (aliases excluded), sorted.
     */
    public Set<String> getAllTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(types.keySet()));
    }

    /**
     * Returns the discriminators whose class can be assigned to the given type, sorted.
     */
    public List<String> getTypes(Class<?> assignableTo) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, Class<? extends Model>> entry : types.entrySet()) {
            if (assignableTo.isAssignableFrom(entry.getValue())) {
                result.add(entry.getKey());
            }
        }
        Collections.sort(result);
        return result;
    }

    /**
     * Returns the aliases registered for a discriminator.
     */
    public List<String> getAliases(String name) {
        return aliases.getOrDefault(name.toLowerCase(Locale.ROOT), List.of());
    }

    /**
     * Returns the registered spelling of a label, or the label itself when unknown.
     */
    public String formatLabel(String label) {
        return labels.getOrDefault(label.toLowerCase(Locale.ROOT), label);
    }

    private String resolve(String lower) {
        if (types.containsKey(lower)) {
            return lower;
        }
        return aliasTargets.get(lower);
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("registry is frozen");
        }
    }
}
