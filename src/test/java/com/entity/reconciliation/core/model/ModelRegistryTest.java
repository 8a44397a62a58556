package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.Model;
import com.entity.reconciliation.registry.TypeRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryTest {

    @Test
    @DisplayName("The shared registry should be frozen and reused")
    void testShared() {
        TypeRegistry shared = ModelRegistry.shared();

        assertTrue(shared.isFrozen());
        assertSame(shared, ModelRegistry.shared());
        assertThrows(IllegalStateException.class, () -> shared.register(Asset::new));
    }

    @Test
    @DisplayName("Should list the built-in types by kind")
    void testTypes() {
        TypeRegistry registry = ModelRegistry.create();

        assertEquals(List.of("discovered", "hasattribute", "hasvulnerability", "instanceof"),
                registry.getTypes(GraphRelationship.class));
        assertTrue(registry.getTypes(Assetlike.class).containsAll(List.of("adobject", "asset", "webapplication")));
        assertTrue(registry.getAllTypes().containsAll(List.of("risk", "port", "attribute", "preseed")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"aduser", "ADComputer", "adgroup", "adcerttemplate"})
    @DisplayName("AD aliases should resolve to ADObject")
    void testAdAliases(String alias) {
        TypeRegistry registry = ModelRegistry.shared();

        assertEquals(ADObject.class, registry.getType(alias).orElseThrow());
        Model model = registry.makeType(alias).orElseThrow();
        assertEquals(alias.toLowerCase(), ((ADObject) model).getAlias());
    }

    @Test
    @DisplayName("Labels should keep their registered spelling")
    void testLabels() {
        TypeRegistry registry = ModelRegistry.shared();

        assertEquals("ADUser", registry.formatLabel("aduser"));
        assertEquals("Seed", registry.formatLabel("SEED"));
        assertEquals("HAS_VULNERABILITY", registry.formatLabel("has_vulnerability"));
        assertEquals("Unknown", registry.formatLabel("Unknown"));
    }

    @Test
    @DisplayName("registerAll should leave room for caller types")
    void testRegisterAll() {
        TypeRegistry registry = new TypeRegistry();
        ModelRegistry.registerAll(registry);

        assertFalse(registry.isFrozen());
        assertTrue(registry.contains("asset"));
    }
}
