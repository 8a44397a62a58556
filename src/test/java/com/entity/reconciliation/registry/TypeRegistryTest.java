package com.entity.reconciliation.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TypeRegistry Tests")
class TypeRegistryTest {

    static class Widget implements Model {
        @Override
        public String getDescription() {
            return "widget";
        }
    }

    static class Gadget implements Model, Labeled {
        @Override
        public String getDescription() {
            return "gadget";
        }

        @Override
        public List<String> getLabels() {
            return List.of("Gadget", "TTL");
        }
    }

    static class Shape implements Model, Aliasable {
        private String alias;

        @Override
        public String getDescription() {
            return "shape";
        }

        @Override
        public void setAlias(String alias) {
            this.alias = alias;
        }

        @Override
        public String getAlias() {
            return alias;
        }
    }

    /**
     * Same simple name as the top level {@link Widget}, so it collides with it.
     */
    static class Other {
        static class Widget implements Model {
            @Override
            public String getDescription() {
                return "other widget";
            }
        }
    }

    private TypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TypeRegistry();
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Discriminator should be the lower-cased simple class name")
        void testName() {
            assertEquals("widget", TypeRegistry.name(Widget.class));
            assertEquals("gadget", TypeRegistry.name(new Gadget()));
        }

        @Test
        @DisplayName("Should allocate a fresh instance per lookup")
        void testMakeType() {
            registry.register(Widget::new);

            Optional<Model> first = registry.makeType("widget");
            Optional<Model> second = registry.makeType("WIDGET");

            assertTrue(first.isPresent());
            assertTrue(second.isPresent());
            assertInstanceOf(Widget.class, first.get());
            assertNotSame(first.get(), second.get());
        }

        @Test
        @DisplayName("Re-registering the same class should be a no-op")
        void testIdempotentRegistration() {
            registry.register(Widget::new);
            assertDoesNotThrow(() -> registry.register(Widget::new));
            assertEquals(1, registry.getAllTypes().size());
        }

        @Test
        @DisplayName("A different class under the same discriminator should be rejected")
        void testConflictingRegistration() {
            registry.register(Widget::new);
            RegistrationException e = assertThrows(RegistrationException.class,
                    () -> registry.register(Other.Widget::new));
            assertTrue(e.getMessage().contains("widget"));
        }

        @Test
        @DisplayName("Unknown names should yield nothing")
        void testUnknown() {
            registry.register(Widget::new);
            assertTrue(registry.makeType("sprocket").isEmpty());
            assertTrue(registry.makeType(null).isEmpty());
            assertFalse(registry.contains("sprocket"));
        }

        @Test
        @DisplayName("Labels of a labeled prototype should be registered")
        void testLabelsFromPrototype() {
            registry.register(Gadget::new);
            assertEquals("Gadget", registry.formatLabel("GADGET"));
            assertEquals("TTL", registry.formatLabel("ttl"));
            assertEquals("unknown", registry.formatLabel("unknown"));
        }

        @Test
        @DisplayName("A label with a different spelling should be rejected")
        void testConflictingLabel() {
            registry.registerLabel("Seed");
            assertDoesNotThrow(() -> registry.registerLabel("Seed"));
            assertThrows(RegistrationException.class, () -> registry.registerLabel("SEED"));
        }

        @Test
        @DisplayName("A type whose label conflicts should leave the registry untouched")
        void testConflictingLabelOnRegister() {
            registry.registerLabel("ttl");

            assertThrows(RegistrationException.class, () -> registry.register(Gadget::new));

            assertFalse(registry.contains("gadget"));
            assertTrue(registry.makeType("gadget").isEmpty());
            assertTrue(registry.getAllTypes().isEmpty());
            assertEquals("GADGET", registry.formatLabel("GADGET"));
        }
    }

    @Nested
    @DisplayName("Aliases")
    class AliasTests {

        @Test
        @DisplayName("Alias lookups should hand the alias to the instance")
        void testAliasSpecialization() {
            registry.register(Shape::new, "Circle", "Square");

            Model model = registry.makeType("circle").orElseThrow();

            assertInstanceOf(Shape.class, model);
            assertEquals("circle", ((Shape) model).getAlias());
            assertEquals(List.of("circle", "square"), registry.getAliases("shape"));
            assertEquals("Circle", registry.formatLabel("circle"));
        }

        @Test
        @DisplayName("Aliases should resolve to the registered class")
        void testGetTypeByAlias() {
            registry.register(Shape::new, "Circle");
            assertEquals(Shape.class, registry.getType("CIRCLE").orElseThrow());
            assertTrue(registry.contains("circle"));
        }

        @Test
        @DisplayName("An alias already used by another type should be rejected")
        void testConflictingAlias() {
            registry.register(Widget::new);
            assertThrows(RegistrationException.class, () -> registry.register(Shape::new, "Widget"));
        }

        @Test
        @DisplayName("Aliases should not be listed as types")
        void testAliasesExcludedFromAllTypes() {
            registry.register(Shape::new, "Circle");
            assertEquals(List.of("shape"), List.copyOf(registry.getAllTypes()));
        }
    }

    @Nested
    @DisplayName("Freezing")
    class FreezeTests {

        @Test
        @DisplayName("A frozen registry should reject registrations")
        void testFrozen() {
            registry.register(Widget::new);
            registry.freeze();

            assertTrue(registry.isFrozen());
            assertThrows(IllegalStateException.class, () -> registry.register(Gadget::new));
            assertThrows(IllegalStateException.class, () -> registry.registerLabel("Late"));
            assertTrue(registry.makeType("widget").isPresent());
        }

        @Test
        @DisplayName("getTypes should filter by assignability")
        void testGetTypes() {
            registry.register(Widget::new);
            registry.register(Gadget::new);
            registry.freeze();

            assertEquals(List.of("gadget"), registry.getTypes(Labeled.class));
            assertEquals(List.of("gadget", "widget"), registry.getTypes(Model.class));
        }
    }
}
