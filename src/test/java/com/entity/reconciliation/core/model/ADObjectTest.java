package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.HookPipeline;
import com.entity.reconciliation.registry.TypeRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ADObject Tests")
class ADObjectTest {

    private static final String ADMIN_SID = "s-1-5-21-100-200-300-500";

    @Nested
    @DisplayName("Normalization")
    class NormalizationTests {

        @Test
        @DisplayName("Should key by label, lower-cased domain and upper-cased object id")
        void testCreate() {
            ADObject user = ADObject.create("CORP.local", ADMIN_SID, "CN=Administrator,CN=Users,DC=corp,DC=local",
                    "ADUser");

            assertEquals("#aduser#corp.local#S-1-5-21-100-200-300-500", user.getKey());
            assertEquals("ADUser", user.getLabel());
            assertEquals("user", user.getAssetClass());
            assertEquals("S-1-5-21-100-200-300-500", user.getSid());
            assertEquals(0, user.getTtl());
            assertTrue(user.valid());
            assertEquals(List.of("ADObject", "Asset", "TTL", "ADUser"), user.getLabels());
        }

        @Test
        @DisplayName("Well-known privileged SIDs should be tagged tier zero")
        void testTierZero() {
            ADObject admin = ADObject.create("corp.local", ADMIN_SID, null, "ADUser");
            ADObject regular = ADObject.create("corp.local", "S-1-5-21-100-200-300-1105", null, "ADUser");

            assertTrue(admin.getTags().contains(ADObject.TIER_ZERO_TAG));
            assertFalse(regular.getTags().contains(ADObject.TIER_ZERO_TAG));
        }

        @Test
        @DisplayName("An unknown label should fall back to ADObject")
        void testUnknownLabel() {
            ADObject object = ADObject.create("corp.local", "ABCDEF01-2345", null, "ADWidget");

            assertEquals("ADObject", object.getLabel());
            assertEquals("#adobject#corp.local#ABCDEF01-2345", object.getKey());
        }

        @Test
        @DisplayName("The registry alias should pick the label")
        void testAliasSpecialization() {
            TypeRegistry registry = ModelRegistry.create();
            ADObject computer = (ADObject) registry.makeType("ADComputer").orElseThrow();
            computer.setGroup("corp.local");
            computer.setIdentifier("a1b2c3d4-0000-1111-2222-333344445555");

            HookPipeline.run(computer);

            assertEquals("ADComputer", computer.getLabel());
            assertEquals("#adcomputer#corp.local#A1B2C3D4-0000-1111-2222-333344445555", computer.getKey());
            assertTrue(computer.isClass("Computer"));
            assertTrue(computer.isClass("adobject"));
        }

        @Test
        @DisplayName("Missing domain should not be valid")
        void testInvalid() {
            assertFalse(ADObject.create("", ADMIN_SID, null, "ADUser").valid());
        }
    }

    @Nested
    @DisplayName("Reconciliation")
    class ReconciliationTests {

        @Test
        @DisplayName("Visit should copy directory properties for the same key")
        void testVisit() {
            ADObject existing = ADObject.create("corp.local", ADMIN_SID, "CN=Old", "ADUser");
            ADObject observation = ADObject.create("corp.local", ADMIN_SID, "CN=New", "ADUser");
            observation.setDisplayName("Administrator");

            existing.visit(observation);

            assertEquals("CN=New", existing.getDistinguishedName());
            assertEquals("Administrator", existing.getDisplayName());
            assertEquals(0, existing.getTtl());
        }

        @Test
        @DisplayName("Visit should ignore an object with another key")
        void testVisitOtherKey() {
            ADObject existing = ADObject.create("corp.local", ADMIN_SID, "CN=Old", "ADUser");
            ADObject other = ADObject.create("corp.local", "S-1-5-21-1-2-3-1105", "CN=Other", "ADUser");

            existing.visit(other);

            assertEquals("CN=Old", existing.getDistinguishedName());
        }

        @Test
        @DisplayName("A seed-sourced update should promote the object")
        void testSeedPromotion() {
            ADObject existing = ADObject.create("corp.local", ADMIN_SID, null, "ADUser");
            ADObject update = new ADObject("corp.local", ADMIN_SID, null, "ADUser");
            update.setSource(Sources.SEED);

            existing.merge(update);

            assertEquals(Labels.SEED, existing.getPendingLabelAddition());
            assertTrue(existing.getLabels().contains(Labels.SEED));
            assertEquals(1, existing.getHistory().size());
        }
    }
}
