package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.Asset;
import com.entity.reconciliation.core.model.Discovered;
import com.entity.reconciliation.core.model.Labels;
import com.entity.reconciliation.core.model.Risk;
import com.entity.reconciliation.core.model.Sources;
import com.entity.reconciliation.core.model.Statuses;
import com.entity.reconciliation.metrics.MicrometerMetricsService;
import com.entity.reconciliation.registry.HookPipeline;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReconciliationEngine Tests")
class ReconciliationEngineTest {

    private SimpleMeterRegistry meterRegistry;
    private ReconciliationEngine engine;
    private Asset asset;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        engine = new ReconciliationEngine(new MicrometerMetricsService(meterRegistry));
        asset = Asset.create("example.com", "example.com");
    }

    private double count(String name) {
        Counter counter = meterRegistry.find(name).counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("Merge")
    class MergeTests {

        @Test
        @DisplayName("Should report the status transition and history added")
        void testStatusTransition() {
            Risk existing = Risk.create(asset, "CVE-2023-12345", "TI");
            Risk update = Risk.create(asset, "CVE-2023-12345", "OH");

            ReconciliationResult<Risk> result = engine.merge(existing, update);

            assertSame(existing, result.entity());
            assertEquals(ReconciliationMode.MERGE, result.mode());
            assertEquals("TI", result.statusBefore());
            assertEquals("OH", result.statusAfter());
            assertTrue(result.statusChanged());
            assertEquals(1, result.historyAdded());
            assertFalse(result.created());
            assertFalse(result.hasPendingLabel());
            assertEquals(1.0, count("entity.status.transition"));
            assertNotNull(meterRegistry.find("entity.reconcile.duration").tag("mode", "merge").timer());
        }

        @Test
        @DisplayName("An unchanged status should not count a transition")
        void testNoTransition() {
            Asset update = Asset.create("example.com", "example.com");

            ReconciliationResult<Asset> result = engine.merge(asset, update);

            assertFalse(result.statusChanged());
            assertEquals(0, result.historyAdded());
            assertEquals(0.0, count("entity.status.transition"));
        }

        @Test
        @DisplayName("Seed promotion should expose the pending label")
        void testPromotion() {
            Asset update = new Asset("example.com", "example.com");
            update.setSource(Sources.SEED);
            HookPipeline.callHooks(update);

            ReconciliationResult<Asset> result = engine.merge(asset, update);

            assertTrue(result.hasPendingLabel());
            assertEquals(Labels.SEED, result.pendingLabel());
            assertEquals(1, result.historyAdded());
            assertTrue(result.labelsToWrite().contains(Labels.SEED));
            assertEquals(1.0, count("entity.seed.promotion"));
        }

        @Test
        @DisplayName("Different keys should be rejected")
        void testKeyMismatch() {
            Asset other = Asset.create("example.org", "example.org");

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> engine.merge(asset, other));
            assertTrue(e.getMessage().contains("cannot reconcile different keys"));
        }
    }

    @Nested
    @DisplayName("Visit")
    class VisitTests {

        @Test
        @DisplayName("A pending asset observed active should become active")
        void testPendingToActive() {
            Asset pending = asset.withStatus(Statuses.PENDING);
            Asset observation = Asset.create("example.com", "example.com");

            ReconciliationResult<Asset> result = engine.visit(pending, observation);

            assertEquals(ReconciliationMode.VISIT, result.mode());
            assertEquals(Statuses.PENDING, result.statusBefore());
            assertEquals(Statuses.ACTIVE, result.statusAfter());
            assertEquals(1.0, count("entity.status.transition"));
        }

        @Test
        @DisplayName("Relationships should be visited by key")
        void testRelationship() {
            Asset host = Asset.create("www.example.com", "www.example.com");
            Discovered existing = Discovered.create(asset, host);
            Discovered observation = Discovered.create(asset, host);
            observation.setCapability("crawler");

            assertSame(existing, engine.visitRelationship(existing, observation));
            assertEquals("crawler", existing.getCapability());
        }

        @Test
        @DisplayName("Relationships with different keys should be rejected")
        void testRelationshipMismatch() {
            Asset host = Asset.create("www.example.com", "www.example.com");
            Discovered existing = Discovered.create(asset, host);
            Discovered reversed = Discovered.create(host, asset);

            assertThrows(IllegalArgumentException.class, () -> engine.visitRelationship(existing, reversed));
        }
    }

    @Test
    @DisplayName("A created result should carry the entity's labels")
    void testCreatedResult() {
        ReconciliationResult<Asset> result = ReconciliationResult.created(asset, asset.getStatus(), null);

        assertTrue(result.created());
        assertFalse(result.statusChanged());
        assertEquals(List.of("Asset", "TTL"), result.labelsToWrite());
    }
}
