package com.entity.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SeedPromotionTest {

    private static Asset seedUpdate(String status) {
        Asset update = new Asset("example.com", "example.com");
        update.setSource(Sources.SEED);
        update.setStatus(status);
        return update;
    }

    @Test
    @DisplayName("Merge should promote with exactly one history record")
    void testMergePromotion() {
        Asset existing = Asset.create("example.com", "example.com");

        existing.merge(seedUpdate(Statuses.ACTIVE_HIGH));

        assertEquals(Sources.SEED, existing.getSource());
        assertEquals(Statuses.ACTIVE_HIGH, existing.getStatus());
        assertEquals(1, existing.getHistory().size());
        HistoryRecord record = existing.getHistory().getRecords().get(0);
        assertEquals(Statuses.ACTIVE_HIGH, record.getTo());
        assertEquals(Sources.SEED, record.getBy());
        assertEquals(Optional.of(Labels.SEED), Relabelable.pendingLabelAddition(existing));
    }

    @Test
    @DisplayName("Merge without a status should keep the current status")
    void testMergePromotionWithoutStatus() {
        Asset existing = Asset.create("example.com", "example.com");

        existing.merge(seedUpdate(null));

        assertEquals(Statuses.ACTIVE, existing.getStatus());
        assertEquals(1, existing.getHistory().size());
    }

    @Test
    @DisplayName("Visit should promote and keep the current status")
    void testVisitPromotion() {
        Asset existing = Asset.create("example.com", "example.com");
        existing.setStatus(Statuses.ACTIVE_LOW);

        existing.visit(seedUpdate(Statuses.ACTIVE));

        assertEquals(Sources.SEED, existing.getSource());
        assertEquals(Statuses.ACTIVE_LOW, existing.getStatus());
        assertEquals(Labels.SEED, existing.getPendingLabelAddition());
        assertEquals(1, existing.getHistory().size());
    }

    @Test
    @DisplayName("An existing seed should not be promoted again")
    void testAlreadySeed() {
        Asset existing = Asset.seed("example.com");

        existing.visit(seedUpdate(Statuses.ACTIVE));

        assertNull(existing.getPendingLabelAddition());
        assertEquals(0, existing.getHistory().size());
    }

    @Test
    @DisplayName("A self-sourced update should not promote")
    void testSelfUpdate() {
        Asset existing = Asset.create("example.com", "example.com");

        existing.merge(Asset.create("example.com", "example.com"));

        assertFalse(SeedPromotion.isPromotion(existing, Asset.create("example.com", "example.com")));
        assertEquals(Optional.empty(), Relabelable.pendingLabelAddition(existing));
        assertEquals(Sources.SELF, existing.getSource());
    }
}
