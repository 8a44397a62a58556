package com.entity.reconciliation.core.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipTest {

    private Asset domain;
    private Asset host;

    @BeforeEach
    void setUp() {
        domain = Asset.create("example.com", "example.com");
        host = Asset.create("www.example.com", "192.0.2.10");
    }

    @Test
    @DisplayName("The key should join source key, label and target key")
    void testKey() {
        Discovered discovered = Discovered.create(domain, host);

        assertEquals(domain.getKey() + "#DISCOVERED" + host.getKey(), discovered.getKey());
        assertSame(domain, discovered.nodes().source());
        assertSame(host, discovered.nodes().target());
        assertNotNull(discovered.getCreated());
        assertTrue(discovered.valid());
    }

    @Test
    @DisplayName("Each relationship type should use its own label")
    void testLabels() {
        Risk risk = Risk.create(domain, "CVE-2024-0001", "TI");
        Attribute attribute = Attribute.create("https", "443", domain);

        assertEquals(domain.getKey() + "#HAS_VULNERABILITY" + risk.getKey(),
                HasVulnerability.create(domain, risk).getKey());
        assertEquals(domain.getKey() + "#HAS_ATTRIBUTE" + attribute.getKey(),
                HasAttribute.create(domain, attribute).getKey());
        assertEquals(host.getKey() + "#INSTANCE_OF" + domain.getKey(),
                InstanceOf.create(host, domain).getKey());
    }

    @Test
    @DisplayName("A relationship without endpoints should not be valid")
    void testNoEndpoints() {
        Discovered discovered = Discovered.create(null, null);

        assertNull(discovered.getKey());
        assertFalse(discovered.valid());
    }

    @Test
    @DisplayName("Visit should take timestamps, capability and endpoints")
    void testVisit() {
        Discovered existing = new Discovered();
        existing.setNodes(domain, host);
        existing.setVisited("2024-01-01T00:00:00Z");
        Discovered observation = Discovered.create(domain, host);
        observation.setCapability("subdomain");
        observation.setAttachmentPath("proofs/example.com");

        existing.visit(observation);

        assertEquals(observation.getVisited(), existing.getVisited());
        assertEquals("subdomain", existing.getCapability());
        assertEquals("proofs/example.com", existing.getAttachmentPath());
        assertSame(host, existing.nodes().target());
    }

    @Test
    @DisplayName("Visit should keep fields the observation leaves blank")
    void testVisitBlank() {
        Discovered existing = Discovered.create(domain, host);
        existing.setCapability("subdomain");

        existing.visit(new Discovered());

        assertEquals("subdomain", existing.getCapability());
        assertSame(domain, existing.nodes().source());
    }
}
