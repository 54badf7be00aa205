package com.domain.correlation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignalTest {

    @Test
    @DisplayName("Domains are stored in lexicographic order")
    void swapsDomainsIntoOrder() {
        Signal signal = new Signal("z.com", "a.com", "phone", "+1-555-0100", SignalTier.STRONG);

        assertEquals("a.com", signal.domainA());
        assertEquals("z.com", signal.domainB());
        assertEquals(DomainPair.of("a.com", "z.com"), signal.pair());
    }

    @Test
    @DisplayName("A signal needs two distinct domains")
    void rejectsSameDomain() {
        assertThrows(IllegalArgumentException.class,
                () -> new Signal("a.com", "a.com", "phone", "+1-555-0100", SignalTier.STRONG));
    }

    @Test
    void rejectsNullFields() {
        assertThrows(NullPointerException.class,
                () -> new Signal("a.com", "b.com", "phone", null, SignalTier.STRONG));
        assertThrows(NullPointerException.class,
                () -> new Signal("a.com", "b.com", "phone", "+1-555-0100", null));
    }

    @Test
    void exposesEvidenceAndKey() {
        IdentifierKey key = new IdentifierKey("google_analytics", "UA-1");
        Signal signal = Signal.between("b.com", "a.com", key, SignalTier.SMOKING_GUN);

        assertEquals(key, signal.identifierKey());
        assertEquals(new Evidence("google_analytics", "UA-1", SignalTier.SMOKING_GUN), signal.evidence());
    }
}
