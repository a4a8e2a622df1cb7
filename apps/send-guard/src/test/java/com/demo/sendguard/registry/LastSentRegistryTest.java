package com.demo.sendguard.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LastSentRegistryTest {

    private LastSentRegistry registry;

    @BeforeEach
    void setup() {
        registry = new LastSentRegistry();
    }

    @Test
    void testEmptyChannel() {
        assertEquals(Optional.empty(), registry.lastSent("c1"));
        assertEquals(0, registry.size());
    }

    @Test
    void testRecordNormalizesToString() {
        assertEquals("42", registry.record("c1", 42L));
        assertEquals(Optional.of("42"), registry.lastSent("c1"));
    }

    @Test
    void testOneEntryPerChannel() {
        registry.record("c1", "m1");
        registry.record("c1", "m2");
        registry.record("c2", "m3");

        assertEquals(Optional.of("m2"), registry.lastSent("c1"));
        assertEquals(2, registry.size());
    }

    @Test
    void testClearIfCurrent() {
        registry.record("c1", "m1");

        assertFalse(registry.clearIfCurrent("c1", "m0"), "stale id must not clear the entry");
        assertEquals(Optional.of("m1"), registry.lastSent("c1"));

        assertTrue(registry.clearIfCurrent("c1", "m1"));
        assertEquals(Optional.empty(), registry.lastSent("c1"));
    }

    @Test
    void testIsCurrent() {
        registry.record("c1", "m1");
        assertTrue(registry.isCurrent("c1", "m1"));
        assertFalse(registry.isCurrent("c1", "m2"));
        assertFalse(registry.isCurrent("c2", "m1"));
        assertFalse(registry.isCurrent("c1", null));
    }

    @Test
    void testExclusivelyAllowsNestedAccess() throws InterruptedException {
        registry.record("c1", "m1");
        String seen = registry.exclusively(() -> {
            registry.record("c1", "m2");
            return registry.lastSent("c1").orElseThrow();
        });
        assertEquals("m2", seen);
    }

    @Test
    void testRecordRejectsNulls() {
        assertThrows(NullPointerException.class, () -> registry.record("c1", null));
        assertThrows(NullPointerException.class, () -> registry.record(null, "m1"));
    }
}
