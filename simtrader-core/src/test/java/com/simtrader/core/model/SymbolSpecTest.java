package com.simtrader.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SymbolSpecTest {

    private final SymbolSpec spec = SymbolSpec.builder("EURUSD")
            .volumeMin(0.01).volumeStep(0.01).volumeMax(10)
            .build();

    @Test
    void volumeOnStepGridIsValid() {
        assertTrue(spec.isValidVolume(0.01));
        assertTrue(spec.isValidVolume(0.37));
        assertTrue(spec.isValidVolume(10));
    }

    @Test
    void volumeOffGridOrOutOfRangeIsInvalid() {
        assertFalse(spec.isValidVolume(0.005));
        assertFalse(spec.isValidVolume(0.015));
        assertFalse(spec.isValidVolume(10.01));
    }

    @Test
    void pointsAndNormalization() {
        assertEquals(10, spec.points(0.0001), 1e-6);
        assertEquals(1.12346, spec.normalizePrice(1.123456), 1e-12);
    }

    @Test
    void builderRejectsBadRange() {
        assertThrows(IllegalArgumentException.class,
                () -> SymbolSpec.builder("X").volumeMin(2).volumeMax(1).build());
    }

    @Test
    void tickRejectsCrossedQuote() {
        assertThrows(IllegalArgumentException.class, () -> Tick.of(0, 1.2, 1.1));
        assertEquals(0.0002, Tick.of(0, 1.1, 1.1002).spread(), 1e-12);
    }
}
