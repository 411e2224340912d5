package com.timeslice.clock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VirtualTimeSourceTest {

    @Test
    @DisplayName("sleep advances the clock by exactly the slice")
    void sleepAdvancesClock() {
        VirtualTimeSource clock = new VirtualTimeSource(10.0);
        clock.sleep(2.0);
        clock.sleep(0.5);
        assertEquals(12.5, clock.now(), 1e-9);
    }

    @Test
    @DisplayName("non-positive sleeps leave the clock untouched")
    void nonPositiveSleepIsNoop() {
        VirtualTimeSource clock = new VirtualTimeSource();
        clock.sleep(0);
        clock.sleep(-3);
        assertEquals(0.0, clock.now());
    }

    @Test
    @DisplayName("advance rejects negative values")
    void advanceRejectsNegative() {
        VirtualTimeSource clock = new VirtualTimeSource();
        clock.advance(4);
        assertEquals(4.0, clock.now());
        assertThrows(IllegalArgumentException.class, () -> clock.advance(-1));
    }

    @Test
    @DisplayName("system clock sleeps in real time")
    void systemClockSleeps() throws InterruptedException {
        SystemTimeSource clock = new SystemTimeSource();
        double before = clock.now();
        clock.sleep(0.05);
        assertTrue(clock.now() - before >= 0.04);
        assertEquals("system", clock.getName());
    }
}
