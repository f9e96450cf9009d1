package com.example.reelroom.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPolicyTest {

    private static final long NOW = 1_700_000_000_000L;

    @Test
    void zeroDaysKeepsOnlyGraceWindow() {
        assertEquals(NOW - 10_000, RetentionPolicy.ofDays(0).cutoff(NOW, 10_000));
    }

    @Test
    void positiveDaysCountBackFromSession() {
        assertEquals(NOW - 2 * RetentionPolicy.DAY_MS, RetentionPolicy.ofDays(2).cutoff(NOW, 10_000));
    }

    @Test
    void negativeDisablesSweep() {
        RetentionPolicy forever = RetentionPolicy.ofDays(-1);
        assertFalse(forever.isSweepEnabled());
        assertThrows(IllegalStateException.class, () -> forever.cutoff(NOW, 10_000));
        assertFalse(RetentionPolicy.keepForever().isSweepEnabled());
    }
}
