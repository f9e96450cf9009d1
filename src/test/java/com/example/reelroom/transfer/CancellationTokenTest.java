package com.example.reelroom.transfer;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void cancelIsObserved() {
        CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancelled());
        token.throwIfCancelled();

        token.cancel();
        assertTrue(token.isCancelled());
        assertThrows(TransferCancelledException.class, token::throwIfCancelled);
    }

    @Test
    void deadlineExpires() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ZERO);
        assertTrue(token.isCancelled());
        TransferCancelledException e = assertThrows(TransferCancelledException.class, token::throwIfCancelled);
        assertEquals("Transfer deadline exceeded", e.getMessage());

        assertFalse(CancellationToken.withTimeout(Duration.ofMinutes(5)).isCancelled());
    }
}
