package com.archiver.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void conflictDefault_shouldAllowAFewQuickAttempts() {
        RetryPolicy policy = RetryPolicy.conflictDefault();
        
        assertEquals(5, policy.maxAttempts());
        assertEquals(Duration.ofMillis(50), policy.initialBackoff());
        assertEquals(2.0, policy.backoffMultiplier());
    }

    @Test
    void computeBackoff_shouldIncreaseExponentially() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(5)
            .initialBackoff(Duration.ofMillis(200))
            .maxBackoff(Duration.ofSeconds(10))
            .backoffMultiplier(2.0)
            .jitterFactor(0.0) // No jitter for predictable test
            .build();
        
        assertEquals(Duration.ofMillis(200), policy.computeBackoff(1));
        assertEquals(Duration.ofMillis(400), policy.computeBackoff(2));
        assertEquals(Duration.ofMillis(800), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_shouldRespectMaxBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(10)
            .initialBackoff(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofSeconds(10))
            .backoffMultiplier(2.0)
            .jitterFactor(0.0)
            .build();
        
        // Attempt 5: 2^4 = 16s, but capped at 10s
        assertEquals(Duration.ofSeconds(10), policy.computeBackoff(5));
    }

    @Test
    void computeBackoff_shouldStayWithinJitterBounds() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(1000))
            .maxBackoff(Duration.ofSeconds(10))
            .jitterFactor(0.2)
            .build();
        
        for (int i = 0; i < 50; i++) {
            long millis = policy.computeBackoff(1).toMillis();
            assertTrue(millis >= 800 && millis <= 1200, "backoff out of range: " + millis);
        }
    }

    @Test
    void computeBackoff_shouldRejectAttemptZero() {
        assertThrows(IllegalArgumentException.class,
            () -> RetryPolicy.transientDefault().computeBackoff(0));
    }

    @Test
    void hasMoreAttempts_shouldRespectMaxAttempts() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(3)
            .build();
        
        assertTrue(policy.hasMoreAttempts(1));
        assertTrue(policy.hasMoreAttempts(2));
        assertFalse(policy.hasMoreAttempts(3));
        assertFalse(policy.hasMoreAttempts(4));
    }

    @Test
    void constructor_shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
            () -> RetryPolicy.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> RetryPolicy.builder().jitterFactor(1.5).build());
        assertThrows(IllegalArgumentException.class,
            () -> RetryPolicy.builder()
                .initialBackoff(Duration.ofSeconds(5))
                .maxBackoff(Duration.ofSeconds(1))
                .build());
    }
}
