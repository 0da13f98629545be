package com.work.chainexec.txmgr.service;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPolicyTest {

    private static RetryPolicy policy(double increment) {
        return new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, increment);
    }

    @Test
    public void escalation_uses_exact_increment_not_whole_percent() {
        RetryPolicy p = policy(1.125);

        assertEquals(BigInteger.valueOf(1125), p.escalate(BigInteger.valueOf(1000)));
        // 1125 * 1.125 = 1265.625，向下取整
        assertEquals(BigInteger.valueOf(1265), p.priceForAttempt(BigInteger.valueOf(1000), 2));
    }

    @Test
    public void escalation_of_wei_scale_price_keeps_precision() {
        RetryPolicy p = policy(1.1);
        BigInteger gwei20 = BigInteger.valueOf(20_000_000_000L);

        assertEquals(BigInteger.valueOf(22_000_000_000L), p.escalate(gwei20));
        assertEquals(BigInteger.valueOf(24_200_000_000L), p.priceForAttempt(gwei20, 2));
        assertNull(p.escalate(null));
    }

    @Test
    public void backoff_doubles_and_is_capped() {
        RetryPolicy p = policy(1.1);

        assertEquals(Duration.ofMillis(100), p.backoff(0));
        assertEquals(Duration.ofMillis(400), p.backoff(2));
        assertEquals(Duration.ofSeconds(1), p.backoff(10));
    }

    @Test
    public void invalid_parameters_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(-1, Duration.ofMillis(1), Duration.ofMillis(1), 2.0, 1.1));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, Duration.ZERO, Duration.ofMillis(1), 2.0, 1.1));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, Duration.ofMillis(1), null, 2.0, 1.1));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1), 2.0, 0.9));
    }

    @Test
    public void override_keeps_unset_fields() {
        RetryPolicy p = policy(1.1).override(0, null, null, null, 1.25);

        assertEquals(0, p.getMaxRetries());
        assertEquals(Duration.ofMillis(100), p.getInitialDelay());
        assertEquals(BigInteger.valueOf(125), p.escalate(BigInteger.valueOf(100)));
    }
}
