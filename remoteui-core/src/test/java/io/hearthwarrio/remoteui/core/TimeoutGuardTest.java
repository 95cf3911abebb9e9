package io.hearthwarrio.remoteui.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class TimeoutGuardTest {

    private final TimeoutGuard guard = new TimeoutGuard(Duration.ofSeconds(60));

    @Test
    void acceptsTimeoutsBelowTheCeiling() {
        assertEquals(59_999L, guard.toMillis("wait.exists", Duration.ofMillis(59_999)));
        assertEquals(0L, guard.toMillis("wait.exists", Duration.ZERO));
    }

    @Test
    void rejectsTimeoutEqualToTheCeiling() {
        ActionArgumentException ex = assertThrows(
                ActionArgumentException.class,
                () -> guard.toMillis("wait.exists", Duration.ofSeconds(60))
        );

        assertEquals("wait.exists", ex.getOperation());
        assertTrue(ex.getMessage().contains("60000 ms"), ex.getMessage());
    }

    @Test
    void rejectsTimeoutAboveTheCeiling() {
        assertThrows(ActionArgumentException.class, () -> guard.toMillis("wait.gone", Duration.ofMinutes(5)));
    }

    @Test
    void rejectsNegativeTimeouts() {
        assertThrows(ActionArgumentException.class, () -> guard.toMillis("wait.gone", Duration.ofMillis(-1)));
    }

    @Test
    void rejectsTimeoutsTooLargeForMillis() {
        ActionArgumentException ex = assertThrows(
                ActionArgumentException.class,
                () -> guard.toMillis("wait.exists", Duration.ofSeconds(Long.MAX_VALUE))
        );

        assertInstanceOf(ArithmeticException.class, ex.getCause());
    }

    @Test
    void dropsSubMillisecondParts() {
        assertEquals(1L, guard.toMillis("click.andWait", Duration.ofNanos(1_999_999)));
    }

    @Test
    void ceilingMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new TimeoutGuard(Duration.ZERO));
    }

    @Test
    void holdDurationsHaveNoCeiling() {
        assertEquals(120_000L, TimeoutGuard.durationMillis("click", Duration.ofMinutes(2)));
        assertThrows(ActionArgumentException.class, () -> TimeoutGuard.durationMillis("click", Duration.ofMillis(-5)));
    }
}
