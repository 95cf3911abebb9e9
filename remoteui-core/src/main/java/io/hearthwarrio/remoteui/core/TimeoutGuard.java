package io.hearthwarrio.remoteui.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Rejects time bounds the RPC channel cannot honor.
 * <p>
 * A remote wait longer than the channel timeout would surface as a transport failure instead of a plain "not found",
 * so every wait-style operation converts its timeout here before calling the remote service.
 */
public final class TimeoutGuard {

    private final long rpcTimeoutMillis;

    public TimeoutGuard(Duration rpcTimeout) {
        Objects.requireNonNull(rpcTimeout, "rpcTimeout must not be null");
        if (rpcTimeout.isNegative() || rpcTimeout.isZero()) {
            throw new IllegalArgumentException("rpcTimeout must be positive: " + rpcTimeout);
        }
        this.rpcTimeoutMillis = rpcTimeout.toMillis();
    }

    /**
     * Converts the timeout to whole milliseconds (sub-millisecond parts are dropped) and checks it against the ceiling.
     *
     * @param operation operation name used in the error message
     * @param timeout   requested bound
     * @return timeout in milliseconds, {@code 0 <= result < ceiling}
     * @throws ActionArgumentException if the timeout is negative or not below the RPC timeout
     */
    public long toMillis(String operation, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new ActionArgumentException(operation, "timeout must not be negative, got " + timeout);
        }

        long millis;
        try {
            millis = timeout.toMillis();
        } catch (ArithmeticException e) {
            throw new ActionArgumentException(operation, tooLong(String.valueOf(timeout)), e);
        }

        if (millis >= rpcTimeoutMillis) {
            throw new ActionArgumentException(operation, tooLong(millis + " ms"));
        }
        return millis;
    }

    /**
     * Converts a hold duration (no ceiling applies) to whole milliseconds.
     *
     * @throws ActionArgumentException if the duration is negative or does not fit in a {@code long}
     */
    public static long durationMillis(String operation, Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isNegative()) {
            throw new ActionArgumentException(operation, "duration must not be negative, got " + duration);
        }
        try {
            return duration.toMillis();
        } catch (ArithmeticException e) {
            throw new ActionArgumentException(operation, "duration is too long: " + duration, e);
        }
    }

    public long getRpcTimeoutMillis() {
        return rpcTimeoutMillis;
    }

    private String tooLong(String requested) {
        return "timeout must be less than the RPC timeout of " + rpcTimeoutMillis + " ms, got " + requested;
    }
}
