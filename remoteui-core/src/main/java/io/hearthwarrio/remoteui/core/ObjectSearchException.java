package io.hearthwarrio.remoteui.core;

import java.util.Map;

/**
 * Thrown when a strict existence or absence check fails.
 * <p>
 * Only raised when the caller opted in, either through a handle's raise-on-missing mode or an explicit per-call flag.
 */
public class ObjectSearchException extends RuntimeException {

    private final Map<String, Object> selector;
    private final long timeoutMillis;

    /**
     * @param message       description
     * @param selector      wire format of the selector that was searched
     * @param timeoutMillis wait bound in milliseconds, or {@code -1} for an immediate check
     */
    public ObjectSearchException(String message, Map<String, Object> selector, long timeoutMillis) {
        super(message);
        this.selector = selector;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Re-wraps a search failure with a caller supplied message. The selector and timeout are carried over.
     */
    public ObjectSearchException(String message, ObjectSearchException cause) {
        super(message, cause);
        this.selector = cause.selector;
        this.timeoutMillis = cause.timeoutMillis;
    }

    public Map<String, Object> getSelector() {
        return selector;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
