package io.hearthwarrio.remoteui.core;

/**
 * Thrown before any remote call when an operation receives an invalid argument combination.
 */
public class ActionArgumentException extends IllegalArgumentException {

    private final String operation;

    public ActionArgumentException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    public ActionArgumentException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }

    /**
     * @return name of the rejected operation, e.g. {@code swipe.down}
     */
    public String getOperation() {
        return operation;
    }
}
