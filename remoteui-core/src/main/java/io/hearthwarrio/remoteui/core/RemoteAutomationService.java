package io.hearthwarrio.remoteui.core;

/**
 * Synchronous request/response channel to the automation service running on the device.
 * <p>
 * Implementations are expected to be connected already. Each call names a remote operation and passes positional
 * parameters: selector wire maps (see {@link Selector#toWireFormat()}), coordinates, percentages, speeds and millisecond
 * durations. {@code null} parameters mean "use the remote default".
 * <p>
 * Results are raw transport values: {@link Boolean}, {@link String}, {@link Number}, {@code Map<String, Object>} records,
 * {@code List} of records, or {@code null}.
 * <p>
 * Transport failures are thrown as-is and are not part of this library's error model.
 */
@FunctionalInterface
public interface RemoteAutomationService {

    /**
     * @param method remote operation name, e.g. {@code clickObj}
     * @param params positional parameters
     * @return raw result (may be null)
     */
    Object call(String method, Object... params);
}
