package io.hearthwarrio.remoteui.testkit;

import io.hearthwarrio.remoteui.core.RemoteAutomationService;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory {@link RemoteAutomationService} for tests.
 * <p>
 * Records every call and answers from scripted per-method responses:
 * <ul>
 *   <li>{@link #respond(String, Object)} – fixed result</li>
 *   <li>{@link #respondInOrder(String, Object...)} – one result per call, the last one repeats</li>
 *   <li>{@link #respondWith(String, Function)} – computed from the call</li>
 *   <li>{@link #failWith(String, RuntimeException)} – simulated transport failure</li>
 * </ul>
 * Unscripted methods return {@code null}, unless {@link #failOnUnscripted()} was called.
 *
 * <pre>
 * RecordingAutomationService service = new RecordingAutomationService()
 *         .respond("waitForExists", false);
 * </pre>
 */
public final class RecordingAutomationService implements RemoteAutomationService {

    private final List<RecordedCall> calls = new ArrayList<>();
    private final Map<String, Function<RecordedCall, Object>> responders = new HashMap<>();

    private boolean failOnUnscripted = false;

    public RecordingAutomationService respond(String method, Object result) {
        return respondWith(method, call -> result);
    }

    public RecordingAutomationService respondInOrder(String method, Object... results) {
        Objects.requireNonNull(results, "results must not be null");
        if (results.length == 0) {
            throw new IllegalArgumentException("At least one result is required for " + method);
        }
        List<Object> ordered = new ArrayList<>(Arrays.asList(results));
        return respondWith(method, call -> ordered.size() > 1 ? ordered.remove(0) : ordered.get(0));
    }

    public RecordingAutomationService respondWith(String method, Function<RecordedCall, Object> responder) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(responder, "responder must not be null");
        responders.put(method, responder);
        return this;
    }

    public RecordingAutomationService failWith(String method, RuntimeException failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return respondWith(method, call -> {
            throw failure;
        });
    }

    /**
     * Makes unscripted calls throw {@link IllegalStateException} instead of returning {@code null}.
     */
    public RecordingAutomationService failOnUnscripted() {
        this.failOnUnscripted = true;
        return this;
    }

    @Override
    public Object call(String method, Object... params) {
        Objects.requireNonNull(method, "method must not be null");
        List<Object> copy = params == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(params)));
        RecordedCall call = new RecordedCall(method, copy);
        calls.add(call);

        Function<RecordedCall, Object> responder = responders.get(method);
        if (responder == null) {
            if (failOnUnscripted) {
                throw new IllegalStateException("Unscripted remote call: " + call);
            }
            return null;
        }
        return responder.apply(call);
    }

    /**
     * @return all calls in the order received (read-only snapshot)
     */
    public List<RecordedCall> calls() {
        return Collections.unmodifiableList(new ArrayList<>(calls));
    }

    public List<RecordedCall> calls(String method) {
        return calls.stream()
                .filter(c -> c.getMethod().equals(method))
                .collect(Collectors.toUnmodifiableList());
    }

    public List<String> methods() {
        return calls.stream()
                .map(RecordedCall::getMethod)
                .collect(Collectors.toUnmodifiableList());
    }

    public int callCount() {
        return calls.size();
    }

    /**
     * @throws IllegalStateException if no call was recorded
     */
    public RecordedCall lastCall() {
        if (calls.isEmpty()) {
            throw new IllegalStateException("No remote calls recorded");
        }
        return calls.get(calls.size() - 1);
    }

    /**
     * Returns the only recorded call.
     *
     * @throws IllegalStateException if zero or several calls were recorded
     */
    public RecordedCall onlyCall() {
        if (calls.size() != 1) {
            throw new IllegalStateException("Expected exactly one remote call, got " + calls);
        }
        return calls.get(0);
    }

    /**
     * Forgets recorded calls; scripted responses stay.
     */
    public void clearCalls() {
        calls.clear();
    }
}
