package io.hearthwarrio.remoteui.testkit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One call received by {@link RecordingAutomationService}.
 */
public final class RecordedCall {

    private final String method;
    private final List<Object> params;

    RecordedCall(String method, List<Object> params) {
        this.method = method;
        this.params = params;
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return positional parameters (read-only, may contain nulls)
     */
    public List<Object> getParams() {
        return params;
    }

    public Object param(int index) {
        return params.get(index);
    }

    /**
     * Returns the parameter at the given index as a selector wire map.
     *
     * @throws IllegalStateException if the parameter is not a map
     */
    public Map<String, Object> selectorAt(int index) {
        Object value = params.get(index);
        if (!(value instanceof Map)) {
            throw new IllegalStateException("Parameter " + index + " of " + method + " is not a selector: " + value);
        }
        Map<String, Object> selector = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
            selector.put(String.valueOf(e.getKey()), e.getValue());
        }
        return selector;
    }

    /**
     * Shortcut for {@code selectorAt(0)}: most operations take the target selector first.
     */
    public Map<String, Object> selector() {
        return selectorAt(0);
    }

    @Override
    public String toString() {
        return method + params;
    }
}
