package io.hearthwarrio.remoteui.core;

import java.util.Map;

final class Records {

    private Records() {
        // utility class
    }

    static int intValue(Map<?, ?> record, String key) {
        Object value = record.get(key);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(
                    "Record entry '" + key + "' must be numeric, got: " + value + " in " + record);
        }
        return ((Number) value).intValue();
    }
}
