package io.hearthwarrio.remoteui.core;

import org.openqa.selenium.json.Json;

/**
 * Renders wire-format maps as compact JSON for messages and logs.
 * <p>
 * Selenium escapes HTML-sensitive characters ({@code < > & = ' /}) as unicode escapes; those are turned back into
 * plain characters so resource ids stay readable. Other escapes are kept.
 */
public final class SelectorJson {

    private static final Json JSON = new Json();

    private static final String READABLE = "<>&='/";

    private SelectorJson() {
        // utility class
    }

    /**
     * @param wire wire-format value (map, list or scalar); {@code null} renders as {@code null}
     * @return single-line JSON
     */
    public static String toJson(Object wire) {
        StringBuilder sb = new StringBuilder(128);
        JSON.newOutput(sb).setPrettyPrint(false).write(wire);
        return unescapeReadable(sb);
    }

    static String unescapeReadable(CharSequence json) {
        StringBuilder out = new StringBuilder(json.length());
        int i = 0;
        while (i < json.length()) {
            char c = json.charAt(i);
            if (c != '\\' || i + 1 >= json.length()) {
                out.append(c);
                i++;
                continue;
            }
            if (json.charAt(i + 1) == 'u' && i + 6 <= json.length()) {
                int code = hex(json, i + 2);
                if (code >= 0 && READABLE.indexOf(code) >= 0) {
                    out.append((char) code);
                    i += 6;
                    continue;
                }
            }
            // any other escape, including an escaped backslash, is copied as is
            out.append(c).append(json.charAt(i + 1));
            i += 2;
        }
        return out.toString();
    }

    private static int hex(CharSequence s, int from) {
        int value = 0;
        for (int k = from; k < from + 4; k++) {
            int digit = Character.digit(s.charAt(k), 16);
            if (digit < 0) {
                return -1;
            }
            value = value * 16 + digit;
        }
        return value;
    }
}
