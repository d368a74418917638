package net.maasbridge.resource.template;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses a raw query string into a flat name to value mapping.
 *
 * <p>Keys and values are percent-decoded ({@code +} becomes a space). Repeated keys collapse
 * to the last value seen; there is no multi-value form. A key without {@code =} maps to the
 * empty string.
 */
public final class QueryStringParser {

    private QueryStringParser() {
    }

    public static Map<String, String> parse(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            if (key.isEmpty()) {
                continue;
            }
            result.put(decode(key), decode(value));
        }
        return Collections.unmodifiableMap(result);
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException malformedEscape) {
            // "%zz" and truncated escapes are kept as typed
            return raw;
        }
    }
}
