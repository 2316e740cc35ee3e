package com.holdemengine.common;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured error value: a code, a human readable message and optional details.
 */
@Value
public class PokerError {
    ErrorCode code;
    String message;
    Map<String, Object> details;

    public static PokerError of(ErrorCode code, String message) {
        return new PokerError(code, message, Collections.emptyMap());
    }

    /**
     * @param details alternating key/value pairs, e.g. {@code "required", 50, "available", 15}
     */
    public static PokerError of(ErrorCode code, String message, Object... details) {
        if (details.length % 2 != 0) {
            throw new IllegalArgumentException("Details must be key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < details.length; i += 2) {
            map.put(String.valueOf(details[i]), details[i + 1]);
        }
        return new PokerError(code, message, Collections.unmodifiableMap(map));
    }

    public boolean hasDetails() {
        return !details.isEmpty();
    }
}
