package com.alertgate.core.throttle;

import java.util.Map;
import java.util.Optional;

/**
 * Dotted-path lookup into nested event payloads, e.g. {@code interface.name}
 * resolves {@code {"interface": {"name": "eth0"}}} to {@code "eth0"}.
 */
final class FieldPaths {

    private FieldPaths() {
        // utility class
    }

    /**
     * @param fields payload, may be {@code null}
     * @param path   dotted path, may be {@code null}
     * @return the stringified leaf value, or empty if any segment is missing,
     *         the leaf is {@code null}, or an intermediate value is not a map
     */
    static Optional<String> resolve(Map<String, ?> fields, String path) {
        if (fields == null || path == null || path.isEmpty()) {
            return Optional.empty();
        }
        Object current = fields;
        for (String segment : path.split("\\.", -1)) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(String.valueOf(current));
    }
}
