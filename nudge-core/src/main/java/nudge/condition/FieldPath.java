package nudge.condition;

import java.util.List;
import java.util.Map;

/**
 * Resolves dot paths such as {@code profile.name} against nested maps. Traversal stops
 * with {@link Value#MISSING} as soon as a segment is absent or its parent is not a map
 * (or a list addressed by index).
 */
public final class FieldPath {

    private FieldPath() {
    }

    public static Value resolve(Map<String, ?> context, String path) {
        if (context == null || path == null || path.isEmpty()) {
            return Value.MISSING;
        }
        Object current = context;
        int start = 0;
        while (true) {
            int dot = path.indexOf('.', start);
            String segment = dot < 0 ? path.substring(start) : path.substring(start, dot);
            Lookup lookup = step(current, segment);
            if (!lookup.found) {
                return Value.MISSING;
            }
            if (dot < 0) {
                return Value.of(lookup.value);
            }
            if (lookup.value == null) {
                return Value.MISSING;
            }
            current = lookup.value;
            start = dot + 1;
        }
    }

    private static Lookup step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            if (!map.containsKey(segment)) {
                return Lookup.ABSENT;
            }
            return new Lookup(true, map.get(segment));
        }
        if (current instanceof List<?> list) {
            int index = parseIndex(segment);
            if (index < 0 || index >= list.size()) {
                return Lookup.ABSENT;
            }
            return new Lookup(true, list.get(index));
        }
        return Lookup.ABSENT;
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }

    private record Lookup(boolean found, Object value) {
        static final Lookup ABSENT = new Lookup(false, null);
    }
}
