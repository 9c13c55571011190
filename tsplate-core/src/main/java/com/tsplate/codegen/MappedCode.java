package com.tsplate.codegen;

import java.util.List;
import java.util.OptionalInt;

/**
 * Flattened generated code together with its source map.
 */
public record MappedCode(
    String code,
    List<MapItem> mappings
) {
    public MappedCode {
        mappings = List.copyOf(mappings);
    }

    /**
     * Finds the template offset that produced the character at {@code generatedOffset}.
     * Nested mappings are appended after their parents, so the last match is the
     * innermost one.
     */
    public OptionalInt sourceOffsetAt(int generatedOffset) {
        OptionalInt result = OptionalInt.empty();
        for (MapItem item : mappings) {
            if (item.containsGenerated(generatedOffset)) {
                result = OptionalInt.of(item.sourceOffset() + generatedOffset - item.generatedOffset());
            }
        }
        return result;
    }

    /**
     * The generated text covered by {@code item}.
     */
    public String generatedText(MapItem item) {
        return code.substring(item.generatedOffset(), item.generatedOffset() + item.length());
    }
}
