package com.tsplate;

import java.util.Objects;

/**
 * Settings for the generated renderer body.
 *
 * @param lineMarkers       emit {@code $line = N} before statements so render-time errors
 *                          can be attributed to a template line
 * @param runtimeIdentifier name of the runtime object providing {@code safeString} and
 *                          {@code renderComponent}
 */
public record CompilerOptions(
    boolean lineMarkers,
    String runtimeIdentifier
) {
    public static final String DEFAULT_RUNTIME_IDENTIFIER = "$api";

    public CompilerOptions {
        Objects.requireNonNull(runtimeIdentifier, "runtimeIdentifier");
        if (runtimeIdentifier.isBlank()) {
            throw new IllegalArgumentException("runtimeIdentifier must not be blank");
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(true, DEFAULT_RUNTIME_IDENTIFIER);
    }

    public CompilerOptions withLineMarkers(boolean lineMarkers) {
        return new CompilerOptions(lineMarkers, runtimeIdentifier);
    }

    public CompilerOptions withRuntimeIdentifier(String runtimeIdentifier) {
        return new CompilerOptions(lineMarkers, runtimeIdentifier);
    }
}
