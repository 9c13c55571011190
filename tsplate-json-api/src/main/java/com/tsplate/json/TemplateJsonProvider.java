package com.tsplate.json;

import java.util.ServiceLoader;

/**
 * Writes and reads the JSON forms of a compiled template: the statement description
 * and the source map of the TypeScript surface.
 *
 * <p>Implementations register themselves in
 * {@code META-INF/services/com.tsplate.json.TemplateJsonProvider}; tsplate-jackson
 * ships one.</p>
 *
 * <pre>{@code
 * TemplateJsonProvider provider = TemplateJsonProvider.getProvider();
 * String json = provider.getSerializer().serializeSourceMap(compiled.typeSurface());
 * MappedCode restored = provider.getDeserializer().deserializeSourceMap(json);
 * }</pre>
 */
public interface TemplateJsonProvider {

    TemplateJsonSerializer getSerializer();

    TemplateJsonDeserializer getDeserializer();

    /**
     * Loads the first provider registered on the classpath.
     *
     * @throws IllegalStateException if none is registered
     */
    static TemplateJsonProvider getProvider() {
        return ServiceLoader.load(TemplateJsonProvider.class)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No TemplateJsonProvider registered; add tsplate-jackson to the classpath"));
    }
}
