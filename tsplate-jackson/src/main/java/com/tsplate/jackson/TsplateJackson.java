package com.tsplate.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for template output.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = TsplateJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(compiledTemplate);
 * MappedCode surface = mapper.readValue(sourceMapJson, MappedCode.class);
 * </pre>
 */
public final class TsplateJackson {

    private TsplateJackson() {
    }

    /**
     * Creates a new ObjectMapper configured for template serialization.
     *
     * The returned mapper:
     * - Writes statements as their plain description
     * - Omits null properties
     * - Reads source maps back into records through their canonical constructors
     * - Ignores unknown properties when reading
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new TemplateModule());

        return mapper;
    }
}
