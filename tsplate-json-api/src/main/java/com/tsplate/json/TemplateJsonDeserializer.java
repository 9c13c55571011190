package com.tsplate.json;

import com.tsplate.codegen.MappedCode;

import java.util.List;
import java.util.Map;

/**
 * Interface for reading JSON produced by {@link TemplateJsonSerializer}.
 */
public interface TemplateJsonDeserializer {

    /**
     * Deserializes a source map document.
     *
     * @param json the JSON string to deserialize
     * @return the generated code with its mappings
     * @throws TemplateJsonException if the JSON is malformed or has the wrong shape
     */
    MappedCode deserializeSourceMap(String json) throws TemplateJsonException;

    /**
     * Deserializes a statement description array into plain maps.
     *
     * @param json the JSON string to deserialize
     * @return one map per described statement
     * @throws TemplateJsonException if the JSON is malformed or has the wrong shape
     */
    List<Map<String, Object>> deserializeDescription(String json) throws TemplateJsonException;
}
