package com.tsplate.json;

import com.tsplate.ast.Statement;
import com.tsplate.codegen.MappedCode;

import java.util.List;

/**
 * Interface for serializing parsed templates and generated code to JSON.
 */
public interface TemplateJsonSerializer {

    /**
     * Serializes the plain description of the statements (see
     * {@link com.tsplate.codegen.StatementDescriber}) to a JSON array.
     *
     * @param statements the statements to serialize
     * @return the JSON representation
     * @throws TemplateJsonException if writing fails
     */
    String serialize(List<Statement> statements) throws TemplateJsonException;

    /**
     * Serializes the statements to a pretty-printed JSON array.
     *
     * @param statements the statements to serialize
     * @return the pretty-printed JSON representation
     * @throws TemplateJsonException if writing fails
     */
    String serializePretty(List<Statement> statements) throws TemplateJsonException;

    /**
     * Serializes generated code and its source map as
     * {@code {"code": ..., "mappings": [{"sourceOffset", "generatedOffset", "length"}]}}.
     *
     * @param mappedCode the generated code
     * @return the JSON representation
     * @throws TemplateJsonException if writing fails
     */
    String serializeSourceMap(MappedCode mappedCode) throws TemplateJsonException;
}
