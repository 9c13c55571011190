package com.tsplate.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.tsplate.CompiledTemplate;
import com.tsplate.ast.Expression;
import com.tsplate.ast.Statement;
import com.tsplate.codegen.MapItem;
import com.tsplate.codegen.MappedCode;
import com.tsplate.codegen.StatementDescriber;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Jackson module for the template compiler's types.
 *
 * This module handles:
 * - Statements, written as their plain description ({@code @end} becomes null)
 * - Expressions, written as their raw text
 * - Stable property order for source maps and compiled templates
 */
public class TemplateModule extends SimpleModule {

    public TemplateModule() {
        super("TemplateModule", new Version(1, 0, 0, null, "com.tsplate", "tsplate-jackson"));

        addSerializer(Statement.class, new StatementSerializer());
        addSerializer(Expression.class, new ExpressionSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(MapItem.class, MapItemMixin.class);
        context.setMixInAnnotations(MappedCode.class, MappedCodeMixin.class);
        context.setMixInAnnotations(CompiledTemplate.class, CompiledTemplateMixin.class);
    }

    // ==================== Mixins ====================

    @JsonPropertyOrder({"sourceOffset", "generatedOffset", "length"})
    private abstract static class MapItemMixin {
    }

    @JsonPropertyOrder({"code", "mappings"})
    private abstract static class MappedCodeMixin {
    }

    // The statements are already reflected in the generated outputs
    @JsonPropertyOrder({"filePath", "renderBody", "typeSurface", "paramsDeclaration", "slotsDeclaration", "importPaths"})
    private abstract static class CompiledTemplateMixin {
        @JsonIgnore
        abstract List<Statement> statements();
    }

    // ==================== Serializers ====================

    private static class StatementSerializer extends StdSerializer<Statement> {
        StatementSerializer() {
            super(Statement.class);
        }

        @Override
        public void serialize(Statement value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            Map<String, Object> description = StatementDescriber.INSTANCE.describe(value);
            if (description == null) {
                gen.writeNull();
            } else {
                provider.defaultSerializeValue(description, gen);
            }
        }
    }

    private static class ExpressionSerializer extends StdSerializer<Expression> {
        ExpressionSerializer() {
            super(Expression.class);
        }

        @Override
        public void serialize(Expression value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.rawText());
        }
    }
}
