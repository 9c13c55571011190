package com.tsplate.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsplate.ast.Statement;
import com.tsplate.codegen.MappedCode;
import com.tsplate.codegen.StatementDescriber;
import com.tsplate.json.TemplateJsonDeserializer;
import com.tsplate.json.TemplateJsonException;
import com.tsplate.json.TemplateJsonException.Document;
import com.tsplate.json.TemplateJsonProvider;
import com.tsplate.json.TemplateJsonSerializer;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Writes descriptions and source maps with an {@link ObjectMapper} from
 * {@link TsplateJackson#createObjectMapper()}, and reads them back.
 */
public class JacksonTemplateJsonProvider implements TemplateJsonProvider {

    private static final TypeReference<List<Map<String, Object>>> DESCRIPTION_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final TemplateJsonSerializer serializer;
    private final TemplateJsonDeserializer deserializer;

    public JacksonTemplateJsonProvider() {
        this(TsplateJackson.createObjectMapper());
    }

    public JacksonTemplateJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public TemplateJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public TemplateJsonDeserializer getDeserializer() {
        return deserializer;
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    private static class JacksonSerializer implements TemplateJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(List<Statement> statements) throws TemplateJsonException {
            try {
                return mapper.writeValueAsString(StatementDescriber.INSTANCE.describe(statements));
            } catch (IOException e) {
                throw TemplateJsonException.writing(Document.DESCRIPTION, e);
            }
        }

        @Override
        public String serializePretty(List<Statement> statements) throws TemplateJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(StatementDescriber.INSTANCE.describe(statements));
            } catch (IOException e) {
                throw TemplateJsonException.writing(Document.DESCRIPTION, e);
            }
        }

        @Override
        public String serializeSourceMap(MappedCode mappedCode) throws TemplateJsonException {
            try {
                return mapper.writeValueAsString(mappedCode);
            } catch (IOException e) {
                throw TemplateJsonException.writing(Document.SOURCE_MAP, e);
            }
        }
    }

    private static class JacksonDeserializer implements TemplateJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public MappedCode deserializeSourceMap(String json) throws TemplateJsonException {
            try {
                return mapper.readValue(json, MappedCode.class);
            } catch (IOException e) {
                throw TemplateJsonException.reading(Document.SOURCE_MAP, e);
            }
        }

        @Override
        public List<Map<String, Object>> deserializeDescription(String json) throws TemplateJsonException {
            try {
                return mapper.readValue(json, DESCRIPTION_TYPE);
            } catch (IOException e) {
                throw TemplateJsonException.reading(Document.DESCRIPTION, e);
            }
        }
    }
}
