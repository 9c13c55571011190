package com.tsplate.jackson;

import com.tsplate.Parser;
import com.tsplate.TemplateCompiler;
import com.tsplate.ast.Statement;
import com.tsplate.codegen.MapItem;
import com.tsplate.codegen.MappedCode;
import com.tsplate.codegen.StatementDescriber;
import com.tsplate.json.TemplateJsonException;
import com.tsplate.json.TemplateJsonException.Document;
import com.tsplate.json.TemplateJsonProvider;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonTemplateJsonProviderTest {

    @Test
    void testServiceLoaderDiscovery() {
        assertInstanceOf(JacksonTemplateJsonProvider.class, TemplateJsonProvider.getProvider());
    }

    @Test
    void testSerializeDescription() throws Exception {
        TemplateJsonProvider provider = new JacksonTemplateJsonProvider();
        List<Statement> statements = Parser.parse("Hi {{ name }}@end", "test.tsplate");

        String json = provider.getSerializer().serialize(statements);

        assertEquals("[{\"type\":\"TextStatement\",\"value\":\"Hi \"},"
            + "{\"type\":\"InlineEscapedStatement\",\"expression\":\"name\"}]", json);
    }

    @Test
    void testDescriptionRoundTrip() throws Exception {
        TemplateJsonProvider provider = new JacksonTemplateJsonProvider();
        List<Statement> statements = Parser.parse(
            "@component(Card, props)@slot(row, item)@if(item.ok){{ item.name }}@else -@end@end@end",
            "test.tsplate");

        String json = provider.getSerializer().serializePretty(statements);
        assertTrue(json.contains("\"ElseStatement\""));
        List<Map<String, Object>> restored = provider.getDeserializer().deserializeDescription(json);

        assertEquals(StatementDescriber.INSTANCE.describe(statements), restored);
    }

    @Test
    void testSourceMapRoundTrip() throws Exception {
        TemplateJsonProvider provider = TemplateJsonProvider.getProvider();
        MappedCode typeSurface = new TemplateCompiler().compile("Hi {{ name }}", "test.tsplate").typeSurface();

        String json = provider.getSerializer().serializeSourceMap(typeSurface);

        assertEquals("{\"code\":\"String(name)\",\"mappings\":"
            + "[{\"sourceOffset\":6,\"generatedOffset\":7,\"length\":4}]}", json);
        assertEquals(typeSurface, provider.getDeserializer().deserializeSourceMap(json));
    }

    @Test
    void testSourceMapIgnoresUnknownProperties() throws Exception {
        String json = """
            {
              "version": 3,
              "code": "String(x)",
              "mappings": [
                { "sourceOffset": 3, "generatedOffset": 7, "length": 1 }
              ]
            }
            """;

        MappedCode mapped = new JacksonTemplateJsonProvider().getDeserializer().deserializeSourceMap(json);

        assertEquals(new MappedCode("String(x)", List.of(new MapItem(3, 7, 1))), mapped);
    }

    @Test
    void testMalformedSourceMap() {
        JacksonTemplateJsonProvider provider = new JacksonTemplateJsonProvider();

        TemplateJsonException e = assertThrows(TemplateJsonException.class,
            () -> provider.getDeserializer().deserializeSourceMap("not json"));

        assertEquals(Document.SOURCE_MAP, e.getDocument());
        assertTrue(e.isReading());
        assertTrue(e.getMessage().startsWith("Failed to read source map"));
        assertNotNull(e.getCause());
    }

    @Test
    void testDescriptionMustBeAnArray() {
        JacksonTemplateJsonProvider provider = new JacksonTemplateJsonProvider();

        TemplateJsonException e = assertThrows(TemplateJsonException.class,
            () -> provider.getDeserializer().deserializeDescription("{\"type\":\"TextStatement\"}"));

        assertEquals(Document.DESCRIPTION, e.getDocument());
        assertTrue(e.isReading());
    }
}
