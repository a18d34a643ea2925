package com.pineparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.pineparser.ast.Node;
import com.pineparser.ast.SourceLocation;

import java.io.IOException;

/**
 * Jackson module that serializes AST nodes from their {@link Node#fields()} list rather
 * than by bean introspection, so the JSON mirrors the dump field for field.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.pineparser", "pinecone-jackson"));
        addSerializer(Node.class, new NodeSerializer());
    }

    static class NodeSerializer extends StdSerializer<Node> {

        NodeSerializer() {
            super(Node.class);
        }

        @Override
        public void serialize(Node node, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("node", node.type());

            SourceLocation loc = node.loc();
            if (loc != null && loc.isKnown()) {
                gen.writeObjectFieldStart("loc");
                gen.writeNumberField("line", loc.line());
                gen.writeNumberField("column", loc.column());
                gen.writeEndObject();
            }

            for (Node.Field field : node.fields()) {
                gen.writeFieldName(field.name());
                provider.defaultSerializeValue(field.value(), gen);
            }
            gen.writeEndObject();
        }
    }
}
