package io.intellixity.vigil.advisor.ast;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Map;

/** Canonical JSON serializer for {@link AstNode}. */
public final class AstNodeJsonSerializer extends JsonSerializer<AstNode> {
  @Override
  public void serialize(AstNode n, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (n == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    if (!n.name().isEmpty()) g.writeStringField("name", n.name());
    if (n.constant() != null) g.writeObjectField("constant", n.constant());

    if (!n.children().isEmpty()) {
      g.writeArrayFieldStart("children");
      for (AstNode c : n.children()) serialize(c, g, serializers);
      g.writeEndArray();
    }

    if (!n.namedChildren().isEmpty()) {
      g.writeObjectFieldStart("named_children");
      for (Map.Entry<String, AstNode> e : n.namedChildren().entrySet()) {
        g.writeFieldName(e.getKey());
        serialize(e.getValue(), g, serializers);
      }
      g.writeEndObject();
    }
    g.writeEndObject();
  }
}
