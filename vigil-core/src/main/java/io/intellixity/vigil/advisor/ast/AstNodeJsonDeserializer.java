package io.intellixity.vigil.advisor.ast;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link AstNode}. */
public final class AstNodeJsonDeserializer extends JsonDeserializer<AstNode> {
  @Override
  public AstNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parseNode(root, codec);
  }

  private static AstNode parseNode(JsonNode node, ObjectCodec codec) throws IOException {
    if (!node.isObject()) throw new InvalidAstException("AST node JSON must be an object, got " + node.getNodeType());

    JsonNode nameNode = node.get("name");
    String name = (nameNode == null || nameNode.isNull()) ? "" : nameNode.asText();

    Object constant = null;
    JsonNode c = node.get("constant");
    if (c != null && !c.isNull()) constant = codec.treeToValue(c, Object.class);

    List<AstNode> children = new ArrayList<>();
    JsonNode ch = node.get("children");
    if (ch != null && ch.isArray()) {
      for (JsonNode x : ch) children.add(parseNode(x, codec));
    }

    Map<String, AstNode> named = new LinkedHashMap<>();
    JsonNode nc = node.get("named_children");
    if (nc != null && nc.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = nc.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        named.put(e.getKey(), parseNode(e.getValue(), codec));
      }
    }
    return new AstNode(name, constant, children, named);
  }
}
