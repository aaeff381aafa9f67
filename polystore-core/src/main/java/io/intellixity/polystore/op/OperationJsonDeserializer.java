package io.intellixity.polystore.op;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical JSON deserializer for {@link Operation}.\n
 *
 * Accepts {@code {"paradigm": "...", "kind": "...", "parameters": {...}}}; {@code params} is accepted as an alias.
 * Paradigm names are case-insensitive. Byte parameters travel as base64 strings.\n
 */
public final class OperationJsonDeserializer extends JsonDeserializer<Operation> {
  @Override
  public Operation deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new OperationValidationException("Operation JSON must be an object");

    Paradigm paradigm = Paradigm.parse(textOrNull(root.get("paradigm")));
    String kind = textOrNull(root.get("kind"));

    JsonNode params = root.get("parameters");
    if (params == null || params.isNull()) params = root.get("params");

    Map<String, Object> m = new LinkedHashMap<>();
    if (params != null && !params.isNull()) {
      if (!params.isObject()) throw new OperationValidationException("parameters must be an object");
      @SuppressWarnings("unchecked")
      Map<String, Object> decoded = codec.treeToValue(params, Map.class);
      m.putAll(decoded);
    }
    return new Operation(paradigm, kind, m);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
