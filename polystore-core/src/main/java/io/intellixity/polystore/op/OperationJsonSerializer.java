package io.intellixity.polystore.op;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link Operation}. */
public final class OperationJsonSerializer extends JsonSerializer<Operation> {
  @Override
  public void serialize(Operation op, JsonGenerator gen, SerializerProvider serializers) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("paradigm", op.paradigm().id());
    gen.writeStringField("kind", op.kind());
    gen.writeFieldName("parameters");
    serializers.defaultSerializeValue(op.parameters(), gen);
    gen.writeEndObject();
  }
}
