package io.intellixity.polystore.op;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.polystore.op.ParamSpec.optional;
import static io.intellixity.polystore.op.ParamSpec.required;
import static org.junit.jupiter.api.Assertions.*;

final class OperationSchemaTest {
  private static final OperationSchema SCHEMA = OperationSchema.builder(Paradigm.VECTOR)
      .kind("index", required("id", ParamType.STRING), optional("embedding", ParamType.VECTOR),
          optional("metadata", ParamType.MAP), optional("text", ParamType.STRING))
      .kind("query", required("embeddingOrText", ParamType.VECTOR_OR_TEXT), required("topK", ParamType.INTEGER))
      .kind("count")
      .build();

  @Test
  void acceptsWellFormedOperations() {
    SCHEMA.validate(Operation.of(Paradigm.VECTOR, "index", Map.of("id", "d1", "embedding", List.of(1, 2.5))));
    SCHEMA.validate(Operation.of(Paradigm.VECTOR, "query", Map.of("embeddingOrText", "shoes", "topK", 5)));
    SCHEMA.validate(Operation.of(Paradigm.VECTOR, "query", Map.of("embeddingOrText", new float[]{1f}, "topK", 5.0)));
    SCHEMA.validate(Operation.of(Paradigm.VECTOR, "count"));
  }

  @Test
  void nullOptionalIsTreatedAsAbsent() {
    Map<String, Object> p = new HashMap<>();
    p.put("id", "d1");
    p.put("metadata", null);
    SCHEMA.validate(Operation.of(Paradigm.VECTOR, "index", p));
  }

  @Test
  void rejectsUnknownKind() {
    var e = assertThrows(OperationValidationException.class,
        () -> SCHEMA.validate(Operation.of(Paradigm.VECTOR, "upsert")));
    assertTrue(e.getMessage().contains("upsert"));
  }

  @Test
  void rejectsUnknownParam_missingRequired_andWrongShape() {
    assertThrows(OperationValidationException.class,
        () -> SCHEMA.validate(Operation.of(Paradigm.VECTOR, "count", Map.of("collection", "x"))));
    assertThrows(OperationValidationException.class,
        () -> SCHEMA.validate(Operation.of(Paradigm.VECTOR, "query", Map.of("embeddingOrText", "x"))));
    assertThrows(OperationValidationException.class,
        () -> SCHEMA.validate(Operation.of(Paradigm.VECTOR, "query", Map.of("embeddingOrText", "x", "topK", 2.5))));
    assertThrows(OperationValidationException.class,
        () -> SCHEMA.validate(Operation.of(Paradigm.VECTOR, "query", Map.of("embeddingOrText", List.of("a"), "topK", 1))));
    assertThrows(OperationValidationException.class,
        () -> SCHEMA.validate(Operation.of(Paradigm.VECTOR, "query", Map.of("embeddingOrText", " ", "topK", 1))));
  }

  @Test
  void rejectsOperationOfAnotherParadigm() {
    assertThrows(OperationValidationException.class,
        () -> SCHEMA.validate(Operation.of(Paradigm.GRAPH, "count")));
  }

  @Test
  void validationErrorsAreInvalidInput() {
    var e = assertThrows(OperationValidationException.class,
        () -> SCHEMA.validate(Operation.of(Paradigm.VECTOR, "nope")));
    assertEquals(io.intellixity.polystore.result.ErrorCategory.INVALID_INPUT, e.category());
    assertFalse(e.retryable());
  }

  @Test
  void bytesAcceptRawOrBase64() {
    OperationSchema s = OperationSchema.builder(Paradigm.OBJECT)
        .kind("put", required("key", ParamType.STRING), required("data", ParamType.BYTES))
        .build();
    s.validate(Operation.of(Paradigm.OBJECT, "put", Map.of("key", "k", "data", new byte[0])));
    s.validate(Operation.of(Paradigm.OBJECT, "put", Map.of("key", "k", "data", "aGVsbG8=")));
    assertThrows(OperationValidationException.class,
        () -> s.validate(Operation.of(Paradigm.OBJECT, "put", Map.of("key", "k", "data", "not base64!"))));
  }
}
