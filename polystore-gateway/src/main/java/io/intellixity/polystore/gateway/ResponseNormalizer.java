package io.intellixity.polystore.gateway;

import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.gateway.internal.SafeMessages;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.ErrorInfo;
import io.intellixity.polystore.result.ResultEnvelope;
import io.intellixity.polystore.result.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Turns adapter results and failures into {@link ResultEnvelope}s.\n
 *
 * Failure classification:\n
 * - wrapper exceptions (completion, execution, reflection) are unwrapped\n
 * - {@link StoreException} keeps its own category\n
 * - otherwise the paradigm's {@link ErrorMappingTable} decides\n
 * - anything unmapped becomes {@code Internal} with a generic message; details go to the log only\n
 */
public final class ResponseNormalizer {
  private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

  static final String INTERNAL_MESSAGE = "Internal error";

  private final Map<Paradigm, ErrorMappingTable> tables = new ConcurrentHashMap<>();

  public void register(Paradigm paradigm, ErrorMappingTable table) {
    Objects.requireNonNull(paradigm, "paradigm");
    tables.put(paradigm, Objects.requireNonNull(table, "table"));
  }

  public ResultEnvelope success(Paradigm paradigm, String kind, Object value, long latencyMs) {
    return ResultEnvelope.success(paradigm, kind, value, latencyMs);
  }

  public ResultEnvelope failure(Paradigm paradigm, String kind, Throwable error, long latencyMs) {
    return ResultEnvelope.failure(paradigm, kind, classify(paradigm, error), latencyMs);
  }

  public ErrorInfo classify(Paradigm paradigm, Throwable error) {
    Objects.requireNonNull(error, "error");
    Throwable t = unwrap(error);
    if (t instanceof StoreException se) {
      return new ErrorInfo(se.category(), SafeMessages.sanitize(se.getMessage()), se.retryable(), se.details());
    }
    ErrorMappingTable table = (paradigm == null) ? null : tables.get(paradigm);
    Optional<ErrorMappingTable.Match> match = (table == null) ? Optional.empty() : table.classify(t);
    if (match.isPresent()) {
      ErrorMappingTable.Match m = match.get();
      if (log.isDebugEnabled()) {
        log.debug("polystore.normalize paradigm={} rule={} category={} type={}",
            paradigm.id(), m.rule(), m.category().wireName(), m.source().getClass().getName());
      }
      return new ErrorInfo(m.category(), SafeMessages.sanitize(m.source().getMessage()), m.retryable(), Map.of());
    }
    log.error("polystore.normalize unmapped paradigm={} type={}",
        (paradigm == null) ? null : paradigm.id(), t.getClass().getName(), t);
    return new ErrorInfo(ErrorCategory.INTERNAL, INTERNAL_MESSAGE, false, Map.of());
  }

  static Throwable unwrap(Throwable t) {
    Throwable cur = t;
    for (int i = 0; i < 16; i++) {
      Throwable next = null;
      if (cur instanceof CompletionException || cur instanceof ExecutionException) next = cur.getCause();
      else if (cur instanceof InvocationTargetException ite) next = ite.getTargetException();
      if (next == null || next == cur) return cur;
      cur = next;
    }
    return cur;
  }
}
