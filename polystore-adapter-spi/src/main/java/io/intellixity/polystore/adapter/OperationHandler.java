package io.intellixity.polystore.adapter;

import io.intellixity.polystore.op.Params;

/** Handles one operation kind inside an {@link AbstractStoreAdapter}. */
@FunctionalInterface
public interface OperationHandler {
  Object handle(Params params) throws Exception;
}
