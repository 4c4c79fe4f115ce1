/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.internal.Nullable;
import java.util.Collections;
import java.util.Map;

/**
 * The pipeline resolved which operation handles the request and is about to invoke it. The
 * reference is null when the integration could not normalize the handler, which tracers treat the
 * same as an operation without a declared intent.
 */
public final class PreDispatch extends Checkpoint {
  public static final String OPERATION = "operation.ref";

  public static PreDispatch create(@Nullable OperationRef operation) {
    return new PreDispatch(operation);
  }

  @Nullable final OperationRef operation;

  PreDispatch(@Nullable OperationRef operation) {
    this.operation = operation;
  }

  @Override public Type type() {
    return Type.PRE_DISPATCH;
  }

  @Nullable public OperationRef operation() {
    return operation;
  }

  @Override public Map<String, String> metadata() {
    if (operation == null) return Collections.emptyMap();
    return Collections.singletonMap(OPERATION, operation.displayName());
  }
}
