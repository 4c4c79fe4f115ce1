/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import java.util.Collections;
import java.util.Map;

/** The operation returned and its result is about to be turned into a response. */
public final class OperationResultReady extends Checkpoint {
  public static final String RESULT_TYPE = "operation.result_type";

  /** @param resultType simple description of the returned value's type. ex "Response" or "void" */
  public static OperationResultReady create(String resultType) {
    if (resultType == null) throw new NullPointerException("resultType == null");
    return new OperationResultReady(resultType);
  }

  final String resultType;

  OperationResultReady(String resultType) {
    this.resultType = resultType;
  }

  @Override public Type type() {
    return Type.OPERATION_RESULT_READY;
  }

  public String resultType() {
    return resultType;
  }

  @Override public Map<String, String> metadata() {
    return Collections.singletonMap(RESULT_TYPE, resultType);
  }
}
