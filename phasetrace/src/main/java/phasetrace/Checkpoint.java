/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import java.util.Collections;
import java.util.Map;

/**
 * A named point in the request pipeline. Checkpoints arrive in a strict order per request and are
 * read-only to tracers: {@link #metadata()} is what gets tagged onto phase and operation spans.
 */
public abstract class Checkpoint {
  public enum Type {
    REQUEST_START("request"),
    PRE_DISPATCH("dispatch"),
    OPERATION_RESULT_READY("view"),
    RESPONSE_READY("response"),
    ERROR_RAISED("exception"),
    TEARDOWN("teardown");

    final String phaseName;

    Type(String phaseName) {
      this.phaseName = phaseName;
    }

    /** Name of the phase span opened while this checkpoint dispatches. ex "request" */
    public String phaseName() {
      return phaseName;
    }
  }

  public abstract Type type();

  /** Tags describing this checkpoint. Returns an empty map when there is nothing to add. */
  public Map<String, String> metadata() {
    return Collections.emptyMap();
  }

  @Override public String toString() {
    return type().name() + metadata();
  }

  Checkpoint() {
  }
}
