/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

/** The response left the pipeline. Anything still open must be closed now. */
public final class Teardown extends Checkpoint {
  public static final Teardown INSTANCE = new Teardown();

  @Override public Type type() {
    return Type.TEARDOWN;
  }

  Teardown() {
  }
}
