/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.Span;
import brave.internal.Nullable;
import brave.propagation.CurrentTraceContext.Scope;
import brave.propagation.TraceContext;

/** The one operation span a {@link ScopedOperationTracer} may have in flight. */
final class ScopedTraceState {
  final String displayName;
  final Span span;
  @Nullable final TraceContext previous;
  final Scope scope;
  final long startTimestamp;
  boolean finished;

  ScopedTraceState(String displayName, Span span, @Nullable TraceContext previous, Scope scope,
    long startTimestamp) {
    this.displayName = displayName;
    this.span = span;
    this.previous = previous;
    this.scope = scope;
    this.startTimestamp = startTimestamp;
  }

  @Override public String toString() {
    return "ScopedTraceState{" + displayName + ", finished=" + finished + "}";
  }
}
