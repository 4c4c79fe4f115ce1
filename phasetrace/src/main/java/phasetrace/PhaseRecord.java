/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.Span;
import brave.internal.Nullable;
import brave.propagation.CurrentTraceContext.Scope;
import brave.propagation.TraceContext;

/** An open phase: its span and what to put back in the current-span slot when it closes. */
final class PhaseRecord {
  final String name;
  final Span span;
  @Nullable final TraceContext previous;
  final Scope scope;
  final long startTimestamp;
  final int executionOrder;

  PhaseRecord(String name, Span span, @Nullable TraceContext previous, Scope scope,
    long startTimestamp, int executionOrder) {
    this.name = name;
    this.span = span;
    this.previous = previous;
    this.scope = scope;
    this.startTimestamp = startTimestamp;
    this.executionOrder = executionOrder;
  }

  @Override public String toString() {
    return "PhaseRecord{name=" + name + ", order=" + executionOrder + ", span=" + span + "}";
  }
}
