/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.Clock;
import brave.Span;
import brave.Tracer;
import brave.internal.Nullable;
import brave.propagation.CurrentTraceContext;
import brave.propagation.CurrentTraceContext.Scope;
import brave.propagation.TraceContext;

/**
 * The per-request view of the tracing context: the transaction (root span of the request) and the
 * single current-span slot that other instrumentation parents new spans under.
 *
 * <p>Every {@link #makeCurrent(Span)} must be paired with exactly one {@link Scope#close()}, in
 * LIFO order. Closing restores precisely the context that was current when the scope opened.
 */
public final class TracingContextHolder {
  /** Tag holding the human readable description of a span. */
  public static final String DESCRIPTION = "description";

  final Tracer tracer;
  final CurrentTraceContext currentTraceContext;
  final Clock clock;
  @Nullable final Span transaction;

  TracingContextHolder(Tracer tracer, CurrentTraceContext currentTraceContext, Clock clock,
    @Nullable Span transaction) {
    this.tracer = tracer;
    this.currentTraceContext = currentTraceContext;
    this.clock = clock;
    this.transaction = transaction;
  }

  /** Returns the root span of this request, or null if the request is not being traced. */
  @Nullable public Span activeTransaction() {
    return transaction;
  }

  /** Returns the span new instrumentation would attach to, or null if there is none. */
  @Nullable public Span currentSpan() {
    return tracer.currentSpan();
  }

  /** Snapshot of the current-span slot, as saved before replacing it. */
  @Nullable public TraceContext currentContext() {
    return currentTraceContext.get();
  }

  /** Makes the span current until the returned scope is closed. */
  public Scope makeCurrent(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    return currentTraceContext.newScope(span.context());
  }

  /** Starts a child of the transaction. Callers own finishing it. */
  public Span startChild(Span transaction, String name, String description, long timestamp) {
    return tracer.newChild(transaction.context())
      .name(name)
      .tag(DESCRIPTION, description)
      .start(timestamp);
  }

  public long currentTimeMicroseconds() {
    return clock.currentTimeMicroseconds();
  }

  @Override public String toString() {
    return "TracingContextHolder{transaction=" + transaction + "}";
  }
}
