/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.Clock;
import brave.Span;
import brave.Tracing;
import brave.internal.Nullable;

/**
 * Configuration shared by every request: how to reach the tracer, what each phase is expected to
 * cost, and which operations declared a {@link TraceIntent}.
 *
 * <p>Per-request state is never kept here. Integrations call {@link #newRequestTracer(Span)} once
 * per request and discard the result when the request ends.
 */
public final class PipelineTracing {
  public static PipelineTracing create(Tracing tracing) {
    return newBuilder(tracing).build();
  }

  public static Builder newBuilder(Tracing tracing) {
    return new Builder(tracing);
  }

  public Tracing tracing() {
    return tracing;
  }

  public PhaseThresholds phaseThresholds() {
    return phaseThresholds;
  }

  public TraceIntentRegistry intentRegistry() {
    return intentRegistry;
  }

  /** Null means timestamps come from {@link Tracing#clock(brave.propagation.TraceContext)}. */
  @Nullable public Clock clock() {
    return clock;
  }

  /**
   * Returns the tracing view of one request.
   *
   * @param transaction the request's root span, or null when the request isn't traced
   */
  public TracingContextHolder newContextHolder(@Nullable Span transaction) {
    Clock clock = this.clock;
    if (clock == null) {
      clock = transaction != null
        ? tracing.clock(transaction.context())
        : () -> System.currentTimeMillis() * 1000L;
    }
    return new TracingContextHolder(tracing.tracer(), tracing.currentTraceContext(), clock,
      transaction);
  }

  /** Returns fresh, empty tracers for one request. */
  public RequestTracer newRequestTracer(@Nullable Span transaction) {
    TracingContextHolder holder = newContextHolder(transaction);
    return new RequestTracer(
      new PhaseSpanTracker(holder, phaseThresholds),
      new ScopedOperationTracer(holder, intentRegistry)
    );
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  final Tracing tracing;
  final PhaseThresholds phaseThresholds;
  final TraceIntentRegistry intentRegistry;
  @Nullable final Clock clock;

  PipelineTracing(Builder builder) {
    this.tracing = builder.tracing;
    this.phaseThresholds = builder.phaseThresholds;
    this.intentRegistry = builder.intentRegistry;
    this.clock = builder.clock;
  }

  public static final class Builder {
    Tracing tracing;
    PhaseThresholds phaseThresholds;
    TraceIntentRegistry intentRegistry;
    Clock clock;

    Builder(Tracing tracing) {
      if (tracing == null) throw new NullPointerException("tracing == null");
      this.tracing = tracing;
      this.phaseThresholds = PhaseThresholds.DEFAULT;
      this.intentRegistry = TraceIntentRegistry.EMPTY;
    }

    Builder(PipelineTracing source) {
      this.tracing = source.tracing;
      this.phaseThresholds = source.phaseThresholds;
      this.intentRegistry = source.intentRegistry;
      this.clock = source.clock;
    }

    public Builder tracing(Tracing tracing) {
      if (tracing == null) throw new NullPointerException("tracing == null");
      this.tracing = tracing;
      return this;
    }

    /** Defaults to {@link PhaseThresholds#DEFAULT}. */
    public Builder phaseThresholds(PhaseThresholds phaseThresholds) {
      if (phaseThresholds == null) throw new NullPointerException("phaseThresholds == null");
      this.phaseThresholds = phaseThresholds;
      return this;
    }

    /** Defaults to {@link TraceIntentRegistry#EMPTY}, which traces no operations. */
    public Builder intentRegistry(TraceIntentRegistry intentRegistry) {
      if (intentRegistry == null) throw new NullPointerException("intentRegistry == null");
      this.intentRegistry = intentRegistry;
      return this;
    }

    /**
     * Overrides the clock used to time phases and operations. Mainly for tests, as the default
     * clock is coherent with the spans of the same trace.
     */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    public PipelineTracing build() {
      return new PipelineTracing(this);
    }
  }
}
