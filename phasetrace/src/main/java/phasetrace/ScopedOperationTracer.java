/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.Span;
import brave.internal.Nullable;
import brave.propagation.TraceContext;
import java.util.Collections;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Measures exactly one operation per dispatch, when that operation declared a {@link TraceIntent}.
 * The span opens at pre-dispatch and closes at the first terminal checkpoint that follows, so it
 * covers the operation and not the pipeline around it.
 *
 * <p>Like {@link PhaseSpanTracker}, the operation span is made current so that queries issued by
 * the operation attach to it. Instances hold the state of one request and are not thread-safe.
 *
 * <pre>{@code
 * POST /books (500ms)
 * ├── pipeline.phase: Pipeline Phase: request (50ms)
 * ├── operation.traced: BookResource::addBook (24ms)
 * │   └── insert books (2ms)
 * └── pipeline.phase: Pipeline Phase: response (100ms)
 * }</pre>
 */
public final class ScopedOperationTracer {
  static final Logger LOG = Logger.getLogger(ScopedOperationTracer.class.getName());

  public enum State {
    /** No operation span exists for the current dispatch. */
    IDLE,
    ACTIVE,
    /** The operation span was finished; further exits are ignored until the next enter. */
    FINISHED
  }

  public static final String DEFAULT_OPERATION_NAME = "operation.traced";

  public static final String OPERATION = "operation.name";
  public static final String START_TIME = "operation.start_time";
  public static final String END_TIME = "operation.end_time";
  public static final String DURATION = "operation.duration_ms";
  public static final String END_TRIGGER = "operation.end_trigger";
  public static final String EXECUTION_STATUS = "operation.execution_status";

  public static final String TRIGGER_RESULT = "result";
  public static final String TRIGGER_RESPONSE = "response";
  public static final String TRIGGER_ERROR = "error";
  /** The operation was still open when a new one started, or when the request ended. */
  public static final String TRIGGER_ABANDONED = "abandoned";

  public static final String STATUS_SUCCESS = "success";
  public static final String STATUS_ERROR = "error";

  final TracingContextHolder holder;
  final TraceIntentRegistry registry;
  @Nullable ScopedTraceState entry;

  ScopedOperationTracer(TracingContextHolder holder, TraceIntentRegistry registry) {
    this.holder = holder;
    this.registry = registry;
  }

  public State state() {
    if (entry == null) return State.IDLE;
    return entry.finished ? State.FINISHED : State.ACTIVE;
  }

  /**
   * Opens an operation span if the operation declared an intent. Whatever the previous operation
   * left behind is discarded first.
   */
  public void enter(PreDispatch checkpoint) {
    reset();

    OperationRef operation = checkpoint.operation();
    TraceIntent intent = registry.resolve(operation);
    if (intent == null) return;
    Span transaction = holder.activeTransaction();
    if (transaction == null) {
      log("no active transaction; not tracing operation {0}", operation);
      return;
    }

    String displayName = operation.displayName();
    String name = intent.operationName() != null ? intent.operationName() : DEFAULT_OPERATION_NAME;
    String description = intent.description() != null ? intent.description() : displayName;

    TraceContext previous = holder.currentContext();
    long timestamp = holder.currentTimeMicroseconds();
    Span span = holder.startChild(transaction, name, description, timestamp);
    span.tag(OPERATION, displayName);
    span.tag(START_TIME, String.valueOf(timestamp));
    SpanTags.tagAll(span, intent.tags());

    entry = new ScopedTraceState(displayName, span, previous, holder.makeCurrent(span), timestamp);
    log("started traced operation {0}", displayName);
  }

  /**
   * Closes the operation span on the first terminal checkpoint after {@link #enter}: an
   * operation result, a response or an error. Anything else, or a second exit, is ignored.
   */
  public void exit(Checkpoint checkpoint) {
    exit(checkpoint, holder.currentTimeMicroseconds());
  }

  /** Like {@link #exit(Checkpoint)}, for a checkpoint reached at this time. */
  public void exit(Checkpoint checkpoint, long timestamp) {
    String trigger;
    switch (checkpoint.type()) {
      case OPERATION_RESULT_READY:
        trigger = TRIGGER_RESULT;
        break;
      case RESPONSE_READY:
        trigger = TRIGGER_RESPONSE;
        break;
      case ERROR_RAISED:
        trigger = TRIGGER_ERROR;
        break;
      default:
        return;
    }
    if (entry == null || entry.finished) return;
    finish(entry, trigger, checkpoint.metadata(),
      checkpoint instanceof ErrorRaised ? (ErrorRaised) checkpoint : null, timestamp);
  }

  /** Returns to idle, finishing an operation span that no exit closed. */
  public void reset() {
    if (entry != null && !entry.finished) {
      finish(entry, TRIGGER_ABANDONED, Collections.emptyMap(), null,
        holder.currentTimeMicroseconds());
    }
    entry = null;
  }

  void finish(ScopedTraceState entry, String trigger, Map<String, String> exitMetadata,
    @Nullable ErrorRaised error, long timestamp) {
    long duration = timestamp - entry.startTimestamp;
    Span span = entry.span;
    span.tag(EXECUTION_STATUS, error != null ? STATUS_ERROR : STATUS_SUCCESS);
    span.tag(END_TIME, String.valueOf(timestamp));
    span.tag(DURATION, SpanTags.millis(duration));
    span.tag(END_TRIGGER, trigger);
    SpanTags.tagAll(span, exitMetadata);
    if (error != null) {
      if (error.error() != null) {
        span.error(error.error());
      } else {
        span.tag("error", error.errorKind());
      }
    }
    span.finish(timestamp);
    entry.finished = true;

    entry.scope.close();
    TraceContext current = holder.currentContext();
    if (current == null ? entry.previous != null : !current.equals(entry.previous)) {
      log("context after closing operation {0} is {1}", entry.displayName, current);
    }
    log("traced operation {0} ended by {1}", entry.displayName, trigger);
  }

  static void log(String msg, Object zero) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LOG.log(Level.FINE, msg, zero);
  }

  static void log(String msg, Object zero, @Nullable Object one) {
    if (!LOG.isLoggable(Level.FINE)) return;
    LOG.log(Level.FINE, msg, new Object[] {zero, one});
  }

  @Override public String toString() {
    return "ScopedOperationTracer{" + state() + "}";
  }
}
