/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.Span;
import brave.internal.Nullable;
import brave.propagation.TraceContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens a span for each named pipeline phase and makes it current, so that spans created by other
 * instrumentation during the phase (queries, cache calls, rendering) become its children.
 *
 * <p>Instances hold the state of one request and are not thread-safe. All operations degrade to
 * no-ops when their preconditions are not met: this never throws at the pipeline.
 *
 * <p>Example hierarchy:
 * <pre>{@code
 * GET /books (120ms)
 * ├── pipeline.phase: Pipeline Phase: request (30ms)
 * │   └── select books.users (12ms)
 * ├── pipeline.phase: Pipeline Phase: view (60ms)
 * └── pipeline.phase: Pipeline Phase: response (25ms)
 * }</pre>
 */
public final class PhaseSpanTracker {
  static final Logger LOG = Logger.getLogger(PhaseSpanTracker.class.getName());

  public static final String OPERATION_NAME = "pipeline.phase";
  public static final String PHASE_NAME = "phase.name";
  public static final String EXECUTION_ORDER = "phase.execution_order";
  public static final String EXECUTION_ORDER_END = "phase.execution_order_end";
  public static final String START_TIME = "phase.start_time";
  public static final String END_TIME = "phase.end_time";
  public static final String DURATION = "phase.duration_ms";
  public static final String PERFORMANCE = "phase.performance";
  public static final String STATUS = "phase.status";

  public static final String STATUS_SUCCESS = "success";
  public static final String STATUS_FORCE_COMPLETED = "force_completed";

  final TracingContextHolder holder;
  final PhaseThresholds thresholds;

  // insertion order is start order, so the last entry is the innermost open phase
  final Map<String, PhaseRecord> openPhases = new LinkedHashMap<>();
  int executionOrder, phaseCount;
  boolean finalized;
  long requestStartTimestamp;
  @Nullable ResponseReady response;

  PhaseSpanTracker(TracingContextHolder holder, PhaseThresholds thresholds) {
    this.holder = holder;
    this.thresholds = thresholds;
  }

  /** Called as the pipeline begins dispatching a checkpoint. */
  public void onCheckpointStarted(Checkpoint checkpoint) {
    onCheckpointStarted(checkpoint, holder.currentTimeMicroseconds());
  }

  /** Like {@link #onCheckpointStarted(Checkpoint)}, for a checkpoint reached at this time. */
  public void onCheckpointStarted(Checkpoint checkpoint, long timestamp) {
    Checkpoint.Type type = checkpoint.type();
    switch (type) {
      case REQUEST_START:
        reset();
        requestStartTimestamp = timestamp;
        startPhase(type.phaseName(), checkpoint.metadata(), timestamp);
        break;
      case OPERATION_RESULT_READY:
        startPhase(type.phaseName(), checkpoint.metadata(), timestamp);
        break;
      case RESPONSE_READY:
        response = (ResponseReady) checkpoint;
        startPhase(type.phaseName(), checkpoint.metadata(), timestamp);
        break;
      case ERROR_RAISED:
        startPhase(type.phaseName(), checkpoint.metadata(), timestamp);
        // the rest of the pipeline may never run
        finalizeAll();
        break;
      case TEARDOWN:
        finalizeAll();
        break;
      default: // pre-dispatch is bracketed by operation tracing, not a phase
    }
  }

  /** Called once every listener of the checkpoint ran. */
  public void onCheckpointFinished(Checkpoint.Type type, Map<String, String> endMetadata) {
    switch (type) {
      case REQUEST_START:
      case OPERATION_RESULT_READY:
        endPhase(type.phaseName(), endMetadata);
        break;
      case RESPONSE_READY:
        endPhase(type.phaseName(), endMetadata);
        if (!finalized) {
          summarize();
          finalizeAll();
        }
        break;
      default:
    }
  }

  /**
   * Starts a child span of the transaction for this phase and makes it current. Does nothing when
   * there's no transaction or the phase is already open.
   */
  public void startPhase(String name, Map<String, String> metadata) {
    startPhase(name, metadata, holder.currentTimeMicroseconds());
  }

  void startPhase(String name, Map<String, String> metadata, long timestamp) {
    Span transaction = holder.activeTransaction();
    if (transaction == null) {
      log("no active transaction; not tracing phase {0}", name);
      return;
    }
    if (openPhases.containsKey(name)) {
      log("phase {0} is already open; ignoring start", name);
      return;
    }

    TraceContext previous = holder.currentContext();
    int order = ++executionOrder;
    Span span = holder.startChild(transaction, OPERATION_NAME, "Pipeline Phase: " + name,
      timestamp);
    SpanTags.tagAll(span, metadata);
    span.tag(PHASE_NAME, name);
    span.tag(EXECUTION_ORDER, String.valueOf(order));
    span.tag(START_TIME, String.valueOf(timestamp));

    openPhases.put(name, new PhaseRecord(name, span, previous, holder.makeCurrent(span),
      timestamp, order));
    phaseCount++;
    finalized = false; // a phase opened late still needs closing
    log("phase {0} started (order {1})", name, order);
  }

  /**
   * Finishes the phase's span and restores the context that was current before it started. Does
   * nothing if the phase isn't open.
   *
   * <p>Phases started after this one, and still open, are nested inside it. Those are
   * force-completed first so that the current-span slot unwinds in order.
   */
  public void endPhase(String name, Map<String, String> metadata) {
    PhaseRecord record = openPhases.get(name);
    if (record == null) {
      log("phase {0} is not open; ignoring end", name);
      return;
    }
    forceCompleteNestedIn(record);

    long timestamp = holder.currentTimeMicroseconds();
    long duration = timestamp - record.startTimestamp;
    PerformanceTier tier = thresholds.classify(name, duration);
    Span span = record.span;
    SpanTags.tagAll(span, metadata);
    span.tag(END_TIME, String.valueOf(timestamp));
    span.tag(DURATION, SpanTags.millis(duration));
    span.tag(EXECUTION_ORDER_END, String.valueOf(++executionOrder));
    span.tag(PERFORMANCE, tier.tagValue());
    span.tag(STATUS, STATUS_SUCCESS);
    span.finish(timestamp);

    restore(record);
    openPhases.remove(name);
    log("phase {0} completed in {1}ms ({2})", name, SpanTags.millis(duration), tier.tagValue());
  }

  /**
   * Force-completes every open phase, newest first, and marks this request finalized. Calling this
   * again does nothing unless a phase was started in between.
   */
  public void finalizeAll() {
    if (finalized) {
      LOG.fine("phases already finalized");
      return;
    }
    List<PhaseRecord> open = new ArrayList<>(openPhases.values());
    for (int i = open.size() - 1; i >= 0; i--) {
      forceComplete(open.get(i));
    }
    openPhases.clear();
    finalized = true;
  }

  /**
   * Clears all state ahead of a new request. Phases leaked by a previous request are finalized
   * first, so reusing an instance never leaves spans open.
   */
  public void reset() {
    if (!openPhases.isEmpty()) {
      log("{0} phases left open by the previous request", openPhases.size());
      finalized = false;
      finalizeAll();
    }
    executionOrder = 0;
    phaseCount = 0;
    finalized = false;
    requestStartTimestamp = 0L;
    response = null;
  }

  public boolean isFinalized() {
    return finalized;
  }

  /** Returns true if the phase was started and not yet ended or finalized. */
  public boolean isOpen(String name) {
    return openPhases.containsKey(name);
  }

  void forceCompleteNestedIn(PhaseRecord outer) {
    List<PhaseRecord> open = new ArrayList<>(openPhases.values());
    for (int i = open.size() - 1; i >= 0; i--) {
      PhaseRecord nested = open.get(i);
      if (nested == outer) break;
      forceComplete(nested);
      openPhases.remove(nested.name);
    }
  }

  void forceComplete(PhaseRecord record) {
    long timestamp = holder.currentTimeMicroseconds();
    record.span.tag(DURATION, SpanTags.millis(timestamp - record.startTimestamp));
    record.span.tag(STATUS, STATUS_FORCE_COMPLETED);
    record.span.finish(timestamp);
    restore(record);
    log("phase {0} force completed", record.name);
  }

  void restore(PhaseRecord record) {
    record.scope.close();
    TraceContext current = holder.currentContext();
    if (current == null ? record.previous != null : !current.equals(record.previous)) {
      log("context after closing phase {0} is {1}", record.name, current);
    }
  }

  void summarize() {
    Span transaction = holder.activeTransaction();
    if (transaction == null || requestStartTimestamp == 0L) return;
    long duration = holder.currentTimeMicroseconds() - requestStartTimestamp;
    ExecutionSummary summary = ExecutionSummary.create(duration, phaseCount, response);
    summary.tag(transaction);
    Level level = duration > 1_000_000L ? Level.INFO : Level.FINE;
    if (LOG.isLoggable(level)) LOG.log(level, summary.toString());
  }

  static void log(String msg, Object zero) {
    log(msg, zero, null);
  }

  static void log(String msg, Object zero, @Nullable Object one) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    Object[] params = one != null ? new Object[] {zero, one} : new Object[] {zero};
    LOG.log(Level.FINE, msg, params);
  }

  static void log(String msg, Object zero, Object one, Object two) {
    if (!LOG.isLoggable(Level.FINE)) return;
    LOG.log(Level.FINE, msg, new Object[] {zero, one, two});
  }

  @Override public String toString() {
    return "PhaseSpanTracker{open=" + openPhases.keySet() + ", finalized=" + finalized + "}";
  }
}
