/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.internal.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static brave.internal.Throwables.propagateIfFatal;

/**
 * Drives the phase and operation tracers of one request from pipeline checkpoints. Integrations
 * call {@link #checkpointStarted} when the pipeline begins dispatching a checkpoint and
 * {@link #checkpointFinished} when it is done with it.
 *
 * <p>On a terminal checkpoint the operation span closes before the phase span opens, so the
 * operation is measured as tightly as the pipeline allows.
 *
 * <p>Tracing must not change what the pipeline does: failures here are logged, not thrown.
 */
public final class RequestTracer {
  static final Logger LOG = Logger.getLogger(RequestTracer.class.getName());

  final PhaseSpanTracker phases;
  final ScopedOperationTracer operations;

  RequestTracer(PhaseSpanTracker phases, ScopedOperationTracer operations) {
    this.phases = phases;
    this.operations = operations;
  }

  public PhaseSpanTracker phases() {
    return phases;
  }

  public ScopedOperationTracer operations() {
    return operations;
  }

  /** Timestamp in the clock phases and operations are timed with. */
  public long currentTimeMicroseconds() {
    return phases.holder.currentTimeMicroseconds();
  }

  public void checkpointStarted(Checkpoint checkpoint) {
    checkpointStarted(checkpoint, currentTimeMicroseconds());
  }

  /**
   * Like {@link #checkpointStarted(Checkpoint)}, for a checkpoint the pipeline reached at this
   * time. Use this when an integration only learns what a checkpoint means from a later event.
   */
  public void checkpointStarted(Checkpoint checkpoint, long timestamp) {
    try {
      switch (checkpoint.type()) {
        case REQUEST_START:
          operations.reset();
          phases.onCheckpointStarted(checkpoint, timestamp);
          break;
        case PRE_DISPATCH:
          operations.enter((PreDispatch) checkpoint);
          break;
        case OPERATION_RESULT_READY:
        case RESPONSE_READY:
        case ERROR_RAISED:
          operations.exit(checkpoint, timestamp);
          phases.onCheckpointStarted(checkpoint, timestamp);
          break;
        case TEARDOWN:
          operations.reset();
          phases.onCheckpointStarted(checkpoint);
          break;
        default:
      }
    } catch (Throwable t) {
      propagateIfFatal(t);
      log(t, "error tracing checkpoint {0}", checkpoint.type());
    }
  }

  public void checkpointFinished(Checkpoint.Type type) {
    checkpointFinished(type, Collections.emptyMap());
  }

  /** @param endMetadata tags only known once the checkpoint was handled. ex the matched route */
  public void checkpointFinished(Checkpoint.Type type, Map<String, String> endMetadata) {
    try {
      phases.onCheckpointFinished(type, endMetadata);
    } catch (Throwable t) {
      propagateIfFatal(t);
      log(t, "error tracing end of checkpoint {0}", type);
    }
  }

  /** Closes everything this request opened. Safe to call more than once. */
  public void close() {
    checkpointStarted(Teardown.INSTANCE);
  }

  static void log(Throwable thrown, String msg, @Nullable Object zero) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LogRecord lr = new LogRecord(Level.FINE, msg);
    lr.setParameters(new Object[] {zero});
    lr.setThrown(thrown);
    LOG.log(lr);
  }

  @Override public String toString() {
    return "RequestTracer{" + phases + ", " + operations + "}";
  }
}
