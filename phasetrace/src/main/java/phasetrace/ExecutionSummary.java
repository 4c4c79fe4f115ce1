/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.Span;
import brave.internal.Nullable;
import java.util.Locale;

/** Totals for one request, written onto the transaction once the response is ready. */
final class ExecutionSummary {
  static final String DURATION = "pipeline.duration_ms";
  static final String HEAP_USED = "pipeline.heap_used_mb";
  static final String PHASE_COUNT = "pipeline.phase_count";
  static final String PERFORMANCE = "pipeline.performance";
  static final String RESPONSE_SIZE = "http.response_size";

  static ExecutionSummary create(long durationMicros, int phaseCount,
    @Nullable ResponseReady response) {
    Runtime runtime = Runtime.getRuntime();
    long heapUsed = runtime.totalMemory() - runtime.freeMemory();
    return new ExecutionSummary(durationMicros, heapUsed, phaseCount, response);
  }

  final long durationMicros, heapUsedBytes;
  final int phaseCount;
  @Nullable final ResponseReady response;

  ExecutionSummary(long durationMicros, long heapUsedBytes, int phaseCount,
    @Nullable ResponseReady response) {
    this.durationMicros = durationMicros;
    this.heapUsedBytes = heapUsedBytes;
    this.phaseCount = phaseCount;
    this.response = response;
  }

  PerformanceTier performance() {
    return PerformanceTier.overall(durationMicros);
  }

  void tag(Span transaction) {
    transaction.tag(DURATION, SpanTags.millis(durationMicros));
    transaction.tag(HEAP_USED, heapUsedMegabytes());
    transaction.tag(PHASE_COUNT, String.valueOf(phaseCount));
    transaction.tag(PERFORMANCE, performance().tagValue());
    transaction.tag(RESPONSE_SIZE, responseSize(response != null ? response.contentLength : -1));
  }

  String heapUsedMegabytes() {
    return String.format(Locale.ROOT, "%.2f", heapUsedBytes / 1024.0 / 1024.0);
  }

  /** Buckets at 1KiB, 10KiB and 100KiB. Negative means the length wasn't known. */
  static String responseSize(long contentLength) {
    if (contentLength < 0) return "unknown";
    if (contentLength < 1024L) return "small";
    if (contentLength < 10_240L) return "medium";
    if (contentLength < 102_400L) return "large";
    return "very_large";
  }

  @Override public String toString() {
    return "request completed with " + phaseCount + " phases in "
      + SpanTags.millis(durationMicros) + "ms (" + performance().tagValue() + "), heap used "
      + heapUsedMegabytes() + "MB, status "
      + (response != null ? String.valueOf(response.statusCode) : "unknown");
  }
}
