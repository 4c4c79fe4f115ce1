/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

/** Coarse grading of how long something took relative to what is expected of it. */
public enum PerformanceTier {
  FAST("fast"),
  NORMAL("normal"),
  SLOW("slow"),
  VERY_SLOW("very_slow");

  final String tagValue;

  PerformanceTier(String tagValue) {
    this.tagValue = tagValue;
  }

  /** Value used in tags. ex "very_slow" */
  public String tagValue() {
    return tagValue;
  }

  /**
   * Under half the threshold is fast, under the threshold normal, under twice the threshold slow.
   * Anything longer is very slow.
   */
  public static PerformanceTier classify(long durationMicros, long thresholdMicros) {
    if (durationMicros * 2 < thresholdMicros) return FAST;
    if (durationMicros < thresholdMicros) return NORMAL;
    if (durationMicros < thresholdMicros * 2) return SLOW;
    return VERY_SLOW;
  }

  /** Grades a whole request: under 200ms fast, 500ms normal, 1s slow. */
  public static PerformanceTier overall(long durationMicros) {
    if (durationMicros < 200_000L) return FAST;
    if (durationMicros < 500_000L) return NORMAL;
    if (durationMicros < 1_000_000L) return SLOW;
    return VERY_SLOW;
  }
}
