/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Expected duration of each named phase, used to grade it with {@link PerformanceTier}. Phases
 * without an explicit entry use {@link #defaultThresholdMicros()}.
 */
public final class PhaseThresholds {
  /**
   * request 50ms, view 20ms, response 50ms, exception 10ms, anything else 50ms.
   */
  public static final PhaseThresholds DEFAULT = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  final Map<String, Long> thresholdsMicros;
  final long defaultThresholdMicros;

  PhaseThresholds(Builder builder) {
    this.thresholdsMicros = Collections.unmodifiableMap(new LinkedHashMap<>(builder.thresholds));
    this.defaultThresholdMicros = builder.defaultThresholdMicros;
  }

  public long thresholdMicros(String phaseName) {
    Long result = thresholdsMicros.get(phaseName);
    return result != null ? result : defaultThresholdMicros;
  }

  public long defaultThresholdMicros() {
    return defaultThresholdMicros;
  }

  public PerformanceTier classify(String phaseName, long durationMicros) {
    return PerformanceTier.classify(durationMicros, thresholdMicros(phaseName));
  }

  public Builder toBuilder() {
    Builder result = new Builder();
    result.thresholds.clear();
    result.thresholds.putAll(thresholdsMicros);
    result.defaultThresholdMicros = defaultThresholdMicros;
    return result;
  }

  @Override public String toString() {
    return "PhaseThresholds{" + thresholdsMicros + ", default=" + defaultThresholdMicros + "}";
  }

  public static final class Builder {
    final Map<String, Long> thresholds = new LinkedHashMap<>();
    long defaultThresholdMicros = 50_000L;

    Builder() {
      thresholds.put(Checkpoint.Type.REQUEST_START.phaseName(), 50_000L);
      thresholds.put(Checkpoint.Type.OPERATION_RESULT_READY.phaseName(), 20_000L);
      thresholds.put(Checkpoint.Type.RESPONSE_READY.phaseName(), 50_000L);
      thresholds.put(Checkpoint.Type.ERROR_RAISED.phaseName(), 10_000L);
    }

    public Builder threshold(String phaseName, long duration, TimeUnit unit) {
      if (phaseName == null) throw new NullPointerException("phaseName == null");
      thresholds.put(phaseName, toMicros(duration, unit));
      return this;
    }

    public Builder defaultThreshold(long duration, TimeUnit unit) {
      defaultThresholdMicros = toMicros(duration, unit);
      return this;
    }

    public PhaseThresholds build() {
      return new PhaseThresholds(this);
    }

    static long toMicros(long duration, TimeUnit unit) {
      if (unit == null) throw new NullPointerException("unit == null");
      if (duration <= 0) throw new IllegalArgumentException("duration <= 0");
      return unit.toMicros(duration);
    }
  }
}
