/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace.spring.beans;

import brave.Clock;
import brave.Tracing;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.FactoryBean;
import phasetrace.Checkpoint;
import phasetrace.PhaseThresholds;
import phasetrace.PipelineTracing;
import phasetrace.TraceIntentRegistry;

/** Spring XML config does not support chained builders. This converts accordingly */
public class PipelineTracingFactoryBean implements FactoryBean {
  // Spring uses commons logging
  static final Log logger = LogFactory.getLog(PipelineTracingFactoryBean.class);

  Tracing tracing;
  Map<String, Long> phaseThresholds;
  Long defaultThresholdMillis;
  TraceIntentRegistry intentRegistry;
  Clock clock;

  @Override public PipelineTracing getObject() {
    PipelineTracing.Builder builder = PipelineTracing.newBuilder(tracing);
    if (phaseThresholds != null || defaultThresholdMillis != null) {
      builder.phaseThresholds(thresholds());
    }
    if (intentRegistry != null) builder.intentRegistry(intentRegistry);
    if (clock != null) builder.clock(clock);
    return builder.build();
  }

  PhaseThresholds thresholds() {
    PhaseThresholds.Builder result = PhaseThresholds.DEFAULT.toBuilder();
    if (defaultThresholdMillis != null) {
      result.defaultThreshold(defaultThresholdMillis, TimeUnit.MILLISECONDS);
    }
    if (phaseThresholds == null) return result.build();
    for (Map.Entry<String, Long> entry : phaseThresholds.entrySet()) {
      if (!isBuiltInPhase(entry.getKey()) && logger.isDebugEnabled()) {
        logger.debug("Threshold configured for custom phase '" + entry.getKey() + "'");
      }
      result.threshold(entry.getKey(), entry.getValue(), TimeUnit.MILLISECONDS);
    }
    return result.build();
  }

  static boolean isBuiltInPhase(String name) {
    for (Checkpoint.Type type : Checkpoint.Type.values()) {
      if (type.phaseName().equals(name)) return true;
    }
    return false;
  }

  @Override public Class<? extends PipelineTracing> getObjectType() {
    return PipelineTracing.class;
  }

  @Override public boolean isSingleton() {
    return true;
  }

  public void setTracing(Tracing tracing) {
    this.tracing = tracing;
  }

  /** Expected duration in milliseconds, keyed by phase name. ex "view" -> 20 */
  public void setPhaseThresholds(Map<String, Long> phaseThresholds) {
    this.phaseThresholds = phaseThresholds;
  }

  public void setDefaultThresholdMillis(Long defaultThresholdMillis) {
    this.defaultThresholdMillis = defaultThresholdMillis;
  }

  public void setIntentRegistry(TraceIntentRegistry intentRegistry) {
    this.intentRegistry = intentRegistry;
  }

  public void setClock(Clock clock) {
    this.clock = clock;
  }
}
