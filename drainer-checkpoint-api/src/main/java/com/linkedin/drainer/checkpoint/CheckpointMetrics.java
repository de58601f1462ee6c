/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

import org.apache.commons.lang3.Validate;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;


/**
 * Save counters and latency of the checkpoints of one {@link CheckpointType}.
 */
public class CheckpointMetrics {

  static final String NUM_CHECKPOINT_SAVES = "numCheckpointSaves";
  static final String NUM_CHECKPOINT_SAVE_ERRORS = "numCheckpointSaveErrors";
  static final String CHECKPOINT_SAVE_LATENCY_MS = "checkpointSaveLatencyMs";

  private final Meter _saves;
  private final Meter _saveErrors;
  private final Histogram _saveLatencyMs;

  public CheckpointMetrics(MetricRegistry registry, CheckpointType type) {
    Validate.notNull(registry, "null metric registry");
    Validate.notNull(type, "null checkpoint type");
    _saves = registry.meter(buildMetricName(type, NUM_CHECKPOINT_SAVES));
    _saveErrors = registry.meter(buildMetricName(type, NUM_CHECKPOINT_SAVE_ERRORS));
    _saveLatencyMs = registry.histogram(buildMetricName(type, CHECKPOINT_SAVE_LATENCY_MS));
  }

  /**
   * Full registry name of a checkpoint metric, e.g. {@code Checkpoint.file.numCheckpointSaves}
   */
  public static String buildMetricName(CheckpointType type, String metric) {
    return MetricRegistry.name(Checkpoint.class.getSimpleName(), type.getName(), metric);
  }

  void onSave(long latencyMs) {
    _saves.mark();
    _saveLatencyMs.update(latencyMs);
  }

  void onSaveError() {
    _saveErrors.mark();
  }
}
