/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.testutil;

import java.util.Properties;

import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Ticker;

import com.linkedin.drainer.checkpoint.CheckpointConfig;
import com.linkedin.drainer.checkpoint.CheckpointMetrics;
import com.linkedin.drainer.checkpoint.CheckpointStore;
import com.linkedin.drainer.checkpoint.CheckpointType;
import com.linkedin.drainer.checkpoint.DefaultCheckpoint;
import com.linkedin.drainer.checkpoint.SaveThrottle;


/**
 * Helpers for building checkpoints in tests.
 */
public final class CheckpointTestUtils {

  private CheckpointTestUtils() {
  }

  /**
   * Build a {@link CheckpointConfig} from alternating key/value pairs.
   */
  public static CheckpointConfig config(String... keyValues) {
    return new CheckpointConfig(properties(keyValues));
  }

  /**
   * Build {@link Properties} from alternating key/value pairs.
   */
  public static Properties properties(String... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("keys and values must come in pairs");
    }
    Properties props = new Properties();
    for (int i = 0; i < keyValues.length; i += 2) {
      props.setProperty(keyValues[i], keyValues[i + 1]);
    }
    return props;
  }

  /**
   * Wrap a store into a checkpoint whose throttle runs on the given ticker.
   */
  public static DefaultCheckpoint newCheckpoint(CheckpointType type, CheckpointStore store, CheckpointConfig config,
      Ticker ticker) {
    return new DefaultCheckpoint(type, store, new SaveThrottle(config.getSaveInterval(), ticker),
        new CheckpointMetrics(new MetricRegistry(), type), config.getInitialCommitTs());
  }
}
