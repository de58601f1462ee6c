/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

import java.time.Duration;

import org.apache.commons.lang3.Validate;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;


/**
 * Decides whether a checkpoint save is due, based on the time elapsed since the last successful save.
 * The clock starts when the throttle is created, so no save is due right after construction.
 */
public class SaveThrottle {

  public static final Duration DEFAULT_SAVE_INTERVAL = Duration.ofMillis(CheckpointConfig.DEFAULT_SAVE_INTERVAL_MS);

  private final Duration _saveInterval;
  private final Stopwatch _sinceLastSave;

  public SaveThrottle(Duration saveInterval) {
    this(saveInterval, Ticker.systemTicker());
  }

  /**
   * Constructor for SaveThrottle
   * @param saveInterval minimum time between two saves
   * @param ticker time source
   */
  public SaveThrottle(Duration saveInterval, Ticker ticker) {
    Validate.notNull(saveInterval, "null save interval");
    Validate.isTrue(!saveInterval.isNegative(), "save interval must not be negative: %s", saveInterval);
    Validate.notNull(ticker, "null ticker");
    _saveInterval = saveInterval;
    _sinceLastSave = Stopwatch.createStarted(ticker);
  }

  /**
   * @return true once the save interval has elapsed since the last {@link #markSaved()} or construction
   */
  public boolean isSaveDue() {
    return _sinceLastSave.elapsed().compareTo(_saveInterval) >= 0;
  }

  /**
   * Restart the interval; called after a successful save only.
   */
  public void markSaved() {
    _sinceLastSave.reset().start();
  }

  public Duration getSaveInterval() {
    return _saveInterval;
  }

  public Duration getTimeSinceLastSave() {
    return _sinceLastSave.elapsed();
  }
}
