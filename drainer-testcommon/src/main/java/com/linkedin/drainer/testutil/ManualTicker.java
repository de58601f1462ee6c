/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.testutil;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Ticker;


/**
 * A {@link Ticker} that only moves when told to.
 */
public class ManualTicker extends Ticker {
  private final AtomicLong _nanos = new AtomicLong();

  @Override
  public long read() {
    return _nanos.get();
  }

  /**
   * Move the time forward
   */
  public ManualTicker advance(Duration duration) {
    _nanos.addAndGet(duration.toNanos());
    return this;
  }
}
