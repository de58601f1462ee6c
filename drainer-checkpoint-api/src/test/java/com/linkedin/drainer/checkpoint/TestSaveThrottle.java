/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.base.Ticker;


public class TestSaveThrottle {

  private final AtomicLong _nanos = new AtomicLong();
  private final Ticker _ticker = new Ticker() {
    @Override
    public long read() {
      return _nanos.get();
    }
  };

  @BeforeMethod
  public void setup() {
    _nanos.set(0);
  }

  private void advanceMillis(long millis) {
    _nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
  }

  @Test
  public void testNotDueRightAfterConstruction() {
    SaveThrottle throttle = new SaveThrottle(SaveThrottle.DEFAULT_SAVE_INTERVAL, _ticker);
    Assert.assertFalse(throttle.isSaveDue());
    Assert.assertEquals(throttle.getSaveInterval(), Duration.ofSeconds(3));
  }

  @Test
  public void testDueOnceIntervalElapsed() {
    SaveThrottle throttle = new SaveThrottle(Duration.ofSeconds(3), _ticker);
    advanceMillis(2999);
    Assert.assertFalse(throttle.isSaveDue());
    advanceMillis(1);
    Assert.assertTrue(throttle.isSaveDue());
    advanceMillis(60_000);
    Assert.assertTrue(throttle.isSaveDue());
  }

  @Test
  public void testMarkSavedRestartsInterval() {
    SaveThrottle throttle = new SaveThrottle(Duration.ofSeconds(3), _ticker);
    advanceMillis(5000);
    Assert.assertTrue(throttle.isSaveDue());

    throttle.markSaved();
    Assert.assertFalse(throttle.isSaveDue());
    Assert.assertEquals(throttle.getTimeSinceLastSave(), Duration.ZERO);

    advanceMillis(3000);
    Assert.assertTrue(throttle.isSaveDue());
  }

  @Test
  public void testZeroIntervalIsAlwaysDue() {
    SaveThrottle throttle = new SaveThrottle(Duration.ZERO, _ticker);
    Assert.assertTrue(throttle.isSaveDue());
    throttle.markSaved();
    Assert.assertTrue(throttle.isSaveDue());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNegativeIntervalRejected() {
    new SaveThrottle(Duration.ofSeconds(-1), _ticker);
  }

  @Test
  public void testThrottlesAreIndependent() {
    SaveThrottle first = new SaveThrottle(Duration.ofSeconds(3), _ticker);
    advanceMillis(3000);
    SaveThrottle second = new SaveThrottle(Duration.ofSeconds(3), _ticker);
    Assert.assertTrue(first.isSaveDue());
    Assert.assertFalse(second.isSaveDue());
  }
}
