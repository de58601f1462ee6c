/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Ticker;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;


public class TestDefaultCheckpoint {

  private final AtomicLong _nanos = new AtomicLong();
  private final Ticker _ticker = new Ticker() {
    @Override
    public long read() {
      return _nanos.get();
    }
  };

  private CheckpointStore _store;
  private MetricRegistry _registry;
  private DefaultCheckpoint _checkpoint;

  @BeforeMethod
  public void setup() {
    _nanos.set(0);
    _store = Mockito.mock(CheckpointStore.class);
    _registry = new MetricRegistry();
    _checkpoint = new DefaultCheckpoint(CheckpointType.FILE, _store, new SaveThrottle(Duration.ofSeconds(3), _ticker),
        new CheckpointMetrics(_registry, CheckpointType.FILE), 7);
  }

  @Test
  public void testCommitTsBeforeLoadIsInitialCommitTs() {
    Assert.assertEquals(_checkpoint.getCommitTs(), 7);
    Assert.assertEquals(_checkpoint.toString(), "binlog commitTS = 7");
    Assert.assertEquals(_checkpoint.getType(), CheckpointType.FILE);
  }

  @Test
  public void testLoadWithoutRecordUsesInitialCommitTs() {
    when(_store.load()).thenReturn(null);
    _checkpoint.load();
    Assert.assertEquals(_checkpoint.getCommitTs(), 7);
  }

  @Test
  public void testLoadReadsRecord() {
    BinlogOffset offset = new BinlogOffset("binlog-0000000002", 17);
    when(_store.load()).thenReturn(new CheckpointRecord(417890573541376001L, offset));
    _checkpoint.load();
    Assert.assertEquals(_checkpoint.getCommitTs(), 417890573541376001L);
    Assert.assertEquals(_checkpoint.getBinlogOffset(), offset);
  }

  @Test
  public void testLoadFailurePropagates() {
    when(_store.load()).thenThrow(new CheckpointCorruptedException("garbage"));
    Assert.assertThrows(CheckpointCorruptedException.class, _checkpoint::load);
    Assert.assertEquals(_checkpoint.getCommitTs(), 7);
  }

  @Test
  public void testSaveWritesRecordAndResetsThrottle() {
    _nanos.addAndGet(TimeUnit.SECONDS.toNanos(10));
    Assert.assertTrue(_checkpoint.check(100));

    _checkpoint.save(100);

    ArgumentCaptor<CheckpointRecord> captor = ArgumentCaptor.forClass(CheckpointRecord.class);
    verify(_store).save(captor.capture());
    Assert.assertEquals(captor.getValue(), new CheckpointRecord(100));
    Assert.assertEquals(_checkpoint.getCommitTs(), 100);
    Assert.assertFalse(_checkpoint.check(100));
    Assert.assertEquals(_registry.meter(
        CheckpointMetrics.buildMetricName(CheckpointType.FILE, CheckpointMetrics.NUM_CHECKPOINT_SAVES)).getCount(), 1);
  }

  @Test
  public void testFailedSaveKeepsStateAndThrottle() {
    _checkpoint.save(100);
    _nanos.addAndGet(TimeUnit.SECONDS.toNanos(4));
    doThrow(new CheckpointStorageException("disk full")).when(_store).save(any(CheckpointRecord.class));

    Assert.assertThrows(CheckpointStorageException.class, () -> _checkpoint.save(200));

    Assert.assertEquals(_checkpoint.getCommitTs(), 100);
    Assert.assertTrue(_checkpoint.check(200), "a failed save must not reset the throttle");
    Assert.assertEquals(_registry.meter(CheckpointMetrics.buildMetricName(CheckpointType.FILE,
        CheckpointMetrics.NUM_CHECKPOINT_SAVE_ERRORS)).getCount(), 1);
  }

  @Test
  public void testSaveKeepsOffsetUnlessGiven() {
    BinlogOffset offset = new BinlogOffset("binlog-0000000003", 99);
    _checkpoint.save(10, offset);
    _checkpoint.save(11);

    ArgumentCaptor<CheckpointRecord> captor = ArgumentCaptor.forClass(CheckpointRecord.class);
    verify(_store, times(2)).save(captor.capture());
    Assert.assertEquals(captor.getAllValues().get(1), new CheckpointRecord(11, offset));
    Assert.assertEquals(_checkpoint.toString(), "binlog commitTS = 11, offset = binlog-0000000003:99");
  }

  @Test
  public void testCloseReleasesStoreOnce() {
    _checkpoint.close();
    _checkpoint.close();
    _checkpoint.close();
    verify(_store, times(1)).close();
    Assert.assertTrue(_checkpoint.isClosed());
  }

  @Test
  public void testClosedCheckpointRejectsOperations() {
    _checkpoint.close();

    CheckpointClosedException e = Assert.expectThrows(CheckpointClosedException.class, _checkpoint::load);
    Assert.assertEquals(e.getMessage(), "CheckPoint already closed");
    Assert.assertThrows(CheckpointClosedException.class, () -> _checkpoint.save(1));
    Assert.assertThrows(CheckpointClosedException.class, () -> _checkpoint.check(1));
    verify(_store, never()).load();
    verify(_store, never()).save(any(CheckpointRecord.class));
  }

  @Test
  public void testCloseFailureReportedOnceAndStillClosed() {
    doThrow(new CheckpointStorageException("connection reset")).when(_store).close();

    Assert.assertThrows(CheckpointStorageException.class, _checkpoint::close);
    _checkpoint.close();

    verify(_store, times(1)).close();
    Assert.assertThrows(CheckpointClosedException.class, () -> _checkpoint.save(1));
  }
}
