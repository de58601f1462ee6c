/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * {@link Checkpoint} backed by one {@link CheckpointStore} and gated by one {@link SaveThrottle}.
 * Holds the position in memory, delegates persistence to the store and owns the store's lifecycle.
 */
public class DefaultCheckpoint implements Checkpoint {
  private static final Logger LOG = LoggerFactory.getLogger(DefaultCheckpoint.class);

  private final CheckpointType _type;
  private final CheckpointStore _store;
  private final SaveThrottle _throttle;
  private final CheckpointMetrics _metrics;
  private final long _initialCommitTs;
  private final AtomicBoolean _closed = new AtomicBoolean(false);

  private volatile long _commitTs;
  private volatile BinlogOffset _offset;

  /**
   * Constructor for DefaultCheckpoint
   * @param type type of the store, used for logging and metrics
   * @param store the store; owned by this checkpoint from now on
   * @param throttle save throttle
   * @param metrics save metrics
   * @param initialCommitTs position used until a checkpoint is loaded, and when the store holds none
   */
  public DefaultCheckpoint(CheckpointType type, CheckpointStore store, SaveThrottle throttle,
      CheckpointMetrics metrics, long initialCommitTs) {
    Validate.notNull(type, "null checkpoint type");
    Validate.notNull(store, "null checkpoint store");
    Validate.notNull(throttle, "null save throttle");
    Validate.notNull(metrics, "null checkpoint metrics");
    _type = type;
    _store = store;
    _throttle = throttle;
    _metrics = metrics;
    _initialCommitTs = initialCommitTs;
    _commitTs = initialCommitTs;
  }

  @Override
  public void load() {
    ensureOpen();
    CheckpointRecord record = _store.load();
    if (record == null) {
      LOG.info("No {} checkpoint found, starting from initial commit ts {}", _type, _initialCommitTs);
      _commitTs = _initialCommitTs;
      _offset = null;
    } else {
      _commitTs = record.getCommitTs();
      _offset = record.getOffset();
      LOG.info("Loaded {} checkpoint: {}", _type, this);
    }
  }

  @Override
  public void save(long commitTs) {
    save(commitTs, _offset);
  }

  /**
   * Save the commit ts together with the binlog offset it corresponds to.
   * @param commitTs position to save
   * @param offset binlog offset of {@code commitTs}, or null if unknown
   * @see #save(long)
   */
  public void save(long commitTs, @Nullable BinlogOffset offset) {
    ensureOpen();
    if (commitTs < _commitTs) {
      LOG.warn("Saving {} checkpoint commit ts {} lower than the current {}", _type, commitTs, _commitTs);
    }

    long startTime = System.currentTimeMillis();
    try {
      _store.save(new CheckpointRecord(commitTs, offset));
    } catch (RuntimeException e) {
      _metrics.onSaveError();
      throw e;
    }
    _metrics.onSave(System.currentTimeMillis() - startTime);

    LOG.debug("Saved {} checkpoint commit ts {}, {} after the previous save", _type, commitTs,
        _throttle.getTimeSinceLastSave());
    _commitTs = commitTs;
    _offset = offset;
    _throttle.markSaved();
  }

  @Override
  public boolean check(long commitTs) {
    ensureOpen();
    return _throttle.isSaveDue();
  }

  @Override
  public long getCommitTs() {
    return _commitTs;
  }

  /**
   * @return the binlog offset of the current position, or null if unknown
   */
  @Nullable
  public BinlogOffset getBinlogOffset() {
    return _offset;
  }

  public CheckpointType getType() {
    return _type;
  }

  /**
   * @return true once {@link #close()} has been called
   */
  public boolean isClosed() {
    return _closed.get();
  }

  @Override
  public void close() {
    if (!_closed.compareAndSet(false, true)) {
      LOG.debug("{} checkpoint already closed", _type);
      return;
    }
    LOG.info("Closing {} checkpoint at {}", _type, this);
    _store.close();
  }

  private void ensureOpen() {
    if (_closed.get()) {
      throw new CheckpointClosedException();
    }
  }

  @Override
  public String toString() {
    BinlogOffset offset = _offset;
    return offset == null
        ? "binlog commitTS = " + _commitTs
        : "binlog commitTS = " + _commitTs + ", offset = " + offset;
  }
}
