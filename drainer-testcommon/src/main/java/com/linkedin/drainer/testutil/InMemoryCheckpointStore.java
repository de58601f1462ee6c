/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.testutil;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.linkedin.drainer.checkpoint.CheckpointRecord;
import com.linkedin.drainer.checkpoint.CheckpointStorageException;
import com.linkedin.drainer.checkpoint.CheckpointStore;


/**
 * An in-memory implementation of {@link CheckpointStore}. Can be told to fail saves.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

  private final AtomicReference<CheckpointRecord> _record = new AtomicReference<>();
  private final AtomicInteger _closeCount = new AtomicInteger();
  private volatile boolean _failSaves;

  @Override
  public CheckpointRecord load() {
    return _record.get();
  }

  @Override
  public void save(CheckpointRecord record) {
    if (_failSaves) {
      throw new CheckpointStorageException("injected save failure");
    }
    _record.set(record);
  }

  @Override
  public void close() {
    _closeCount.incrementAndGet();
  }

  public void setFailSaves(boolean failSaves) {
    _failSaves = failSaves;
  }

  public CheckpointRecord getRecord() {
    return _record.get();
  }

  public int getCloseCount() {
    return _closeCount.get();
  }
}
