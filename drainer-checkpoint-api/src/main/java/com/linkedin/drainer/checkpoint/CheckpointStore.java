/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

import org.jetbrains.annotations.Nullable;


/**
 * Backend adapter persisting a single current {@link CheckpointRecord} in one storage technology.
 * A store is owned by exactly one {@link DefaultCheckpoint}, which guarantees {@link #close()} is called once
 * and nothing else is called after it.
 */
public interface CheckpointStore {

  /**
   * Read the current record.
   * @return the last saved record, or null if nothing has been saved yet
   * @throws CheckpointStorageException on I/O failure
   * @throws CheckpointCorruptedException if the stored record cannot be decoded
   */
  @Nullable
  CheckpointRecord load();

  /**
   * Replace the current record. Either the new record is durable when this returns or an exception is thrown
   * and the previous record is still the current one.
   * @throws CheckpointStorageException on I/O failure
   */
  void save(CheckpointRecord record);

  /**
   * Release connections, producers or file handles held by the store.
   * @throws CheckpointStorageException if the release fails
   */
  void close();
}
