/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

/**
 * The replication position of a drainer, persisted to a durable store so that a restarted drainer
 * resumes from the last saved commit ts instead of replaying or skipping changes.
 *
 * The expected call pattern from the replication loop is:
 * <pre>
 *   checkpoint.load();                       // once, on startup
 *   ...
 *   if (checkpoint.check(commitTs)) {        // after each applied batch
 *     checkpoint.save(commitTs);
 *   }
 *   ...
 *   checkpoint.close();                      // once, on shutdown
 * </pre>
 *
 * Implementations are driven by a single thread and are not safe for concurrent {@link #save(long)} calls.
 * After {@link #close()} every operation other than {@link #close()}, {@link #getCommitTs()} and
 * {@link #toString()} throws {@link CheckpointClosedException}.
 */
public interface Checkpoint extends AutoCloseable {

  /**
   * Read the last durably saved position into memory. If the store holds no checkpoint yet the position
   * becomes the configured initial commit ts.
   * @throws CheckpointStorageException if the store cannot be reached
   * @throws CheckpointCorruptedException if the stored record cannot be decoded
   * @throws CheckpointClosedException if the checkpoint is closed
   */
  void load();

  /**
   * Durably persist {@code commitTs}, replacing the previously stored value. The value is stored as given
   * even if it is lower than the current one. On success the save throttle is reset.
   * @param commitTs position everything up to which has been applied downstream
   * @throws CheckpointStorageException if the write fails; the previously stored value is left intact
   * @throws CheckpointClosedException if the checkpoint is closed
   */
  void save(long commitTs);

  /**
   * Whether the caller should call {@link #save(long)} now. True once the configured save interval has elapsed
   * since the last successful save (or since construction). Never performs I/O.
   * @param commitTs the position the caller is about to save; does not influence the decision
   * @throws CheckpointClosedException if the checkpoint is closed
   */
  boolean check(long commitTs);

  /**
   * @return the last position known in memory, from the last successful {@link #load()} or {@link #save(long)}
   */
  long getCommitTs();

  /**
   * Release the store's resources. Resources are released exactly once no matter how many times this is called.
   * @throws CheckpointStorageException if releasing the store fails; reported by the first call only
   */
  @Override
  void close();

  /**
   * @return the commit ts, and the binlog offset where known, for logging
   */
  @Override
  String toString();
}
