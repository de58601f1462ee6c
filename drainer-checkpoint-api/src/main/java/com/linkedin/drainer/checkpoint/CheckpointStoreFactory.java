/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

/**
 * Creates the {@link CheckpointStore} for one or more {@link CheckpointType}s.
 */
public interface CheckpointStoreFactory {

  /**
   * Create and initialize a store, e.g. connect and create the checkpoint table.
   * @param type the checkpoint type the store is created for
   * @param config checkpoint configuration; validated here
   * @return a ready to use store
   * @throws IllegalArgumentException if a required property is missing or invalid
   * @throws CheckpointStorageException if the backend cannot be initialized
   */
  CheckpointStore createStore(CheckpointType type, CheckpointConfig config);
}
