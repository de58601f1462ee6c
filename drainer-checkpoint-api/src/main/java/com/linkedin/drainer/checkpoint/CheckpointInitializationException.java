/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

/**
 * Thrown when the store for a checkpoint cannot be created, e.g. invalid configuration or unreachable backend.
 */
public class CheckpointInitializationException extends CheckpointException {
  private static final long serialVersionUID = 1;

  public CheckpointInitializationException(String typeName, CheckpointConfig config, Throwable cause) {
    super(String.format("initialize %s type checkpoint with config %s", typeName, config), cause);
  }
}
