/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

/**
 * Thrown by any operation other than close on a checkpoint that has been closed.
 */
public class CheckpointClosedException extends CheckpointException {
  private static final long serialVersionUID = 1;

  public static final String MESSAGE = "CheckPoint already closed";

  public CheckpointClosedException() {
    super(MESSAGE);
  }
}
