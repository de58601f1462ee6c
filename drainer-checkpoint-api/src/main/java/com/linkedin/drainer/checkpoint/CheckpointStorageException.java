/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

/**
 * Thrown when a checkpoint store fails to read, write or release its backend.
 */
public class CheckpointStorageException extends CheckpointException {
  private static final long serialVersionUID = 1;

  public CheckpointStorageException(String message) {
    super(message);
  }

  public CheckpointStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
