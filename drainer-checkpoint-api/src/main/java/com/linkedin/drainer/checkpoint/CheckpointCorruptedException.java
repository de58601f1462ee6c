/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

/**
 * Thrown when a stored checkpoint record exists but cannot be decoded.
 */
public class CheckpointCorruptedException extends CheckpointStorageException {
  private static final long serialVersionUID = 1;

  public CheckpointCorruptedException(String message) {
    super(message);
  }

  public CheckpointCorruptedException(String message, Throwable cause) {
    super(message, cause);
  }
}
