/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

/**
 * Thrown when a checkpoint is requested for a type name no store is known for.
 */
public class UnsupportedCheckpointTypeException extends CheckpointException {
  private static final long serialVersionUID = 1;

  private final String _typeName;

  public UnsupportedCheckpointTypeException(String typeName) {
    super("unsupported checkpoint type " + typeName);
    _typeName = typeName;
  }

  public String getTypeName() {
    return _typeName;
  }
}
