/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

/**
 * The storage backends a checkpoint can be kept in.
 */
public enum CheckpointType {
  MYSQL("mysql"),
  TIDB("tidb"),
  FILE("file"),
  KAFKA("kafka"),
  FLASH("flash");

  private final String _name;

  CheckpointType(String name) {
    _name = name;
  }

  /**
   * @return the name used to select this type in configuration
   */
  public String getName() {
    return _name;
  }

  /**
   * Resolve a checkpoint type by its configuration name.
   * @throws UnsupportedCheckpointTypeException if no type has that name
   */
  public static CheckpointType fromName(String name) {
    for (CheckpointType type : values()) {
      if (type._name.equals(name)) {
        return type;
      }
    }
    throw new UnsupportedCheckpointTypeException(name);
  }

  @Override
  public String toString() {
    return _name;
  }
}
