/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

import java.util.Objects;

import org.apache.commons.lang3.Validate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;


/**
 * Location of a change in a binlog file: the file name and the byte offset within it.
 */
public final class BinlogOffset {
  private final String _fileName;
  private final long _position;

  /**
   * Constructor for BinlogOffset
   * @param fileName binlog file name
   * @param position offset within the file
   */
  @JsonCreator
  public BinlogOffset(@JsonProperty(value = "fileName", required = true) String fileName,
      @JsonProperty(value = "position", required = true) long position) {
    Validate.notBlank(fileName, "binlog file name must not be blank");
    Validate.isTrue(position >= 0, "binlog position must not be negative: %d", position);
    _fileName = fileName;
    _position = position;
  }

  @JsonProperty("fileName")
  public String getFileName() {
    return _fileName;
  }

  @JsonProperty("position")
  public long getPosition() {
    return _position;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    BinlogOffset that = (BinlogOffset) o;
    return _position == that._position && _fileName.equals(that._fileName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_fileName, _position);
  }

  @Override
  public String toString() {
    return _fileName + ":" + _position;
  }
}
