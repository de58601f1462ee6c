/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.linkedin.drainer.common.DrainerRuntimeException;
import com.linkedin.drainer.common.JsonUtils;


/**
 * The value every {@link CheckpointStore} persists: the commit ts and, optionally, the binlog offset it maps to.
 * Stored as JSON, e.g.
 * {@code {"commitTS":417890573541376001,"offset":{"fileName":"binlog-0000000001","position":1024}}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CheckpointRecord {
  private final long _commitTs;
  private final BinlogOffset _offset;

  public CheckpointRecord(long commitTs) {
    this(commitTs, null);
  }

  @JsonCreator
  public CheckpointRecord(@JsonProperty(value = "commitTS", required = true) long commitTs,
      @JsonProperty("offset") @Nullable BinlogOffset offset) {
    _commitTs = commitTs;
    _offset = offset;
  }

  @JsonProperty("commitTS")
  public long getCommitTs() {
    return _commitTs;
  }

  @JsonProperty("offset")
  @Nullable
  public BinlogOffset getOffset() {
    return _offset;
  }

  /**
   * @return the JSON form written to the store
   */
  public String toJson() {
    return JsonUtils.toJson(this);
  }

  /**
   * Decode a record read from a store.
   * @param json stored JSON
   * @param source where the JSON was read from, used in the error message
   * @throws CheckpointCorruptedException if the JSON is blank, malformed, a bare {@code null} or lacks the commit ts
   */
  public static CheckpointRecord fromJson(String json, String source) {
    if (StringUtils.isBlank(json)) {
      throw new CheckpointCorruptedException("empty checkpoint record in " + source);
    }
    CheckpointRecord record;
    try {
      record = JsonUtils.fromJson(json, CheckpointRecord.class);
    } catch (DrainerRuntimeException e) {
      throw new CheckpointCorruptedException("unreadable checkpoint record in " + source + ": " + json, e);
    }
    if (record == null) {
      throw new CheckpointCorruptedException("null checkpoint record in " + source);
    }
    return record;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CheckpointRecord that = (CheckpointRecord) o;
    return _commitTs == that._commitTs && Objects.equals(_offset, that._offset);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_commitTs, _offset);
  }

  @Override
  public String toString() {
    return toJson();
  }
}
