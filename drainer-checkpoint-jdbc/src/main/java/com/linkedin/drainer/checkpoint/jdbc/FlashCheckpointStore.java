/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.function.LongSupplier;

import javax.sql.DataSource;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linkedin.drainer.checkpoint.CheckpointConfig;
import com.linkedin.drainer.checkpoint.CheckpointRecord;
import com.linkedin.drainer.checkpoint.CheckpointStorageException;
import com.linkedin.drainer.checkpoint.CheckpointStore;
import com.linkedin.drainer.common.ErrorLogger;


/**
 * Keeps the checkpoint in a ClickHouse compatible columnar store (TiFlash, ClickHouse).
 *
 * Columnar stores make in-place updates expensive, so every save appends a row with a larger {@code version} and
 * the {@code ReplacingMergeTree} engine folds older versions away in the background. Reads use {@code FINAL} and
 * pick the highest version, so the newest row is the current checkpoint even before a merge ran.
 */
public class FlashCheckpointStore implements CheckpointStore {
  private static final Logger LOG = LoggerFactory.getLogger(FlashCheckpointStore.class);

  private static final String CREATE_DATABASE = "CREATE DATABASE IF NOT EXISTS %s";
  private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS %s "
      + "(clusterid UInt64, checkpoint String, version UInt64) ENGINE = ReplacingMergeTree(version) ORDER BY clusterid";
  private static final String SELECT_CHECKPOINT =
      "SELECT checkpoint, version FROM %s FINAL WHERE clusterid = ? ORDER BY version DESC LIMIT 1";
  private static final String INSERT_CHECKPOINT = "INSERT INTO %s (clusterid, checkpoint, version) VALUES (?, ?, ?)";

  private final DataSource _dataSource;
  private final long _clusterId;
  private final String _tableName;
  private final int _queryTimeoutSeconds;
  private final LongSupplier _clock;

  private long _lastVersion;

  public FlashCheckpointStore(DataSource dataSource, CheckpointConfig config) {
    this(dataSource, config, System::currentTimeMillis);
  }

  /**
   * Constructor for FlashCheckpointStore. Creates the checkpoint database and table if missing.
   * @param dataSource connection pool owned by this store from now on
   * @param config checkpoint configuration
   * @param clock source of row versions, in milliseconds
   * @throws CheckpointStorageException if the table cannot be created
   */
  FlashCheckpointStore(DataSource dataSource, CheckpointConfig config, LongSupplier clock) {
    Validate.notNull(dataSource, "null data source");
    Validate.notNull(config, "null checkpoint config");
    _dataSource = dataSource;
    _clusterId = config.getClusterId();
    _tableName = config.getSchema() + "." + config.getTable();
    _queryTimeoutSeconds = config.getDbQueryTimeoutSeconds();
    _clock = clock;

    try (Connection conn = _dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.setQueryTimeout(_queryTimeoutSeconds);
      stmt.execute(String.format(CREATE_DATABASE, config.getSchema()));
      stmt.execute(String.format(CREATE_TABLE, _tableName));
    } catch (SQLException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to create checkpoint table " + _tableName, e,
          CheckpointStorageException::new);
    }
    LOG.info("Using columnar checkpoint table {} for cluster {}", _tableName, _clusterId);
  }

  @Override
  public CheckpointRecord load() {
    String json;
    try (Connection conn = _dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(String.format(SELECT_CHECKPOINT, _tableName))) {
      stmt.setQueryTimeout(_queryTimeoutSeconds);
      stmt.setLong(1, _clusterId);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          LOG.info("No checkpoint row for cluster {} in {}", _clusterId, _tableName);
          return null;
        }
        json = rs.getString(1);
        _lastVersion = Math.max(_lastVersion, rs.getLong(2));
      }
    } catch (SQLException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to read checkpoint of cluster " + _clusterId + " from " + _tableName,
          e, CheckpointStorageException::new);
    }
    return CheckpointRecord.fromJson(json, _tableName);
  }

  @Override
  public void save(CheckpointRecord record) {
    // versions must grow even if the wall clock goes backwards
    long version = Math.max(_lastVersion + 1, _clock.getAsLong());
    try (Connection conn = _dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(String.format(INSERT_CHECKPOINT, _tableName))) {
      stmt.setQueryTimeout(_queryTimeoutSeconds);
      stmt.setLong(1, _clusterId);
      stmt.setString(2, record.toJson());
      stmt.setLong(3, version);
      stmt.executeUpdate();
    } catch (SQLException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to save checkpoint " + record + " to " + _tableName, e,
          CheckpointStorageException::new);
    }
    _lastVersion = version;
  }

  @Override
  public void close() {
    try {
      JdbcDataSources.close(_dataSource);
    } catch (SQLException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to close the data source of " + _tableName, e,
          CheckpointStorageException::new);
    }
  }

  @Override
  public String toString() {
    return "FlashCheckpointStore{table=" + _tableName + ", clusterId=" + _clusterId + "}";
  }
}
