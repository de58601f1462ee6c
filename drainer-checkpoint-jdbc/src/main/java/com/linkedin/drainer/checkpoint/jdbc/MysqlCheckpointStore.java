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
 * Keeps the checkpoint as one row per cluster in a MySQL compatible database (MySQL, TiDB):
 * <pre>
 *   CREATE TABLE tidb_binlog.checkpoint (clusterID BIGINT PRIMARY KEY, checkPoint MEDIUMTEXT)
 * </pre>
 * The row is replaced with a single {@code REPLACE INTO}, so a save either fully lands or leaves the old row.
 */
public class MysqlCheckpointStore implements CheckpointStore {
  private static final Logger LOG = LoggerFactory.getLogger(MysqlCheckpointStore.class);

  private static final String CREATE_SCHEMA = "CREATE SCHEMA IF NOT EXISTS %s";
  private static final String CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS %s (clusterID BIGINT PRIMARY KEY, checkPoint MEDIUMTEXT)";
  private static final String SELECT_CHECKPOINT = "SELECT checkPoint FROM %s WHERE clusterID = ?";
  private static final String REPLACE_CHECKPOINT = "REPLACE INTO %s (clusterID, checkPoint) VALUES (?, ?)";

  private final DataSource _dataSource;
  private final long _clusterId;
  private final String _tableName;
  private final int _queryTimeoutSeconds;

  /**
   * Constructor for MysqlCheckpointStore. Creates the checkpoint schema and table if missing.
   * @param dataSource connection pool owned by this store from now on
   * @param config checkpoint configuration
   * @throws CheckpointStorageException if the table cannot be created
   */
  public MysqlCheckpointStore(DataSource dataSource, CheckpointConfig config) {
    Validate.notNull(dataSource, "null data source");
    Validate.notNull(config, "null checkpoint config");
    _dataSource = dataSource;
    _clusterId = config.getClusterId();
    _tableName = config.getSchema() + "." + config.getTable();
    _queryTimeoutSeconds = config.getDbQueryTimeoutSeconds();

    try (Connection conn = _dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.setQueryTimeout(_queryTimeoutSeconds);
      stmt.execute(String.format(CREATE_SCHEMA, config.getSchema()));
      stmt.execute(String.format(CREATE_TABLE, _tableName));
    } catch (SQLException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to create checkpoint table " + _tableName, e,
          CheckpointStorageException::new);
    }
    LOG.info("Using checkpoint table {} for cluster {}", _tableName, _clusterId);
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
      }
    } catch (SQLException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to read checkpoint of cluster " + _clusterId + " from " + _tableName,
          e, CheckpointStorageException::new);
    }
    return CheckpointRecord.fromJson(json, _tableName);
  }

  @Override
  public void save(CheckpointRecord record) {
    try (Connection conn = _dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(String.format(REPLACE_CHECKPOINT, _tableName))) {
      stmt.setQueryTimeout(_queryTimeoutSeconds);
      stmt.setLong(1, _clusterId);
      stmt.setString(2, record.toJson());
      stmt.executeUpdate();
    } catch (SQLException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to save checkpoint " + record + " to " + _tableName, e,
          CheckpointStorageException::new);
    }
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
    return "MysqlCheckpointStore{table=" + _tableName + ", clusterId=" + _clusterId + "}";
  }
}
