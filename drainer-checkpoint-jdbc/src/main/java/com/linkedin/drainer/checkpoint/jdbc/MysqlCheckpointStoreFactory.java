/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.jdbc;

import java.sql.SQLException;
import java.time.Duration;

import org.apache.commons.dbcp2.BasicDataSource;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linkedin.drainer.checkpoint.CheckpointConfig;
import com.linkedin.drainer.checkpoint.CheckpointStore;
import com.linkedin.drainer.checkpoint.CheckpointStoreFactory;
import com.linkedin.drainer.checkpoint.CheckpointType;


/**
 * Creates {@link MysqlCheckpointStore}s for the {@code mysql} and {@code tidb} checkpoint types, which share the
 * MySQL wire protocol and dialect.
 */
public class MysqlCheckpointStoreFactory implements CheckpointStoreFactory {
  private static final Logger LOG = LoggerFactory.getLogger(MysqlCheckpointStoreFactory.class);

  private static final String URL_FORMAT = "jdbc:mysql://%s:%d/?useSSL=false&connectTimeout=%d";

  @Override
  public CheckpointStore createStore(CheckpointType type, CheckpointConfig config) {
    Validate.isTrue(type == CheckpointType.MYSQL || type == CheckpointType.TIDB,
        "unexpected checkpoint type " + type);
    String url = buildUrl(config);
    LOG.info("Creating {} checkpoint store at {}", type, url);

    BasicDataSource dataSource = JdbcDataSources.create(url, config.getDbUser(), config.getDbPassword(),
        Duration.ofSeconds(Math.max(1, config.getDbQueryTimeoutSeconds())));
    try {
      return new MysqlCheckpointStore(dataSource, config);
    } catch (RuntimeException e) {
      closeAfterFailure(dataSource, e);
      throw e;
    }
  }

  static String buildUrl(CheckpointConfig config) {
    if (config.getDbUrl() != null) {
      return config.getDbUrl();
    }
    long connectTimeoutMs = Duration.ofSeconds(Math.max(1, config.getDbQueryTimeoutSeconds())).toMillis();
    return String.format(URL_FORMAT, config.getDbHost(), config.getDbPort(), connectTimeoutMs);
  }

  // A failure to release the pool is attached to the construction failure being reported.
  static void closeAfterFailure(BasicDataSource dataSource, RuntimeException pending) {
    try {
      dataSource.close();
    } catch (SQLException e) {
      pending.addSuppressed(e);
    }
  }
}
