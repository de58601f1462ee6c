/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.jdbc;

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
 * Creates {@link FlashCheckpointStore}s, talking to the columnar store over the ClickHouse JDBC driver.
 */
public class FlashCheckpointStoreFactory implements CheckpointStoreFactory {
  private static final Logger LOG = LoggerFactory.getLogger(FlashCheckpointStoreFactory.class);

  private static final String URL_FORMAT = "jdbc:clickhouse://%s:%d/";

  @Override
  public CheckpointStore createStore(CheckpointType type, CheckpointConfig config) {
    Validate.isTrue(type == CheckpointType.FLASH, "unexpected checkpoint type " + type);
    String url = config.getDbUrl() != null
        ? config.getDbUrl()
        : String.format(URL_FORMAT, config.getDbHost(), config.getDbPort());
    LOG.info("Creating {} checkpoint store at {}", type, url);

    BasicDataSource dataSource = JdbcDataSources.create(url, config.getDbUser(), config.getDbPassword(),
        Duration.ofSeconds(Math.max(1, config.getDbQueryTimeoutSeconds())));
    try {
      return new FlashCheckpointStore(dataSource, config);
    } catch (RuntimeException e) {
      MysqlCheckpointStoreFactory.closeAfterFailure(dataSource, e);
      throw e;
    }
  }
}
