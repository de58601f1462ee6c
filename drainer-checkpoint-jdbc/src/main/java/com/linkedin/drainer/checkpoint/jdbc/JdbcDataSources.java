/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.jdbc;

import java.sql.SQLException;
import java.time.Duration;

import javax.sql.DataSource;

import org.apache.commons.dbcp2.BasicDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Creation and release of the connection pools backing the JDBC checkpoint stores.
 */
public final class JdbcDataSources {
  private static final Logger LOG = LoggerFactory.getLogger(JdbcDataSources.class);

  static final String VALIDATION_QUERY = "SELECT 1";

  private JdbcDataSources() {
  }

  /**
   * Create a pool holding at most one connection; a checkpoint store never issues concurrent statements.
   * @param url JDBC url
   * @param user user name
   * @param password password, may be empty
   * @param timeout how long to wait for the connection, also used as the validation timeout
   */
  public static BasicDataSource create(String url, String user, String password, Duration timeout) {
    BasicDataSource ds = new BasicDataSource();
    ds.setUrl(url);
    ds.setUsername(user);
    ds.setPassword(password);
    ds.setInitialSize(0);
    ds.setMinIdle(0);
    ds.setMaxIdle(1);
    ds.setMaxTotal(1);
    ds.setMaxWaitMillis(timeout.toMillis());
    ds.setValidationQuery(VALIDATION_QUERY);
    ds.setValidationQueryTimeout((int) Math.max(1, timeout.getSeconds()));
    ds.setTestOnBorrow(true);
    return ds;
  }

  /**
   * Close the data source if it holds resources. Data sources that are not {@link AutoCloseable} are left alone.
   * @throws SQLException if closing the pool fails
   */
  public static void close(DataSource dataSource) throws SQLException {
    if (dataSource instanceof AutoCloseable) {
      try {
        ((AutoCloseable) dataSource).close();
      } catch (SQLException e) {
        throw e;
      } catch (Exception e) {
        throw new SQLException("Failed to close data source", e);
      }
      LOG.debug("Closed data source {}", dataSource.getClass().getSimpleName());
    }
  }
}
