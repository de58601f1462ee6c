/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint;

import java.time.Duration;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import com.linkedin.drainer.common.VerifiableProperties;


/**
 * Immutable checkpoint configuration, read once from the {@code checkpoint.} domain of the drainer properties.
 * Properties every store type understands are validated here; properties only some types need (e.g. {@code dir}
 * for file checkpoints) are validated by the store factory through the {@code require*} accessors.
 */
public final class CheckpointConfig {

  public static final String DOMAIN = "checkpoint";

  public static final String CONFIG_CLUSTER_ID = "clusterId";
  public static final String CONFIG_INITIAL_COMMIT_TS = "initialCommitTs";
  public static final String CONFIG_SAVE_INTERVAL_MS = "saveIntervalMs";
  public static final String CONFIG_SCHEMA = "schema";
  public static final String CONFIG_TABLE = "table";
  public static final String CONFIG_DB_HOST = "db.host";
  public static final String CONFIG_DB_PORT = "db.port";
  public static final String CONFIG_DB_USER = "db.user";
  public static final String CONFIG_DB_PASSWORD = "db.password";
  public static final String CONFIG_DB_URL = "db.url";
  public static final String CONFIG_DB_QUERY_TIMEOUT_SECONDS = "db.queryTimeoutSeconds";
  public static final String CONFIG_DIR = "dir";
  public static final String CONFIG_KAFKA_BOOTSTRAP_SERVERS = "kafka.bootstrapServers";
  public static final String CONFIG_KAFKA_TOPIC = "kafka.topic";
  public static final String CONFIG_KAFKA_TIMEOUT_MS = "kafka.timeoutMs";

  public static final long DEFAULT_SAVE_INTERVAL_MS = 3000;
  public static final String DEFAULT_SCHEMA = "tidb_binlog";
  public static final String DEFAULT_TABLE = "checkpoint";
  public static final String DEFAULT_DB_HOST = "127.0.0.1";
  public static final int DEFAULT_DB_PORT = 3306;
  public static final String DEFAULT_DB_USER = "root";
  public static final int DEFAULT_DB_QUERY_TIMEOUT_SECONDS = 30;
  public static final long DEFAULT_KAFKA_TIMEOUT_MS = 30000;

  private final long _clusterId;
  private final long _initialCommitTs;
  private final Duration _saveInterval;
  private final String _schema;
  private final String _table;
  private final String _dbHost;
  private final int _dbPort;
  private final String _dbUser;
  private final String _dbPassword;
  private final String _dbUrl;
  private final int _dbQueryTimeoutSeconds;
  private final String _dir;
  private final String _kafkaBootstrapServers;
  private final String _kafkaTopic;
  private final Duration _kafkaTimeout;

  /**
   * Build the configuration from properties without the {@code checkpoint.} prefix.
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public CheckpointConfig(Properties properties) {
    VerifiableProperties props = new VerifiableProperties(properties);
    _clusterId = props.getLongInRange(CONFIG_CLUSTER_ID, 0, 0, Long.MAX_VALUE);
    _initialCommitTs = props.getLong(CONFIG_INITIAL_COMMIT_TS, 0);
    _saveInterval = Duration.ofMillis(
        props.getLongInRange(CONFIG_SAVE_INTERVAL_MS, DEFAULT_SAVE_INTERVAL_MS, 0, Long.MAX_VALUE));
    _schema = requireIdentifier(props.getString(CONFIG_SCHEMA, DEFAULT_SCHEMA), CONFIG_SCHEMA);
    _table = requireIdentifier(props.getString(CONFIG_TABLE, DEFAULT_TABLE), CONFIG_TABLE);
    _dbHost = props.getString(CONFIG_DB_HOST, DEFAULT_DB_HOST);
    _dbPort = props.getIntInRange(CONFIG_DB_PORT, DEFAULT_DB_PORT, 1, 65535);
    _dbUser = props.getString(CONFIG_DB_USER, DEFAULT_DB_USER);
    _dbPassword = props.getString(CONFIG_DB_PASSWORD, "");
    _dbUrl = StringUtils.trimToNull(props.getString(CONFIG_DB_URL, null));
    _dbQueryTimeoutSeconds =
        props.getIntInRange(CONFIG_DB_QUERY_TIMEOUT_SECONDS, DEFAULT_DB_QUERY_TIMEOUT_SECONDS, 0, Integer.MAX_VALUE);
    _dir = StringUtils.trimToNull(props.getString(CONFIG_DIR, null));
    _kafkaBootstrapServers = StringUtils.trimToNull(props.getString(CONFIG_KAFKA_BOOTSTRAP_SERVERS, null));
    _kafkaTopic = props.getString(CONFIG_KAFKA_TOPIC, _clusterId + "_checkpoint");
    _kafkaTimeout = Duration.ofMillis(
        props.getLongInRange(CONFIG_KAFKA_TIMEOUT_MS, DEFAULT_KAFKA_TIMEOUT_MS, 1, Long.MAX_VALUE));
    props.verify();
  }

  /**
   * Build the configuration from the {@code checkpoint.} domain of the full drainer properties.
   */
  public static CheckpointConfig fromDrainerProperties(Properties drainerProperties) {
    return new CheckpointConfig(new VerifiableProperties(drainerProperties).getDomainProperties(DOMAIN));
  }

  // Schema and table names are spliced into DDL, so only plain identifiers are accepted.
  private static String requireIdentifier(String value, String name) {
    if (value == null || !value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
      throw new IllegalArgumentException(name + " has value " + value + " which is not a valid identifier.");
    }
    return value;
  }

  public long getClusterId() {
    return _clusterId;
  }

  public long getInitialCommitTs() {
    return _initialCommitTs;
  }

  public Duration getSaveInterval() {
    return _saveInterval;
  }

  public String getSchema() {
    return _schema;
  }

  public String getTable() {
    return _table;
  }

  public String getDbHost() {
    return _dbHost;
  }

  public int getDbPort() {
    return _dbPort;
  }

  public String getDbUser() {
    return _dbUser;
  }

  public String getDbPassword() {
    return _dbPassword;
  }

  /**
   * @return the explicitly configured JDBC url, or null to derive it from host and port
   */
  @Nullable
  public String getDbUrl() {
    return _dbUrl;
  }

  public int getDbQueryTimeoutSeconds() {
    return _dbQueryTimeoutSeconds;
  }

  @Nullable
  public String getDir() {
    return _dir;
  }

  /**
   * @return the checkpoint directory
   * @throws IllegalArgumentException if no directory is configured
   */
  public String requireDir() {
    return require(_dir, CONFIG_DIR);
  }

  @Nullable
  public String getKafkaBootstrapServers() {
    return _kafkaBootstrapServers;
  }

  /**
   * @return the Kafka bootstrap servers
   * @throws IllegalArgumentException if none are configured
   */
  public String requireKafkaBootstrapServers() {
    return require(_kafkaBootstrapServers, CONFIG_KAFKA_BOOTSTRAP_SERVERS);
  }

  public String getKafkaTopic() {
    return _kafkaTopic;
  }

  public Duration getKafkaTimeout() {
    return _kafkaTimeout;
  }

  private static String require(String value, String name) {
    if (value == null) {
      throw new IllegalArgumentException("Missing required property '" + name + "'");
    }
    return value;
  }

  @Override
  public String toString() {
    return "CheckpointConfig{clusterId=" + _clusterId
        + ", initialCommitTs=" + _initialCommitTs
        + ", saveInterval=" + _saveInterval
        + ", schema=" + _schema
        + ", table=" + _table
        + ", db=" + _dbUser + "@" + (_dbUrl != null ? _dbUrl : _dbHost + ":" + _dbPort)
        + ", dbPassword=" + (_dbPassword.isEmpty() ? "" : "******")
        + ", dir=" + _dir
        + ", kafka=" + _kafkaBootstrapServers + "/" + _kafkaTopic
        + "}";
  }
}
