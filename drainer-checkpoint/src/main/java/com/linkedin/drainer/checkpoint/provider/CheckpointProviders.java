/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.provider;

import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Ticker;

import com.linkedin.drainer.checkpoint.CheckpointConfig;
import com.linkedin.drainer.checkpoint.CheckpointInitializationException;
import com.linkedin.drainer.checkpoint.CheckpointMetrics;
import com.linkedin.drainer.checkpoint.CheckpointStore;
import com.linkedin.drainer.checkpoint.CheckpointStoreFactory;
import com.linkedin.drainer.checkpoint.CheckpointType;
import com.linkedin.drainer.checkpoint.DefaultCheckpoint;
import com.linkedin.drainer.checkpoint.SaveThrottle;
import com.linkedin.drainer.checkpoint.UnsupportedCheckpointTypeException;
import com.linkedin.drainer.checkpoint.file.FileCheckpointStoreFactory;
import com.linkedin.drainer.checkpoint.jdbc.FlashCheckpointStoreFactory;
import com.linkedin.drainer.checkpoint.jdbc.MysqlCheckpointStoreFactory;
import com.linkedin.drainer.checkpoint.kafka.KafkaCheckpointStoreFactory;
import com.linkedin.drainer.common.ErrorLogger;


/**
 * Entry point for creating checkpoints: maps every {@link CheckpointType} to the {@link CheckpointStoreFactory}
 * building its store and wraps the store into a {@link DefaultCheckpoint}.
 *
 * <pre>
 *   Checkpoint checkpoint = CheckpointProviders.newCheckpoint("mysql", CheckpointConfig.fromDrainerProperties(props));
 *   checkpoint.load();
 * </pre>
 *
 * The returned checkpoint is not loaded yet.
 */
public class CheckpointProviders {
  private static final Logger LOG = LoggerFactory.getLogger(CheckpointProviders.class);

  private static final CheckpointProviders DEFAULT = new CheckpointProviders(new MetricRegistry());

  private final Map<CheckpointType, CheckpointStoreFactory> _factories = new EnumMap<>(CheckpointType.class);
  private final MetricRegistry _metricRegistry;
  private final Ticker _ticker;

  public CheckpointProviders(MetricRegistry metricRegistry) {
    this(metricRegistry, Ticker.systemTicker());
  }

  /**
   * Constructor for CheckpointProviders, with a factory registered for every checkpoint type.
   * @param metricRegistry registry the save metrics of created checkpoints are reported to
   * @param ticker time source of the save throttles
   */
  public CheckpointProviders(MetricRegistry metricRegistry, Ticker ticker) {
    Validate.notNull(metricRegistry, "null metric registry");
    Validate.notNull(ticker, "null ticker");
    _metricRegistry = metricRegistry;
    _ticker = ticker;

    MysqlCheckpointStoreFactory mysqlFactory = new MysqlCheckpointStoreFactory();
    _factories.put(CheckpointType.MYSQL, mysqlFactory);
    _factories.put(CheckpointType.TIDB, mysqlFactory);
    _factories.put(CheckpointType.FLASH, new FlashCheckpointStoreFactory());
    _factories.put(CheckpointType.FILE, new FileCheckpointStoreFactory());
    _factories.put(CheckpointType.KAFKA, new KafkaCheckpointStoreFactory());
  }

  /**
   * Create a checkpoint with the shared default providers.
   * @see #create(String, CheckpointConfig)
   */
  public static DefaultCheckpoint newCheckpoint(String typeName, CheckpointConfig config) {
    return DEFAULT.create(typeName, config);
  }

  /**
   * Replace the factory used for a checkpoint type.
   */
  public synchronized CheckpointProviders register(CheckpointType type, CheckpointStoreFactory factory) {
    Validate.notNull(type, "null checkpoint type");
    Validate.notNull(factory, "null checkpoint store factory");
    _factories.put(type, factory);
    return this;
  }

  /**
   * Create a checkpoint of the named type.
   * @param typeName one of the {@link CheckpointType} names, e.g. {@code mysql} or {@code file}
   * @param config checkpoint configuration
   * @return a new, not yet loaded checkpoint owning its store
   * @throws UnsupportedCheckpointTypeException if no checkpoint type has that name
   * @throws CheckpointInitializationException if the store cannot be created with the given configuration
   */
  public DefaultCheckpoint create(String typeName, CheckpointConfig config) {
    Validate.notNull(config, "null checkpoint config");
    CheckpointType type = CheckpointType.fromName(typeName);
    CheckpointStoreFactory factory;
    synchronized (this) {
      factory = _factories.get(type);
    }

    // nothing that can fail may run between creating the store and handing it to the checkpoint
    SaveThrottle throttle = new SaveThrottle(config.getSaveInterval(), _ticker);
    CheckpointMetrics metrics = new CheckpointMetrics(_metricRegistry, type);

    CheckpointStore store;
    try {
      store = factory.createStore(type, config);
    } catch (RuntimeException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to create " + type + " checkpoint store", e,
          (msg, cause) -> new CheckpointInitializationException(typeName, config, cause));
    }

    DefaultCheckpoint checkpoint = new DefaultCheckpoint(type, store, throttle, metrics, config.getInitialCommitTs());
    LOG.info("Created {} checkpoint over {} with config {}", type, store, config);
    return checkpoint;
  }
}
