/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.kafka;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.commons.lang3.Validate;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linkedin.drainer.checkpoint.CheckpointConfig;
import com.linkedin.drainer.checkpoint.CheckpointRecord;
import com.linkedin.drainer.checkpoint.CheckpointStorageException;
import com.linkedin.drainer.checkpoint.CheckpointStore;
import com.linkedin.drainer.common.ErrorLogger;

import static java.util.Collections.singletonList;


/**
 * Keeps the checkpoint as the latest message for the cluster id in a single partition, compacted topic.
 * Saves wait for the broker acknowledgement. Loads read the partition from the beginning up to the end offset
 * seen when the load started and keep the last value written for the cluster id.
 */
public class KafkaCheckpointStore implements CheckpointStore {
  private static final Logger LOG = LoggerFactory.getLogger(KafkaCheckpointStore.class);

  static final Duration POLL_INTERVAL = Duration.ofMillis(100);

  private final Producer<String, String> _producer;
  private final Consumer<String, String> _consumer;
  private final String _topic;
  private final TopicPartition _topicPartition;
  private final String _key;
  private final Duration _timeout;

  /**
   * Constructor for KafkaCheckpointStore
   * @param producer producer writing to the checkpoint topic; owned by this store from now on
   * @param consumer consumer not subscribed to anything; owned by this store from now on
   * @param config checkpoint configuration, provides the topic, the cluster id and the timeout
   */
  public KafkaCheckpointStore(Producer<String, String> producer, Consumer<String, String> consumer,
      CheckpointConfig config) {
    Validate.notNull(producer, "null producer");
    Validate.notNull(consumer, "null consumer");
    Validate.notNull(config, "null checkpoint config");
    _producer = producer;
    _consumer = consumer;
    _topic = config.getKafkaTopic();
    _topicPartition = new TopicPartition(_topic, 0);
    _key = String.valueOf(config.getClusterId());
    _timeout = config.getKafkaTimeout();

    _consumer.assign(singletonList(_topicPartition));
    LOG.info("Using checkpoint topic {} with key {}", _topic, _key);
  }

  @Override
  public CheckpointRecord load() {
    String value = null;
    try {
      long endOffset =
          _consumer.endOffsets(singletonList(_topicPartition), _timeout).getOrDefault(_topicPartition, 0L);
      _consumer.seekToBeginning(singletonList(_topicPartition));

      long deadline = System.nanoTime() + _timeout.toNanos();
      while (_consumer.position(_topicPartition, _timeout) < endOffset) {
        if (System.nanoTime() - deadline > 0) {
          String msg = String.format("Timed out after %s reading checkpoint topic %s up to offset %d", _timeout,
              _topic, endOffset);
          throw ErrorLogger.logAndWrap(LOG, msg, null, CheckpointStorageException::new);
        }
        for (ConsumerRecord<String, String> record : _consumer.poll(POLL_INTERVAL).records(_topicPartition)) {
          if (record.offset() < endOffset && _key.equals(record.key())) {
            value = record.value();
          }
        }
      }
    } catch (KafkaException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to read checkpoint topic " + _topic, e,
          CheckpointStorageException::new);
    }

    // no message, or a tombstone
    if (value == null) {
      LOG.info("No checkpoint for key {} in topic {}", _key, _topic);
      return null;
    }
    return CheckpointRecord.fromJson(value, "topic " + _topic);
  }

  @Override
  public void save(CheckpointRecord record) {
    try {
      _producer.send(new ProducerRecord<>(_topic, _topicPartition.partition(), _key, record.toJson()))
          .get(_timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw ErrorLogger.logAndWrap(LOG, "Interrupted while saving checkpoint " + record, e,
          CheckpointStorageException::new);
    } catch (ExecutionException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to save checkpoint " + record + " to topic " + _topic, e.getCause(),
          CheckpointStorageException::new);
    } catch (TimeoutException | KafkaException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to save checkpoint " + record + " to topic " + _topic, e,
          CheckpointStorageException::new);
    }
  }

  @Override
  public void close() {
    RuntimeException failure = null;
    try {
      _producer.close(_timeout);
    } catch (RuntimeException e) {
      failure = e;
    }
    try {
      _consumer.close(_timeout);
    } catch (RuntimeException e) {
      if (failure == null) {
        failure = e;
      } else {
        failure.addSuppressed(e);
      }
    }
    if (failure != null) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to close the clients of checkpoint topic " + _topic, failure,
          CheckpointStorageException::new);
    }
  }

  @Override
  public String toString() {
    return "KafkaCheckpointStore{topic=" + _topic + ", key=" + _key + "}";
  }
}
