/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.kafka;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.commons.lang3.Validate;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.config.TopicConfig;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linkedin.drainer.checkpoint.CheckpointConfig;
import com.linkedin.drainer.checkpoint.CheckpointStorageException;
import com.linkedin.drainer.checkpoint.CheckpointStore;
import com.linkedin.drainer.checkpoint.CheckpointStoreFactory;
import com.linkedin.drainer.checkpoint.CheckpointType;
import com.linkedin.drainer.common.ErrorLogger;


/**
 * Creates {@link KafkaCheckpointStore}s. Makes sure the compacted checkpoint topic exists before handing out the
 * store.
 */
public class KafkaCheckpointStoreFactory implements CheckpointStoreFactory {
  private static final Logger LOG = LoggerFactory.getLogger(KafkaCheckpointStoreFactory.class);

  static final String CLIENT_ID_PREFIX = "drainer-checkpoint-";
  static final String DELETE_RETENTION_MS = "3600000";

  @Override
  public CheckpointStore createStore(CheckpointType type, CheckpointConfig config) {
    Validate.isTrue(type == CheckpointType.KAFKA, "unexpected checkpoint type " + type);
    String bootstrapServers = config.requireKafkaBootstrapServers();
    LOG.info("Creating {} checkpoint store on topic {} at {}", type, config.getKafkaTopic(), bootstrapServers);

    try (Admin admin = Admin.create(adminProperties(config))) {
      createTopicIfAbsent(admin, config);
    }

    Producer<String, String> producer = new KafkaProducer<>(producerProperties(config));
    try {
      Consumer<String, String> consumer = new KafkaConsumer<>(consumerProperties(config));
      return new KafkaCheckpointStore(producer, consumer, config);
    } catch (RuntimeException e) {
      producer.close(config.getKafkaTimeout());
      throw e;
    }
  }

  static void createTopicIfAbsent(Admin admin, CheckpointConfig config) {
    String topic = config.getKafkaTopic();
    try {
      admin.createTopics(Collections.singletonList(newCheckpointTopic(config)))
          .all()
          .get(config.getKafkaTimeout().toMillis(), TimeUnit.MILLISECONDS);
      LOG.info("Created checkpoint topic {}", topic);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw ErrorLogger.logAndWrap(LOG, "Interrupted while creating checkpoint topic " + topic, e,
          CheckpointStorageException::new);
    } catch (ExecutionException e) {
      if (!(e.getCause() instanceof TopicExistsException)) {
        throw ErrorLogger.logAndWrap(LOG, "Failed to create checkpoint topic " + topic, e.getCause(),
            CheckpointStorageException::new);
      }
      LOG.info("Checkpoint topic {} already exists", topic);
    } catch (TimeoutException | KafkaException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to create checkpoint topic " + topic, e,
          CheckpointStorageException::new);
    }
  }

  /**
   * One partition keeps the checkpoint messages ordered; compaction keeps only the latest one per cluster id.
   */
  static NewTopic newCheckpointTopic(CheckpointConfig config) {
    Map<String, String> topicConfig = new HashMap<>();
    topicConfig.put(TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_COMPACT);
    topicConfig.put(TopicConfig.DELETE_RETENTION_MS_CONFIG, DELETE_RETENTION_MS);
    return new NewTopic(config.getKafkaTopic(), Optional.of(1), Optional.empty()).configs(topicConfig);
  }

  static Properties adminProperties(CheckpointConfig config) {
    Properties props = new Properties();
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.requireKafkaBootstrapServers());
    props.put(AdminClientConfig.CLIENT_ID_CONFIG, CLIENT_ID_PREFIX + config.getClusterId() + "-admin");
    return props;
  }

  static Properties producerProperties(CheckpointConfig config) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.requireKafkaBootstrapServers());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, CLIENT_ID_PREFIX + config.getClusterId() + "-producer");
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, String.valueOf(config.getKafkaTimeout().toMillis()));
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return props;
  }

  static Properties consumerProperties(CheckpointConfig config) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.requireKafkaBootstrapServers());
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, CLIENT_ID_PREFIX + config.getClusterId() + "-consumer");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, String.valueOf(config.getKafkaTimeout().toMillis()));
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    return props;
  }
}
