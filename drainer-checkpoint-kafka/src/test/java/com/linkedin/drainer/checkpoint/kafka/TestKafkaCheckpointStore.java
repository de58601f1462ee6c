/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.kafka;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.NotEnoughReplicasException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.linkedin.drainer.checkpoint.CheckpointConfig;
import com.linkedin.drainer.checkpoint.CheckpointCorruptedException;
import com.linkedin.drainer.checkpoint.CheckpointRecord;
import com.linkedin.drainer.checkpoint.CheckpointStorageException;
import com.linkedin.drainer.checkpoint.CheckpointType;
import com.linkedin.drainer.checkpoint.DefaultCheckpoint;
import com.linkedin.drainer.testutil.BaseCheckpointTest;
import com.linkedin.drainer.testutil.CheckpointTestUtils;
import com.linkedin.drainer.testutil.ManualTicker;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;


/**
 * Runs the Kafka checkpoint store over mock clients. Every store gets its own producer; the consumer of a new
 * store sees everything the producers of earlier stores in the same test method have sent, like a real topic would.
 */
public class TestKafkaCheckpointStore extends BaseCheckpointTest {
  private static final String TOPIC = "6842_checkpoint";
  private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

  private CheckpointConfig _config;
  private List<MockProducer<String, String>> _producers;
  private List<ProducerRecord<String, String>> _extraMessages;

  @BeforeMethod(alwaysRun = true)
  public void setupTopic() {
    _config = CheckpointTestUtils.config(CheckpointConfig.CONFIG_CLUSTER_ID, "6842",
        CheckpointConfig.CONFIG_KAFKA_BOOTSTRAP_SERVERS, "localhost:9092",
        CheckpointConfig.CONFIG_KAFKA_TIMEOUT_MS, "500");
    _producers = new ArrayList<>();
    _extraMessages = new ArrayList<>();
  }

  @Override
  protected DefaultCheckpoint createCheckpoint(ManualTicker ticker) {
    return CheckpointTestUtils.newCheckpoint(CheckpointType.KAFKA, newStore(), _config, ticker);
  }

  private KafkaCheckpointStore newStore() {
    MockConsumer<String, String> consumer = newConsumer(topicContent());
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    _producers.add(producer);
    return new KafkaCheckpointStore(producer, consumer, _config);
  }

  private List<ProducerRecord<String, String>> topicContent() {
    List<ProducerRecord<String, String>> content = new ArrayList<>(_extraMessages);
    for (MockProducer<String, String> producer : _producers) {
      content.addAll(producer.history());
    }
    return content;
  }

  private static MockConsumer<String, String> newConsumer(List<ProducerRecord<String, String>> messages) {
    MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    consumer.updateBeginningOffsets(Collections.singletonMap(PARTITION, 0L));
    consumer.updateEndOffsets(Collections.singletonMap(PARTITION, (long) messages.size()));
    consumer.schedulePollTask(() -> {
      for (int i = 0; i < messages.size(); i++) {
        ProducerRecord<String, String> message = messages.get(i);
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, i, message.key(), message.value()));
      }
    });
    return consumer;
  }

  @Test
  public void testMessagesAreKeyedByClusterId() {
    KafkaCheckpointStore store = newStore();
    store.save(new CheckpointRecord(100));

    List<ProducerRecord<String, String>> history = _producers.get(0).history();
    Assert.assertEquals(history.size(), 1);
    Assert.assertEquals(history.get(0).topic(), TOPIC);
    Assert.assertEquals(history.get(0).partition(), Integer.valueOf(0));
    Assert.assertEquals(history.get(0).key(), "6842");
    Assert.assertEquals(history.get(0).value(), "{\"commitTS\":100}");
    store.close();
    Assert.assertTrue(_producers.get(0).closed());
  }

  @Test
  public void testOtherClustersAndTombstonesOnTheTopic() {
    _extraMessages.add(new ProducerRecord<>(TOPIC, "6842", new CheckpointRecord(10).toJson()));
    _extraMessages.add(new ProducerRecord<>(TOPIC, "7000", new CheckpointRecord(20).toJson()));
    KafkaCheckpointStore store = newStore();
    Assert.assertEquals(store.load(), new CheckpointRecord(10));
    store.close();

    _extraMessages.add(new ProducerRecord<>(TOPIC, "6842", null));
    KafkaCheckpointStore afterTombstone = newStore();
    Assert.assertNull(afterTombstone.load());
    afterTombstone.close();
  }

  @Test
  public void testCorruptedMessageFailsLoad() {
    _extraMessages.add(new ProducerRecord<>(TOPIC, "6842", "{not json"));
    KafkaCheckpointStore store = newStore();
    Assert.assertThrows(CheckpointCorruptedException.class, store::load);
    store.close();
  }

  @Test
  public void testLoadTimesOutWhenEndOffsetIsNotReached() {
    MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    consumer.updateBeginningOffsets(Collections.singletonMap(PARTITION, 0L));
    consumer.updateEndOffsets(Collections.singletonMap(PARTITION, 5L));
    KafkaCheckpointStore store = new KafkaCheckpointStore(
        new MockProducer<>(true, new StringSerializer(), new StringSerializer()), consumer, _config);

    CheckpointStorageException e = Assert.expectThrows(CheckpointStorageException.class, store::load);
    Assert.assertTrue(e.getMessage().contains("Timed out"));
    store.close();
  }

  @Test
  public void testConsumerFailureIsReported() {
    MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    consumer.setPollException(new KafkaException("broker gone"));
    consumer.updateBeginningOffsets(Collections.singletonMap(PARTITION, 0L));
    consumer.updateEndOffsets(Collections.singletonMap(PARTITION, 1L));
    KafkaCheckpointStore store = new KafkaCheckpointStore(
        new MockProducer<>(true, new StringSerializer(), new StringSerializer()), consumer, _config);

    CheckpointStorageException e = Assert.expectThrows(CheckpointStorageException.class, store::load);
    Assert.assertTrue(e.getCause() instanceof KafkaException);
    store.close();
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testFailedSendKeepsPreviousCheckpoint() {
    KafkaCheckpointStore first = newStore();
    first.save(new CheckpointRecord(100));
    first.close();

    Producer<String, String> producer = Mockito.mock(Producer.class);
    CompletableFuture<RecordMetadata> failed = new CompletableFuture<>();
    failed.completeExceptionally(new NotEnoughReplicasException("not enough replicas"));
    when(producer.send(any(ProducerRecord.class))).thenReturn(failed);

    KafkaCheckpointStore store = new KafkaCheckpointStore(producer, newConsumer(topicContent()), _config);
    Assert.assertEquals(store.load(), new CheckpointRecord(100));
    CheckpointStorageException e =
        Assert.expectThrows(CheckpointStorageException.class, () -> store.save(new CheckpointRecord(200)));
    Assert.assertTrue(e.getCause() instanceof NotEnoughReplicasException);
    store.close();
    Mockito.verify(producer).close(Duration.ofMillis(500));

    KafkaCheckpointStore reopened = newStore();
    Assert.assertEquals(reopened.load(), new CheckpointRecord(100));
    reopened.close();
  }
}
