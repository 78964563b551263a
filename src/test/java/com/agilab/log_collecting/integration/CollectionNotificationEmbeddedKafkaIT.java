package com.agilab.log_collecting.integration;

import com.agilab.log_collecting.CollectionOrchestrator;
import com.agilab.log_collecting.LogCollectingApplication;
import com.agilab.log_collecting.event.CollectionCompletedEvent;
import com.agilab.log_collecting.model.FilterKind;
import com.agilab.log_collecting.model.SourceConfig;
import com.agilab.log_collecting.model.SourceKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.kafka.test.EmbeddedKafkaBroker;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.kafka.test.utils.ContainerTestUtils;
import org.springframework.kafka.test.utils.KafkaTestUtils;
import org.springframework.test.context.TestPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Completion events reach a real Kafka topic through the Kafka binder.
 */
@SpringBootTest(classes = LogCollectingApplication.class, properties = {
        "spring.cloud.stream.kafka.binder.brokers=${spring.embedded.kafka.brokers}",
        "spring.cloud.stream.default-binder=kafka"
})
@EmbeddedKafka(partitions = 1, topics = {"test-collection-topic"})
@TestPropertySource(properties = {
        "spring.cloud.stream.bindings.collectionCompleted-out-0.destination=test-collection-topic",
        "spring.cloud.stream.bindings.collectionCompleted-out-0.content-type=application/json",
        "log-collector.notification-binding=collectionCompleted-out-0",
        "log-collector.retry-attempts=1"
})
class CollectionNotificationEmbeddedKafkaIT {

    @Autowired
    private EmbeddedKafkaBroker embeddedKafka;

    @Autowired
    private CollectionOrchestrator orchestrator;

    @TempDir
    Path tempDir;

    private KafkaMessageListenerContainer<String, String> container;
    private BlockingQueue<ConsumerRecord<String, String>> records;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();

        var consumerProps = KafkaTestUtils.consumerProps("test-collection-group", "true", embeddedKafka);
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        var consumerFactory = new DefaultKafkaConsumerFactory<String, String>(consumerProps);
        container = new KafkaMessageListenerContainer<>(consumerFactory, new ContainerProperties("test-collection-topic"));
        records = new LinkedBlockingQueue<>();
        container.setupMessageListener((MessageListener<String, String>) records::add);
        container.start();
        ContainerTestUtils.waitForAssignment(container, embeddedKafka.getPartitionsPerTopic());
    }

    @AfterEach
    void tearDown() {
        if (container != null) {
            container.stop();
        }
    }

    @Test
    void shouldPublishCompletionEventForFinishedCollection() throws Exception {
        var source = Files.createDirectories(tempDir.resolve("src"));
        Files.write(source.resolve("a.log"), new byte[100]);
        var destination = tempDir.resolve("dst");

        var result = orchestrator.collect(config(source.toString()), destination, null, null);
        assertThat(result.isSuccess()).isTrue();

        ConsumerRecord<String, String> record = records.poll(10, TimeUnit.SECONDS);
        assertThat(record).isNotNull();
        var event = objectMapper.readValue(record.value(), CollectionCompletedEvent.class);
        assertThat(event.source()).isEqualTo("User software log");
        assertThat(event.collectedFiles()).isEqualTo(1);
        assertThat(event.totalBytes()).isEqualTo(100);
        assertThat(event.destinationDirectory()).isEqualTo(destination.toString());
    }

    @Test
    void shouldPublishFailedRunToo() throws IOException, InterruptedException {
        var result = orchestrator.collect(config(tempDir.resolve("missing").toString()), tempDir.resolve("dst"), null, null);
        assertThat(result.isSuccess()).isFalse();

        ConsumerRecord<String, String> record = records.poll(10, TimeUnit.SECONDS);
        assertThat(record).isNotNull();
        var event = objectMapper.readValue(record.value(), CollectionCompletedEvent.class);
        assertThat(event.success()).isFalse();
        assertThat(event.errorMessage()).contains("not found");
    }

    private static SourceConfig config(String path) {
        return SourceConfig.builder()
                .sourceKind(SourceKind.CLIENT_LOG)
                .path(path)
                .enabled(true)
                .filterKind(FilterKind.ALL)
                .build();
    }
}
