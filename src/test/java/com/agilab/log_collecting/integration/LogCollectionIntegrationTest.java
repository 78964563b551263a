package com.agilab.log_collecting.integration;

import com.agilab.log_collecting.CollectionJobLauncher;
import com.agilab.log_collecting.CollectionOrchestrator;
import com.agilab.log_collecting.config.LogCollectorProperties;
import com.agilab.log_collecting.model.FilterKind;
import com.agilab.log_collecting.model.SourceConfig;
import com.agilab.log_collecting.model.SourceKind;
import com.agilab.log_collecting.remote.RemoteSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cloud.stream.binder.test.OutputDestination;
import org.springframework.cloud.stream.binder.test.TestChannelBinderConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.messaging.Message;
import org.springframework.test.context.TestPropertySource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs a local collection through the application context and checks the published completion event.
 */
@SpringBootTest
@Import(TestChannelBinderConfiguration.class)
@TestPropertySource(properties = {
        "spring.cloud.stream.default-binder=integration",
        "spring.cloud.stream.bindings.collectionCompleted-out-0.destination=log-collection-completed",
        "log-collector.notification-binding=collectionCompleted-out-0",
        "log-collector.retry-attempts=2",
        "log-collector.retry-delay=PT0.01S",
        "log-collector.collect-on-startup=false"
})
class LogCollectionIntegrationTest {

    @Autowired
    private OutputDestination outputDestination;

    @Autowired
    private CollectionOrchestrator orchestrator;

    @Autowired
    private CollectionJobLauncher launcher;

    @Autowired
    private LogCollectorProperties properties;

    @Autowired
    private RemoteSession remoteSession;

    @TempDir
    Path tempDir;

    @Test
    void shouldCollectLocalLogsAndPublishCompletion() throws IOException {
        var source = createSource();
        var destination = tempDir.resolve("dst");

        var result = orchestrator.collect(clientConfig(source), destination, null, null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCollectedFiles()).isEqualTo(2);
        assertThat(destination.resolve("sub/b.log")).exists();

        Message<byte[]> message = outputDestination.receive(Duration.ofSeconds(5).toMillis(), "log-collection-completed");
        assertThat(message).isNotNull();
        var payload = new String(message.getPayload(), StandardCharsets.UTF_8);
        assertThat(payload).contains("\"collectedFiles\":2").contains("\"success\":true");
    }

    @Test
    void shouldRunSubmittedJobOnWorker() throws Exception {
        var source = createSource();

        var job = launcher.submit(clientConfig(source), tempDir.resolve("job-dst"));

        var result = job.result().get(10, TimeUnit.SECONDS);
        assertThat(result.getCollectedFiles()).isEqualTo(2);
        assertThat(job.progress().drain()).isNotEmpty();
    }

    @Test
    void shouldBindSourcesFromConfiguration() {
        var kernel = properties.sourceConfig(SourceKind.KERNEL_LOG);

        assertThat(kernel.isRemote()).isTrue();
        assertThat(kernel.path()).isEqualTo("/var/log");
        assertThat(kernel.filterKind()).isEqualTo(FilterKind.REGEX);
        assertThat(properties.sessionConfig().port()).isEqualTo(22);
        assertThat(remoteSession.isConnected()).isFalse();
    }

    private Path createSource() throws IOException {
        var source = Files.createDirectories(tempDir.resolve("src"));
        Files.write(source.resolve("a.log"), new byte[100]);
        Files.createDirectories(source.resolve("sub"));
        Files.write(source.resolve("sub/b.log"), new byte[50]);
        return source;
    }

    private static SourceConfig clientConfig(Path source) {
        return SourceConfig.builder()
                .sourceKind(SourceKind.CLIENT_LOG)
                .path(source.toString())
                .enabled(true)
                .filterKind(FilterKind.ALL)
                .build();
    }
}
