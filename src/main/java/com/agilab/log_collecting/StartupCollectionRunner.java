package com.agilab.log_collecting;

import com.agilab.log_collecting.config.LogCollectorProperties;
import com.agilab.log_collecting.exception.ConnectionException;
import com.agilab.log_collecting.model.SourceConfig;
import com.agilab.log_collecting.model.SourceKind;
import com.agilab.log_collecting.remote.RemoteSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Headless mode: collects every enabled source once at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "log-collector", name = "collect-on-startup", havingValue = "true")
public class StartupCollectionRunner implements ApplicationRunner {

    private final CollectionOrchestrator orchestrator;
    private final RemoteSession remoteSession;
    private final LogCollectorProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        var sources = Arrays.stream(SourceKind.values())
                .map(properties::sourceConfig)
                .filter(SourceConfig::enabled)
                .toList();
        if (sources.isEmpty()) {
            log.warn("No enabled log sources configured");
            return;
        }

        var needsRemote = sources.stream().anyMatch(SourceConfig::isRemote);
        if (needsRemote) {
            try {
                remoteSession.connect(properties.sessionConfig());
            } catch (ConnectionException e) {
                log.error("Cannot connect to {}: {}", properties.sessionConfig().describe(), e.getMessage());
            }
        }
        try {
            var destination = Paths.get(properties.getDestinationDirectory());
            for (var source : sources) {
                if (source.isRemote() && !remoteSession.isConnected()) {
                    log.warn("Skipping {}: not connected", source.displayName());
                    continue;
                }
                var result = orchestrator.collect(source, destination, null, null);
                log.info("{}: {}", source.displayName(), result.summary());
            }
        } finally {
            if (needsRemote) {
                remoteSession.disconnect();
            }
        }
    }
}
