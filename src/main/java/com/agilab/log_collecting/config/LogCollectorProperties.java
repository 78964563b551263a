package com.agilab.log_collecting.config;

import com.agilab.log_collecting.model.FilterKind;
import com.agilab.log_collecting.model.SessionConfig;
import com.agilab.log_collecting.model.SourceConfig;
import com.agilab.log_collecting.model.SourceKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@ConfigurationProperties(prefix = "log-collector")
@Data
@Component
public class LogCollectorProperties {
    private Ssh ssh = new Ssh();
    private Map<SourceKind, Source> sources = new EnumMap<>(SourceKind.class);
    private String destinationDirectory = "collected-logs";
    private int compressionLevel = 6;
    private int retryAttempts = 3;
    private Duration retryDelay = Duration.ofSeconds(1);
    private String remoteTempDirectory = "/tmp";
    private Duration commandTimeout = Duration.ofSeconds(30);
    private Duration remoteCompressionTimeout = Duration.ofMinutes(10);
    private String notificationBinding = "";
    private boolean collectOnStartup = false;

    @Data
    public static class Ssh {
        private String host = "";
        private int port = 22;
        private String username = "root";
        private String password = "";
        private Duration connectTimeout = Duration.ofSeconds(300);
        private boolean keepAlive = true;
        private Duration keepAliveInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Source {
        private String path = "";
        private boolean enabled = true;
        private FilterKind filterKind = FilterKind.ALL;
        private String filterValue = "";
        private boolean compress = false;
        private boolean deleteAfterCollect = false;
    }

    public SessionConfig sessionConfig() {
        return SessionConfig.builder()
                .host(ssh.getHost())
                .port(ssh.getPort())
                .username(ssh.getUsername())
                .password(ssh.getPassword())
                .connectTimeout(ssh.getConnectTimeout())
                .keepAliveEnabled(ssh.isKeepAlive())
                .keepAliveIntervalSeconds((int) ssh.getKeepAliveInterval().toSeconds())
                .build();
    }

    /**
     * Settings for {@code kind}. A source missing from the configuration is reported as disabled.
     */
    public SourceConfig sourceConfig(SourceKind kind) {
        var source = sources.get(kind);
        if (source == null) {
            return SourceConfig.builder().sourceKind(kind).path("").enabled(false).build();
        }
        return SourceConfig.builder()
                .sourceKind(kind)
                .path(source.getPath())
                .enabled(source.isEnabled())
                .filterKind(source.getFilterKind())
                .filterValue(source.getFilterValue())
                .compress(source.isCompress())
                .deleteAfterCollect(source.isDeleteAfterCollect())
                .build();
    }
}
