package com.agilab.log_collecting.model;

import lombok.Builder;

import java.time.Duration;

@Builder(toBuilder = true)
public record SessionConfig(String host,
                            int port,
                            String username,
                            String password,
                            Duration connectTimeout,
                            boolean keepAliveEnabled,
                            int keepAliveIntervalSeconds) {

    public boolean isValid() {
        return host != null && !host.isBlank()
                && username != null && !username.isBlank()
                && port > 0;
    }

    /**
     * Host and port without credentials, for log lines.
     */
    public String describe() {
        return String.format("%s@%s:%d", username, host, port);
    }
}
