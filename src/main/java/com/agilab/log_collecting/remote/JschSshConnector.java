package com.agilab.log_collecting.remote;

import com.agilab.log_collecting.model.SessionConfig;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Properties;

/**
 * Password-only connector. Host keys are accepted without verification, agents and key files are not consulted.
 */
@Slf4j
@RequiredArgsConstructor
public class JschSshConnector implements SshConnector {

    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(300);

    private final JSch jsch;

    @Override
    public Session open(SessionConfig config) throws JSchException {
        var timeout = connectTimeoutMillis(config);
        var session = jsch.getSession(config.username(), config.host(), config.port());
        session.setPassword(config.password());
        var sshConfig = new Properties();
        sshConfig.put("StrictHostKeyChecking", "no");
        sshConfig.put("PreferredAuthentications", "password");
        session.setConfig(sshConfig);
        session.setTimeout(timeout);
        log.debug("Opening SSH transport to {} (timeout {} ms)", config.describe(), timeout);
        session.connect(timeout);
        return session;
    }

    static int connectTimeoutMillis(SessionConfig config) {
        var timeout = config.connectTimeout() == null ? DEFAULT_CONNECT_TIMEOUT : config.connectTimeout();
        return (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    }
}
