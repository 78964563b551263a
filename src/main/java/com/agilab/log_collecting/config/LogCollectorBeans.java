package com.agilab.log_collecting.config;

import com.agilab.log_collecting.access.LocalFileAccess;
import com.agilab.log_collecting.access.RemoteFileAccess;
import com.agilab.log_collecting.archive.ArchiveHandler;
import com.agilab.log_collecting.exception.TransferException;
import com.agilab.log_collecting.remote.JschSshConnector;
import com.agilab.log_collecting.remote.RemoteSession;
import com.agilab.log_collecting.remote.SshConnector;
import com.jcraft.jsch.JSch;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wiring of the collection engine. The SSH session is shared by every component that talks to the remote host.
 */
@Configuration
public class LogCollectorBeans {

    /**
     * Retries single-file transfers. Missing paths and permission problems are not retried.
     */
    @Bean
    public RetryTemplate transferRetryTemplate(LogCollectorProperties properties) {
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, properties.getRetryAttempts()))
                .fixedBackoff(properties.getRetryDelay().toMillis())
                .retryOn(List.of(TransferException.class))
                .build();
    }

    @Bean
    public JSch jsch() {
        return new JSch();
    }

    @Bean
    public SshConnector sshConnector(JSch jsch) {
        return new JschSshConnector(jsch);
    }

    @Bean
    public RemoteSession remoteSession(SshConnector sshConnector) {
        return new RemoteSession(sshConnector);
    }

    @Bean
    public LocalFileAccess localFileAccess() {
        return new LocalFileAccess();
    }

    @Bean
    public RemoteFileAccess remoteFileAccess(RemoteSession remoteSession, LogCollectorProperties properties) {
        return new RemoteFileAccess(remoteSession, properties.getCommandTimeout());
    }

    @Bean
    public ArchiveHandler archiveHandler(RemoteSession remoteSession, LogCollectorProperties properties) {
        return new ArchiveHandler(remoteSession, properties.getRemoteCompressionTimeout());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService collectionExecutor() {
        var threadFactory = new CustomizableThreadFactory("log-collection-");
        threadFactory.setDaemon(true);
        return Executors.newSingleThreadExecutor(threadFactory);
    }
}
