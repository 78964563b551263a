package com.agilab.log_collecting;

import com.agilab.log_collecting.config.LogCollectorProperties;
import com.agilab.log_collecting.exception.AuthenticationException;
import com.agilab.log_collecting.model.CollectionResult;
import com.agilab.log_collecting.model.SourceKind;
import com.agilab.log_collecting.remote.RemoteSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StartupCollectionRunnerTest {

    @Mock
    private CollectionOrchestrator orchestrator;

    @Mock
    private RemoteSession remoteSession;

    private LogCollectorProperties properties;
    private StartupCollectionRunner runner;

    @BeforeEach
    void setUp() {
        properties = new LogCollectorProperties();
        properties.getSsh().setHost("controller");
        properties.setDestinationDirectory("/tmp/collected");
        runner = new StartupCollectionRunner(orchestrator, remoteSession, properties);
    }

    @Test
    void collectsEnabledSourcesAndDisconnects() {
        properties.getSources().put(SourceKind.SERVER_LOG, source("/opt/logs"));
        properties.getSources().put(SourceKind.CLIENT_LOG, source("/home/user/logs"));
        when(remoteSession.isConnected()).thenReturn(true);
        when(orchestrator.collect(any(), any(), any(), any())).thenReturn(new CollectionResult());

        runner.run(new DefaultApplicationArguments());

        verify(remoteSession).connect(argThat(config -> "controller".equals(config.host())));
        verify(orchestrator).collect(argThat(config -> config.sourceKind() == SourceKind.SERVER_LOG), any(), any(), any());
        verify(orchestrator).collect(argThat(config -> config.sourceKind() == SourceKind.CLIENT_LOG), any(), any(), any());
        verify(remoteSession).disconnect();
    }

    @Test
    void skipsRemoteSourcesWhenConnectionFails() {
        properties.getSources().put(SourceKind.KERNEL_LOG, source("/var/log"));
        doThrow(new AuthenticationException("controller:22", "Authentication failed"))
                .when(remoteSession).connect(any());

        runner.run(new DefaultApplicationArguments());

        verify(orchestrator, never()).collect(any(), any(), any(), any());
        verify(remoteSession).disconnect();
    }

    @Test
    void localOnlyConfigurationNeverTouchesSession() {
        properties.getSources().put(SourceKind.CLIENT_LOG, source("/home/user/logs"));
        when(orchestrator.collect(any(), any(), any(), any())).thenReturn(new CollectionResult());

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(remoteSession);
    }

    private static LogCollectorProperties.Source source(String path) {
        var source = new LogCollectorProperties.Source();
        source.setPath(path);
        return source;
    }
}
