package com.agilab.log_collecting.access;

import com.agilab.log_collecting.exception.NotConnectedException;
import com.agilab.log_collecting.exception.TransferException;
import com.agilab.log_collecting.model.CommandResult;
import com.agilab.log_collecting.remote.RemoteSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RemoteFileAccessTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @Mock
    private RemoteSession session;

    private RemoteFileAccess access;

    @BeforeEach
    void setUp() {
        access = new RemoteFileAccess(session, TIMEOUT);
    }

    @Test
    void directoryExistsQuotesPathAndChecksMarker() {
        when(session.executeCommand("test -d '/var/my logs' && echo exists", TIMEOUT))
                .thenReturn(new CommandResult("exists\n", "", 0));

        assertThat(access.directoryExists("/var/my logs")).isTrue();
    }

    @Test
    void fileExistsIsFalseOnNonZeroExit() {
        when(session.executeCommand(anyString(), eq(TIMEOUT))).thenReturn(new CommandResult("", "", 1));

        assertThat(access.fileExists("/var/log/none.log")).isFalse();
    }

    @Test
    void existsIsFalseWhenProbeFails() {
        when(session.executeCommand(anyString(), eq(TIMEOUT)))
                .thenThrow(new NotConnectedException("/var/log", "Not connected"));

        assertThat(access.exists("/var/log")).isFalse();
    }

    @Test
    void availableSpaceParsesDfOutput() {
        when(session.executeCommand("df -B1 '/var/log' | tail -1 | awk '{print $4}'", TIMEOUT))
                .thenReturn(new CommandResult("52428800\n", "", 0));

        assertThat(access.availableSpace("/var/log")).isEqualTo(52_428_800L);
    }

    @Test
    void availableSpaceIsZeroOnUnexpectedOutput() {
        when(session.executeCommand(anyString(), eq(TIMEOUT))).thenReturn(new CommandResult("Avail\n", "", 0));

        assertThat(access.availableSpace("/var/log")).isZero();
    }

    @Test
    void createDirectoryRunsMkdirAndReportsFailure() {
        when(session.executeCommand("mkdir -p '/tmp/a'", TIMEOUT)).thenReturn(new CommandResult("", "", 0));
        when(session.executeCommand("mkdir -p '/root/x'", TIMEOUT))
                .thenReturn(new CommandResult("", "mkdir: Permission denied", 1));

        access.createDirectory("/tmp/a");

        assertThatThrownBy(() -> access.createDirectory("/root/x")).isInstanceOf(TransferException.class);
    }

    @Test
    void listingAndDeletionDelegateToSession() {
        access.listFiles("/var/log");
        access.delete("/var/log/old.log");

        verify(session).listFiles("/var/log", true);
        verify(session).deleteFile("/var/log/old.log");
    }
}
