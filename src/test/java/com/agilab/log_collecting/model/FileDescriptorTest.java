package com.agilab.log_collecting.model;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileDescriptorTest {

    @Test
    void remoteFullPathUsesForwardSlash() {
        var file = new FileDescriptor("sub/b.log", "/var/log", 10, Instant.EPOCH, true);

        assertThat(file.fullPath()).isEqualTo("/var/log/sub/b.log");
    }

    @Test
    void fullPathDoesNotDoubleTrailingSeparator() {
        var file = new FileDescriptor("kern.log", "/var/log/", 10, Instant.EPOCH, true);

        assertThat(file.fullPath()).isEqualTo("/var/log/kern.log");
    }

    @Test
    void localFullPathUsesPlatformSeparator() {
        var file = new FileDescriptor("a.log", "logs", 10, Instant.EPOCH, false);

        assertThat(file.fullPath()).isEqualTo("logs" + File.separator + "a.log");
    }

    @Test
    void rejectsEmptyOrAbsoluteNames() {
        assertThatThrownBy(() -> new FileDescriptor("", "/var/log", 0, Instant.EPOCH, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FileDescriptor("/etc/passwd", "/var/log", 0, Instant.EPOCH, true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
