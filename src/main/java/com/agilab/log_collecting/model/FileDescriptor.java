package com.agilab.log_collecting.model;

import java.io.File;
import java.time.Instant;

/**
 * Metadata of one discoverable file.
 *
 * @param name          path relative to {@code containerPath}, may contain subdirectory segments
 * @param containerPath directory the listing started from
 * @param sizeBytes     size in bytes
 * @param modifiedAt    last modification time
 * @param remote        whether the file lives on the remote host
 */
public record FileDescriptor(String name,
                             String containerPath,
                             long sizeBytes,
                             Instant modifiedAt,
                             boolean remote) {

    public FileDescriptor {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("File name must not be empty");
        }
        if (name.startsWith("/") || name.startsWith("\\")) {
            throw new IllegalArgumentException("File name must be relative: " + name);
        }
    }

    public String separator() {
        return remote ? "/" : File.separator;
    }

    public String fullPath() {
        if (containerPath.endsWith("/") || containerPath.endsWith("\\")) {
            return containerPath + name;
        }
        return containerPath + separator() + name;
    }
}
