package com.agilab.log_collecting.access;

import com.agilab.log_collecting.event.TransferProgressListener;
import com.agilab.log_collecting.model.FileDescriptor;

import java.nio.file.Path;
import java.util.List;

/**
 * File operations shared by the local filesystem and the remote host. Listings return descriptors whose
 * names are relative to the listed directory, subdirectories included.
 */
public interface FileAccess {

    List<FileDescriptor> listFiles(String path);

    /**
     * Brings {@code source} to the local {@code destination}, creating parent directories as needed.
     */
    void copyOrDownload(String source, Path destination, TransferProgressListener onProgress);

    void delete(String path);

    boolean exists(String path);

    void createDirectory(String path);
}
