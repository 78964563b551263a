package com.agilab.log_collecting.access;

import com.agilab.log_collecting.event.TransferProgressListener;
import com.agilab.log_collecting.exception.TransferException;
import com.agilab.log_collecting.model.FileDescriptor;
import com.agilab.log_collecting.remote.RemoteSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static com.agilab.log_collecting.util.RemotePaths.shellQuote;

/**
 * File operations on the remote host, delegating to the shared {@link RemoteSession}.
 * Existence and capacity probes run as shell commands.
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteFileAccess implements FileAccess {

    private final RemoteSession session;
    private final Duration commandTimeout;

    @Override
    public List<FileDescriptor> listFiles(String path) {
        return session.listFiles(path, true);
    }

    @Override
    public void copyOrDownload(String source, Path destination, TransferProgressListener onProgress) {
        session.downloadFile(source, destination, onProgress);
    }

    @Override
    public void delete(String path) {
        session.deleteFile(path);
    }

    @Override
    public boolean exists(String path) {
        return probe("test -e " + shellQuote(path), path);
    }

    public boolean fileExists(String path) {
        return probe("test -f " + shellQuote(path), path);
    }

    public boolean directoryExists(String path) {
        return probe("test -d " + shellQuote(path), path);
    }

    @Override
    public void createDirectory(String path) {
        var result = session.executeCommand("mkdir -p " + shellQuote(path), commandTimeout);
        if (!result.succeeded()) {
            throw new TransferException(path, "Failed to create remote directory " + path + ": " + result.stderr().trim());
        }
        log.debug("Remote directory ready: {}", path);
    }

    /**
     * Bytes available on the remote filesystem holding {@code path}, 0 when the query fails.
     */
    public long availableSpace(String path) {
        try {
            var result = session.executeCommand(
                    "df -B1 " + shellQuote(path) + " | tail -1 | awk '{print $4}'", commandTimeout);
            var output = result.stdout().trim();
            if (result.succeeded() && !output.isEmpty() && output.chars().allMatch(Character::isDigit)) {
                var available = Long.parseLong(output);
                log.debug("Remote free space at {}: {} bytes", path, available);
                return available;
            }
            log.warn("Unexpected df output for {}: '{}'", path, output);
        } catch (RuntimeException e) {
            log.warn("Cannot determine remote free space at {}: {}", path, e.getMessage());
        }
        return 0;
    }

    private boolean probe(String command, String path) {
        try {
            var result = session.executeCommand(command + " && echo exists", commandTimeout);
            return result.succeeded() && result.stdout().contains("exists");
        } catch (RuntimeException e) {
            log.warn("Remote probe failed for {}: {}", path, e.getMessage());
            return false;
        }
    }
}
