package com.agilab.log_collecting;

import com.agilab.log_collecting.access.FileAccess;
import com.agilab.log_collecting.access.LocalFileAccess;
import com.agilab.log_collecting.access.RemoteFileAccess;
import com.agilab.log_collecting.archive.ArchiveHandler;
import com.agilab.log_collecting.config.LogCollectorProperties;
import com.agilab.log_collecting.event.CollectionCompletedEvent;
import com.agilab.log_collecting.event.ProgressEvent;
import com.agilab.log_collecting.event.ProgressListener;
import com.agilab.log_collecting.event.TransferProgressListener;
import com.agilab.log_collecting.exception.CollectorExceptionHandler;
import com.agilab.log_collecting.exception.LogCollectionException;
import com.agilab.log_collecting.exception.TransferException;
import com.agilab.log_collecting.filter.FilterEngine;
import com.agilab.log_collecting.model.ArchiveKind;
import com.agilab.log_collecting.model.CancellationToken;
import com.agilab.log_collecting.model.CollectionResult;
import com.agilab.log_collecting.model.DeletionSummary;
import com.agilab.log_collecting.model.FileDescriptor;
import com.agilab.log_collecting.model.SourceConfig;
import com.agilab.log_collecting.notification.CollectionNotificationProducer;
import com.agilab.log_collecting.util.FileOperations;
import com.agilab.log_collecting.util.RemotePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Runs collections: lists and filters a source, brings the selected files into a local directory,
 * optionally archives them and removes the originals.
 * <p>
 * Collection and deletion never throw. Setup failures end up in {@link CollectionResult#getErrorMessage()},
 * failures of single files are counted and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionOrchestrator {

    static final String CANCELLED_MESSAGE = "Cancelled by user";

    private final LocalFileAccess localAccess;
    private final RemoteFileAccess remoteAccess;
    private final ArchiveHandler archiveHandler;
    private final RetryTemplate transferRetryTemplate;
    private final CollectionNotificationProducer notificationProducer;
    private final CollectorExceptionHandler exceptionHandler;
    private final LogCollectorProperties properties;

    /**
     * Lists the configured source and applies its filter. Errors propagate unchanged.
     */
    public List<FileDescriptor> listFiltered(SourceConfig config) {
        log.info("Listing {} at {}", config.displayName(), config.path());
        var files = accessFor(config.isRemote()).listFiles(config.path());
        return FilterEngine.applyFilter(files, config);
    }

    public CollectionResult collect(SourceConfig config, Path destinationDir,
                                    ProgressListener onProgress, CancellationToken cancelToken) {
        var listener = onProgress == null ? ProgressListener.NONE : onProgress;
        var token = cancelToken == null ? new CancellationToken() : cancelToken;
        var result = new CollectionResult();
        log.info("Starting collection of {} into {}", config.displayName(), destinationDir);

        try {
            var files = listFiltered(config);
            if (files.isEmpty()) {
                log.warn("No files to collect for {}", config.displayName());
                result.setSuccess(true);
                listener.onProgress(ProgressEvent.completed(0));
                return result;
            }
            result.setTotalFiles(files.size());
            result.setTotalBytes(FilterEngine.totalSize(files));
            log.info("Collecting {} files ({})", files.size(), FilterEngine.humanSize(result.getTotalBytes()));

            createDestination(destinationDir);

            if (config.isRemote() && config.compress()) {
                collectRemoteCompressed(config, files, destinationDir, listener, token, result);
                return result;
            }

            var collected = transferAll(files, destinationDir, listener, token, result);
            if (token.isCancelled() && CANCELLED_MESSAGE.equals(result.getErrorMessage())) {
                return result;
            }
            if (config.compress() && !collected.isEmpty()) {
                archiveCollected(config, destinationDir, collected, result);
            }
            if (config.deleteAfterCollect() && !collected.isEmpty()) {
                deleteOriginals(config.isRemote(), collected.stream().map(Pair::getLeft).toList());
            }
            result.setSuccess(true);
            listener.onProgress(ProgressEvent.completed(result.getTotalFiles()));
            log.info("Collection of {} finished: {}", config.displayName(), result.summary());
        } catch (RuntimeException e) {
            fail(result, e);
        } finally {
            notifyCompletion(config.displayName(), destinationDir, result);
        }
        return result;
    }

    /**
     * Transfers a caller-chosen list, each file over the access matching its origin. Nothing is archived or deleted.
     */
    public CollectionResult collectSelected(List<FileDescriptor> files, Path destinationDir,
                                            ProgressListener onProgress, CancellationToken cancelToken) {
        var listener = onProgress == null ? ProgressListener.NONE : onProgress;
        var token = cancelToken == null ? new CancellationToken() : cancelToken;
        var result = new CollectionResult();
        result.setTotalFiles(files.size());
        result.setTotalBytes(FilterEngine.totalSize(files));
        log.info("Collecting {} selected files into {}", files.size(), destinationDir);

        try {
            createDestination(destinationDir);
            transferAll(files, destinationDir, listener, token, result);
            if (!(token.isCancelled() && CANCELLED_MESSAGE.equals(result.getErrorMessage()))) {
                result.setSuccess(true);
                listener.onProgress(ProgressEvent.completed(result.getTotalFiles()));
                log.info("Selected file collection finished: {}", result.summary());
            }
        } catch (RuntimeException e) {
            fail(result, e);
        } finally {
            notifyCompletion("Selected files", destinationDir, result);
        }
        return result;
    }

    public DeletionSummary deleteFiles(List<FileDescriptor> files) {
        log.info("Deleting {} files", files.size());
        var success = 0;
        var failure = 0;
        for (var file : files) {
            try {
                accessFor(file.remote()).delete(file.fullPath());
                success++;
                log.info("Deleted {}", file.fullPath());
            } catch (RuntimeException e) {
                failure++;
                log.error("Failed to delete {}: {}", file.fullPath(), exceptionHandler.describe(e));
            }
        }
        log.info("Deletion finished: {} deleted, {} failed", success, failure);
        return new DeletionSummary(success, failure);
    }

    public long diskFreeBytes(String path) {
        return localAccess.diskFreeBytes(path);
    }

    public long remoteDiskFree(String remotePath) {
        return remoteAccess.availableSpace(remotePath);
    }

    private List<Pair<FileDescriptor, Path>> transferAll(List<FileDescriptor> files, Path destinationDir,
                                                         ProgressListener listener, CancellationToken token,
                                                         CollectionResult result) {
        var collected = new ArrayList<Pair<FileDescriptor, Path>>();
        var total = files.size();
        for (var i = 0; i < total; i++) {
            if (token.isCancelled()) {
                log.warn("Collection cancelled after {} of {} files", i, total);
                result.setSuccess(false);
                result.setErrorMessage(CANCELLED_MESSAGE);
                listener.onProgress(ProgressEvent.cancelled(i, total));
                return collected;
            }
            var file = files.get(i);
            var index = i + 1;
            listener.onProgress(ProgressEvent.item(file.name(), index, total));
            try {
                var target = FileOperations.resolveWithin(destinationDir, file.name());
                var access = accessFor(file.remote());
                transferRetryTemplate.execute(context -> {
                    if (context.getRetryCount() > 0) {
                        log.warn("Retrying {} (attempt {})", file.name(), context.getRetryCount() + 1);
                    }
                    access.copyOrDownload(file.fullPath(), target, TransferProgressListener.NONE);
                    return null;
                });
                result.recordCollected(target.toString());
                collected.add(Pair.of(file, target));
                log.info("[{}/{}] Collected {}", index, total, file.name());
            } catch (RuntimeException e) {
                result.recordFailed();
                if (e instanceof LogCollectionException collectionException) {
                    exceptionHandler.logException(collectionException);
                }
                log.error("[{}/{}] Failed to collect {}: {}", index, total, file.name(), exceptionHandler.describe(e));
            }
        }
        return collected;
    }

    private void collectRemoteCompressed(SourceConfig config, List<FileDescriptor> files, Path destinationDir,
                                         ProgressListener listener, CancellationToken token, CollectionResult result) {
        var total = files.size();
        if (token.isCancelled()) {
            log.warn("Collection cancelled before remote compression");
            result.setErrorMessage(CANCELLED_MESSAGE);
            listener.onProgress(ProgressEvent.cancelled(0, total));
            return;
        }

        listener.onProgress(ProgressEvent.phase("Compressing files on remote host", total, 10));
        var archiveName = archiveHandler.buildArchiveName(config.sourceKind(), true);
        var remoteArchive = RemotePaths.join(properties.getRemoteTempDirectory(), archiveName);
        var remotePaths = files.stream().map(FileDescriptor::fullPath).toList();
        var compression = archiveHandler.compressRemote(remotePaths, remoteArchive, ArchiveKind.TAR_GZ);
        if (!compression.success()) {
            throw new TransferException(remoteArchive,
                    "Remote compression failed with exit code " + compression.exitCode() + ": " + compression.stderr().trim());
        }

        listener.onProgress(ProgressEvent.phase("Downloading archive", total, 50));
        var localArchive = destinationDir.resolve(archiveName);
        try {
            remoteAccess.copyOrDownload(remoteArchive, localArchive, TransferProgressListener.NONE);
            log.info("Downloaded remote archive to {}", localArchive);
        } catch (RuntimeException e) {
            discardPartialArchive(localArchive);
            throw e;
        } finally {
            listener.onProgress(ProgressEvent.phase("Removing remote archive", total, 80));
            removeRemoteArchive(remoteArchive);
        }

        var skipped = new HashSet<>(compression.failedFiles());
        var base = RemotePaths.commonParent(remotePaths);
        var archived = files.stream()
                .filter(file -> !skipped.contains(RemotePaths.relativize(base, file.fullPath())))
                .toList();
        result.setCollectedFiles(archived.size());
        result.setFailedFiles(total - archived.size());
        result.getProducedPaths().add(localArchive.toString());

        if (config.deleteAfterCollect()) {
            deleteOriginals(true, archived);
        }
        result.setSuccess(true);
        listener.onProgress(ProgressEvent.completed(total));
        log.info("Remote collection of {} finished: {}", config.displayName(), result.summary());
    }

    private void removeRemoteArchive(String remoteArchive) {
        try {
            remoteAccess.delete(remoteArchive);
        } catch (RuntimeException e) {
            log.warn("Could not remove remote archive {}: {}", remoteArchive, exceptionHandler.describe(e));
        }
    }

    private void discardPartialArchive(Path localArchive) {
        try {
            if (Files.deleteIfExists(localArchive)) {
                log.info("Removed partial archive {}", localArchive);
            }
        } catch (IOException e) {
            log.warn("Could not remove partial archive {}: {}", localArchive, e.getMessage());
        }
    }

    /**
     * Replaces the collected files with one archive and removes directories left empty.
     */
    private void archiveCollected(SourceConfig config, Path destinationDir,
                                  List<Pair<FileDescriptor, Path>> collected, CollectionResult result) {
        var archivePath = destinationDir.resolve(archiveHandler.buildArchiveName(config.sourceKind(), true));
        try {
            archiveHandler.compressLocal(
                    collected.stream().map(Pair::getRight).toList(),
                    archivePath,
                    properties.getCompressionLevel(),
                    collected.stream().map(pair -> pair.getLeft().name()).toList());
        } catch (RuntimeException e) {
            log.error("Archiving collected files failed", e);
            result.setErrorMessage("Archive creation failed: " + exceptionHandler.describe(e));
            return;
        }
        for (var pair : collected) {
            try {
                Files.deleteIfExists(pair.getRight());
                FileOperations.pruneEmptyParents(pair.getRight(), destinationDir);
            } catch (IOException e) {
                log.warn("Could not remove archived file {}: {}", pair.getRight(), e.getMessage());
            }
        }
        result.getProducedPaths().clear();
        result.getProducedPaths().add(archivePath.toString());
        log.info("Collected files archived into {}", archivePath);
    }

    private void deleteOriginals(boolean remote, List<FileDescriptor> originals) {
        var access = accessFor(remote);
        var deleted = 0;
        var failed = 0;
        for (var file : originals) {
            try {
                access.delete(file.fullPath());
                deleted++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Could not delete original {}: {}", file.fullPath(), exceptionHandler.describe(e));
            }
        }
        log.info("Originals removed: {} deleted, {} failed", deleted, failed);
    }

    private void createDestination(Path destinationDir) {
        try {
            Files.createDirectories(destinationDir);
        } catch (IOException e) {
            throw new TransferException(destinationDir.toString(),
                    "Cannot create destination directory " + destinationDir + ": " + e.getMessage(), e);
        }
    }

    private FileAccess accessFor(boolean remote) {
        return remote ? remoteAccess : localAccess;
    }

    private void fail(CollectionResult result, RuntimeException e) {
        if (e instanceof LogCollectionException collectionException) {
            exceptionHandler.logException(collectionException);
        }
        log.error("Collection failed", e);
        result.setSuccess(false);
        result.setErrorMessage(exceptionHandler.describe(e));
    }

    private void notifyCompletion(String source, Path destinationDir, CollectionResult result) {
        var event = new CollectionCompletedEvent(source, destinationDir.toString(), result.isSuccess(),
                result.getTotalFiles(), result.getCollectedFiles(), result.getFailedFiles(), result.getTotalBytes(),
                result.getErrorMessage(), List.copyOf(result.getProducedPaths()), Instant.now());
        notificationProducer.sendCompletion(event);
    }
}
