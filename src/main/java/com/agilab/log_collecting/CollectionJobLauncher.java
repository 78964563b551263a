package com.agilab.log_collecting;

import com.agilab.log_collecting.event.ProgressChannel;
import com.agilab.log_collecting.model.CancellationToken;
import com.agilab.log_collecting.model.CollectionResult;
import com.agilab.log_collecting.model.FileDescriptor;
import com.agilab.log_collecting.model.SourceConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs collections on the collection worker so callers never block on network or disk I/O.
 */
@Slf4j
@Component
public class CollectionJobLauncher {

    private final CollectionOrchestrator orchestrator;
    private final ExecutorService collectionExecutor;

    public CollectionJobLauncher(CollectionOrchestrator orchestrator,
                                 @Qualifier("collectionExecutor") ExecutorService collectionExecutor) {
        this.orchestrator = orchestrator;
        this.collectionExecutor = collectionExecutor;
    }

    /**
     * A submitted run. Progress arrives on {@code progress}; {@code cancellation} stops it between files.
     */
    public record CollectionJob(CompletableFuture<CollectionResult> result,
                                ProgressChannel progress,
                                CancellationToken cancellation) {

        public void cancel() {
            cancellation.cancel();
        }
    }

    public CollectionJob submit(SourceConfig config, Path destinationDir) {
        var progress = new ProgressChannel();
        var token = new CancellationToken();
        log.info("Submitting collection of {} into {}", config.displayName(), destinationDir);
        var future = CompletableFuture.supplyAsync(
                () -> orchestrator.collect(config, destinationDir, progress, token), collectionExecutor);
        return new CollectionJob(future, progress, token);
    }

    public CollectionJob submitSelected(List<FileDescriptor> files, Path destinationDir) {
        var progress = new ProgressChannel();
        var token = new CancellationToken();
        log.info("Submitting collection of {} selected files into {}", files.size(), destinationDir);
        var future = CompletableFuture.supplyAsync(
                () -> orchestrator.collectSelected(files, destinationDir, progress, token), collectionExecutor);
        return new CollectionJob(future, progress, token);
    }
}
