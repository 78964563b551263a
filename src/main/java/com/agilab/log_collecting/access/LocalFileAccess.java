package com.agilab.log_collecting.access;

import com.agilab.log_collecting.event.TransferProgressListener;
import com.agilab.log_collecting.exception.NotADirectoryException;
import com.agilab.log_collecting.exception.PathNotFoundException;
import com.agilab.log_collecting.exception.PathPermissionException;
import com.agilab.log_collecting.exception.TransferException;
import com.agilab.log_collecting.model.FileDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class LocalFileAccess implements FileAccess {

    private static final int BUFFER_SIZE = 1024 * 1024;

    /**
     * Recursive listing. Unreadable entries are skipped with a warning.
     */
    @Override
    public List<FileDescriptor> listFiles(String path) {
        log.info("Listing local files: {}", path);
        var root = Paths.get(path);
        if (!Files.exists(root)) {
            throw new PathNotFoundException(path, "Path not found: " + path);
        }
        if (!Files.isDirectory(root)) {
            throw new NotADirectoryException(path, "Not a directory: " + path);
        }

        var files = new ArrayList<FileDescriptor>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    var target = attrs;
                    if (attrs.isSymbolicLink()) {
                        target = linkTarget(file);
                        if (target == null) {
                            return FileVisitResult.CONTINUE;
                        }
                    }
                    if (target.isRegularFile()) {
                        files.add(new FileDescriptor(root.relativize(file).toString(), root.toString(),
                                target.size(), target.lastModifiedTime().toInstant(), false));
                    } else {
                        log.debug("Skipping non-regular entry: {}", file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    if (file.equals(root)) {
                        throw new PathPermissionException(path, "Cannot read directory: " + path, e);
                    }
                    log.warn("Skipping unreadable entry: {} - {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new TransferException(path, "Failed to list " + path + ": " + e.getMessage(), e);
        }
        log.info("Listed {} local files under {}", files.size(), path);
        return files;
    }

    /**
     * Attributes of the file a link points to, or null for a dangling link. Linked directories are not descended.
     */
    private static BasicFileAttributes linkTarget(Path link) {
        try {
            return Files.readAttributes(link, BasicFileAttributes.class);
        } catch (IOException e) {
            log.debug("Skipping dangling link: {} - {}", link, e.getMessage());
            return null;
        }
    }

    /**
     * Copies in chunks so progress can be reported, then carries the modification time over.
     */
    @Override
    public void copyOrDownload(String source, Path destination, TransferProgressListener onProgress) {
        var sourcePath = Paths.get(source);
        if (!Files.exists(sourcePath)) {
            throw new PathNotFoundException(source, "Source file not found: " + source);
        }
        if (!Files.isRegularFile(sourcePath)) {
            throw new TransferException(source, "Not a regular file: " + source);
        }
        var listener = onProgress == null ? TransferProgressListener.NONE : onProgress;
        try {
            var parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            var total = Files.size(sourcePath);
            var transferred = 0L;
            try (var in = Files.newInputStream(sourcePath);
                 var out = Files.newOutputStream(destination, StandardOpenOption.CREATE,
                         StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                var buffer = new byte[BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    transferred += read;
                    listener.onBytes(transferred, total);
                }
            }
            Files.setLastModifiedTime(destination, Files.getLastModifiedTime(sourcePath));
            log.info("Copied {} -> {} ({} bytes)", source, destination, total);
        } catch (AccessDeniedException e) {
            throw new PathPermissionException(e.getFile(), "Permission denied: " + e.getFile(), e);
        } catch (IOException e) {
            throw new TransferException(source, "Failed to copy " + source + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String path) {
        var file = Paths.get(path);
        if (!Files.isRegularFile(file)) {
            if (!Files.exists(file)) {
                throw new PathNotFoundException(path, "File not found: " + path);
            }
            throw new TransferException(path, "Not a regular file: " + path);
        }
        try {
            Files.delete(file);
            log.info("Deleted local file: {}", path);
        } catch (NoSuchFileException e) {
            throw new PathNotFoundException(path, "File not found: " + path, e);
        } catch (AccessDeniedException e) {
            throw new PathPermissionException(path, "Permission denied: " + path, e);
        } catch (IOException e) {
            throw new TransferException(path, "Failed to delete " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(Paths.get(path));
    }

    @Override
    public void createDirectory(String path) {
        try {
            Files.createDirectories(Paths.get(path));
            log.debug("Directory ready: {}", path);
        } catch (IOException e) {
            throw new TransferException(path, "Failed to create directory " + path + ": " + e.getMessage(), e);
        }
    }

    public FileDescriptor statFile(String path) {
        var file = Paths.get(path).toAbsolutePath();
        if (!Files.isRegularFile(file)) {
            throw new PathNotFoundException(path, "File not found: " + path);
        }
        try {
            var attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return new FileDescriptor(file.getFileName().toString(), file.getParent().toString(),
                    attrs.size(), attrs.lastModifiedTime().toInstant(), false);
        } catch (IOException e) {
            throw new TransferException(path, "Cannot read attributes of " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Usable space of the store holding {@code path}, 0 when it cannot be determined.
     */
    public long diskFreeBytes(String path) {
        try {
            var free = Files.getFileStore(Paths.get(path)).getUsableSpace();
            log.debug("Free space at {}: {} bytes", path, free);
            return free;
        } catch (IOException e) {
            log.error("Cannot determine free space at {}", path, e);
            return 0;
        }
    }
}
