package com.agilab.log_collecting.archive;

import com.agilab.log_collecting.exception.PathNotFoundException;
import com.agilab.log_collecting.exception.TransferException;
import com.agilab.log_collecting.exception.UnsupportedArchiveKindException;
import com.agilab.log_collecting.model.ArchiveEntry;
import com.agilab.log_collecting.model.ArchiveKind;
import com.agilab.log_collecting.model.RemoteCompressionResult;
import com.agilab.log_collecting.model.SourceKind;
import com.agilab.log_collecting.remote.RemoteCommandExecutor;
import com.agilab.log_collecting.util.FileOperations;
import com.agilab.log_collecting.util.RemotePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import static com.agilab.log_collecting.util.RemotePaths.shellQuote;

/**
 * Builds and inspects local zip archives and drives archive commands on the remote host.
 */
@Slf4j
@RequiredArgsConstructor
public class ArchiveHandler {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH.mm.ss");

    private final RemoteCommandExecutor remoteExecutor;
    private final Duration remoteCompressionTimeout;
    private final Clock clock;

    public ArchiveHandler(RemoteCommandExecutor remoteExecutor, Duration remoteCompressionTimeout) {
        this(remoteExecutor, remoteCompressionTimeout, Clock.systemDefaultZone());
    }

    public void compressLocal(Path source, Path archivePath, int level) {
        compressLocal(List.of(source), archivePath, level, null);
    }

    /**
     * Writes every input into one deflate archive. {@code namesInArchive}, when given, supplies the entry
     * name of the input at the same index; otherwise the bare file name is used.
     */
    public void compressLocal(List<Path> sources, Path archivePath, int level, List<String> namesInArchive) {
        if (namesInArchive != null && namesInArchive.size() != sources.size()) {
            throw new IllegalArgumentException("Expected " + sources.size() + " entry names, got " + namesInArchive.size());
        }
        for (var source : sources) {
            if (!Files.isRegularFile(source)) {
                throw new PathNotFoundException(source.toString(), "File to archive not found: " + source);
            }
        }
        log.info("Compressing {} files into {} (level {})", sources.size(), archivePath, level);
        try {
            var parent = archivePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            var originalSize = 0L;
            try (var zip = new ZipOutputStream(Files.newOutputStream(archivePath))) {
                zip.setMethod(ZipOutputStream.DEFLATED);
                zip.setLevel(level < Deflater.NO_COMPRESSION || level > Deflater.BEST_COMPRESSION
                        ? Deflater.DEFAULT_COMPRESSION : level);
                for (var i = 0; i < sources.size(); i++) {
                    var source = sources.get(i);
                    var name = namesInArchive == null ? source.getFileName().toString() : namesInArchive.get(i);
                    var entry = new ZipEntry(FileOperations.toEntryName(name));
                    entry.setLastModifiedTime(Files.getLastModifiedTime(source));
                    zip.putNextEntry(entry);
                    Files.copy(source, zip);
                    zip.closeEntry();
                    originalSize += Files.size(source);
                }
            }
            var compressedSize = Files.size(archivePath);
            log.info("Archive {} written: {} -> {} bytes", archivePath, originalSize, compressedSize);
        } catch (IOException e) {
            throw new TransferException(archivePath.toString(),
                    "Failed to create archive " + archivePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Extracts every file entry under {@code targetDir}. Entries that would land outside it are refused.
     */
    public List<Path> decompress(Path archivePath, Path targetDir) {
        requireArchive(archivePath);
        var extracted = new ArrayList<Path>();
        try {
            Files.createDirectories(targetDir);
            try (var zip = new ZipInputStream(Files.newInputStream(archivePath))) {
                ZipEntry entry;
                while ((entry = zip.getNextEntry()) != null) {
                    var target = FileOperations.resolveWithin(targetDir, entry.getName());
                    if (entry.isDirectory()) {
                        Files.createDirectories(target);
                    } else {
                        Files.createDirectories(target.getParent());
                        Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
                        extracted.add(target);
                    }
                    zip.closeEntry();
                }
            }
        } catch (IOException e) {
            throw new TransferException(archivePath.toString(),
                    "Failed to extract " + archivePath + ": " + e.getMessage(), e);
        }
        log.info("Extracted {} files from {} into {}", extracted.size(), archivePath, targetDir);
        return extracted;
    }

    public List<ArchiveEntry> listContents(Path archivePath) {
        requireArchive(archivePath);
        try (var zip = new ZipFile(archivePath.toFile())) {
            return Collections.list(zip.entries()).stream()
                    .map(entry -> new ArchiveEntry(entry.getName(), entry.getSize(),
                            entry.getCompressedSize(), entry.isDirectory()))
                    .toList();
        } catch (IOException e) {
            throw new TransferException(archivePath.toString(),
                    "Failed to read archive " + archivePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads every entry to the end so that checksums are verified.
     */
    public boolean isValidArchive(Path archivePath) {
        if (!Files.isRegularFile(archivePath)) {
            return false;
        }
        try (var ignored = new ZipFile(archivePath.toFile());
             var zip = new ZipInputStream(Files.newInputStream(archivePath))) {
            while (zip.getNextEntry() != null) {
                zip.transferTo(OutputStream.nullOutputStream());
            }
            return true;
        } catch (IOException e) {
            log.warn("Archive {} failed the integrity check: {}", archivePath, e.getMessage());
            return false;
        }
    }

    /**
     * Space saved as a fraction of the original size, 0 for an empty or unreadable archive.
     */
    public double compressionRatio(Path archivePath) {
        try {
            var files = listContents(archivePath).stream().filter(entry -> !entry.directory()).toList();
            var total = files.stream().mapToLong(ArchiveEntry::size).sum();
            var compressed = files.stream().mapToLong(ArchiveEntry::compressedSize).sum();
            if (total <= 0) {
                return 0.0;
            }
            return 1.0 - (double) compressed / total;
        } catch (RuntimeException e) {
            log.error("Cannot compute compression ratio of {}", archivePath, e);
            return 0.0;
        }
    }

    /**
     * e.g. {@code controller_log_{2024-05-01 13.45.10}.tar.gz}.
     */
    public String buildArchiveName(SourceKind kind, boolean withTimestamp) {
        if (!withTimestamp) {
            return kind.getArchiveBaseName() + kind.getArchiveExtension();
        }
        var timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        return kind.getArchiveBaseName() + "_{" + timestamp + "}" + kind.getArchiveExtension();
    }

    /**
     * Archives remote files on the remote host with a single command. Exit code 1 means some inputs could not
     * be read; those are reported in the result and the rest of the archive is kept.
     */
    public RemoteCompressionResult compressRemote(List<String> remotePaths, String archiveRemotePath, ArchiveKind kind) {
        if (remotePaths.isEmpty()) {
            throw new IllegalArgumentException("No remote files to compress");
        }
        var command = switch (kind) {
            case TAR_GZ -> tarCommand(remotePaths, archiveRemotePath);
            case GZ -> {
                if (remotePaths.size() != 1) {
                    throw new UnsupportedArchiveKindException(archiveRemotePath,
                            "gzip archives hold exactly one file, got " + remotePaths.size());
                }
                yield "gzip -c -- " + shellQuote(remotePaths.get(0)) + " > " + shellQuote(archiveRemotePath);
            }
        };
        log.info("Compressing {} remote files into {}", remotePaths.size(), archiveRemotePath);
        log.debug("Remote compression command: {}", command);

        var result = remoteExecutor.executeCommand(command, remoteCompressionTimeout);
        var failedFiles = failedFiles(result.stderr());
        var success = result.exitCode() == 0 || result.exitCode() == 1;
        if (!success) {
            log.error("Remote compression failed with exit code {}: {}", result.exitCode(), result.stderr().trim());
        } else if (!failedFiles.isEmpty()) {
            log.warn("Remote compression skipped {} unreadable files: {}", failedFiles.size(), failedFiles);
        } else {
            log.info("Remote archive created: {}", archiveRemotePath);
        }
        return new RemoteCompressionResult(success, result.exitCode(), failedFiles, result.stderr());
    }

    private static String tarCommand(List<String> remotePaths, String archiveRemotePath) {
        var base = RemotePaths.commonParent(remotePaths);
        var members = remotePaths.stream()
                .map(path -> shellQuote(RemotePaths.relativize(base, path)))
                .collect(Collectors.joining(" "));
        return "cd " + shellQuote(base) + " && tar -czf " + shellQuote(archiveRemotePath) + " -- " + members;
    }

    /**
     * Picks file names out of lines like {@code tar: logs/a.log: Cannot open: Permission denied}.
     */
    static List<String> failedFiles(String stderr) {
        var failed = new ArrayList<String>();
        if (StringUtils.isBlank(stderr)) {
            return failed;
        }
        for (var line : stderr.split("\\R")) {
            if (!line.contains("Permission denied") && !line.contains("Cannot open")) {
                continue;
            }
            var text = StringUtils.removeStart(line.trim(), "tar: ");
            text = StringUtils.removeStart(text, "gzip: ");
            var end = text.indexOf(": Cannot open");
            if (end < 0) {
                end = text.indexOf(": Permission denied");
            }
            var name = end < 0 ? text : text.substring(0, end);
            if (!name.isBlank()) {
                failed.add(name.trim());
            }
        }
        return failed;
    }

    private static void requireArchive(Path archivePath) {
        if (!Files.isRegularFile(archivePath)) {
            throw new PathNotFoundException(archivePath.toString(), "Archive not found: " + archivePath);
        }
    }
}
