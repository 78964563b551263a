package com.agilab.log_collecting.util;

import com.agilab.log_collecting.exception.TransferException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
public final class FileOperations {

    private FileOperations() {
    }

    /**
     * Resolves a descriptor's relative name under {@code root}, refusing names that would land outside it.
     */
    public static Path resolveWithin(Path root, String relativeName) {
        var normalizedRoot = root.toAbsolutePath().normalize();
        var localName = FilenameUtils.separatorsToSystem(relativeName);
        var target = normalizedRoot.resolve(localName).normalize();
        if (!target.startsWith(normalizedRoot) || target.equals(normalizedRoot)) {
            throw new TransferException(relativeName, "Path escapes destination directory: " + relativeName);
        }
        return target;
    }

    /**
     * Removes now-empty directories from the parent of {@code file} upwards, stopping before {@code stopAt}.
     */
    public static void pruneEmptyParents(Path file, Path stopAt) {
        var boundary = stopAt.toAbsolutePath().normalize();
        var current = file.toAbsolutePath().normalize().getParent();
        while (current != null && !current.equals(boundary) && current.startsWith(boundary)) {
            try {
                if (!Files.isDirectory(current)) {
                    return;
                }
                Files.delete(current);
                log.debug("Removed empty directory: {}", current);
            } catch (DirectoryNotEmptyException e) {
                return;
            } catch (IOException e) {
                log.debug("Could not remove directory {}", current, e);
                return;
            }
            current = current.getParent();
        }
    }

    /**
     * Archive entry names always use forward slashes.
     */
    public static String toEntryName(String relativeName) {
        return FilenameUtils.separatorsToUnix(relativeName);
    }
}
