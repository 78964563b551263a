package com.agilab.log_collecting.util;

import org.apache.commons.io.FilenameUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * POSIX path handling for the remote host, independent of the local operating system.
 */
public final class RemotePaths {

    private RemotePaths() {
    }

    public static String normalize(String path) {
        var normalized = FilenameUtils.normalizeNoEndSeparator(path, true);
        return normalized == null ? path : normalized;
    }

    public static String join(String parent, String child) {
        if (parent.endsWith("/")) {
            return parent + child;
        }
        return parent + "/" + child;
    }

    public static String parent(String path) {
        var normalized = normalize(path);
        var index = normalized.lastIndexOf('/');
        if (index < 0) {
            return ".";
        }
        return index == 0 ? "/" : normalized.substring(0, index);
    }

    public static String baseName(String path) {
        var normalized = normalize(path);
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }

    /**
     * Path of {@code path} relative to {@code base}. Expects {@code path} to sit below {@code base}.
     */
    public static String relativize(String base, String path) {
        var normalizedBase = normalize(base);
        var normalizedPath = normalize(path);
        if ("/".equals(normalizedBase)) {
            return normalizedPath.substring(1);
        }
        if (normalizedPath.startsWith(normalizedBase + "/")) {
            return normalizedPath.substring(normalizedBase.length() + 1);
        }
        return normalizedPath;
    }

    /**
     * Deepest directory containing every path. A single path yields its own parent.
     */
    public static String commonParent(List<String> paths) {
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("No paths given");
        }
        List<String> common = null;
        for (var path : paths) {
            var segments = segments(parent(path));
            if (common == null) {
                common = new ArrayList<>(segments);
                continue;
            }
            var shared = 0;
            while (shared < common.size() && shared < segments.size()
                    && common.get(shared).equals(segments.get(shared))) {
                shared++;
            }
            common = new ArrayList<>(common.subList(0, shared));
        }
        return "/" + String.join("/", common);
    }

    /**
     * Wraps a value in single quotes for a POSIX shell.
     */
    public static String shellQuote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private static List<String> segments(String absolutePath) {
        return Arrays.stream(absolutePath.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toList();
    }
}
