package com.agilab.log_collecting.filter;

import com.agilab.log_collecting.exception.InvalidFilterValueException;
import com.agilab.log_collecting.exception.InvalidPatternException;
import com.agilab.log_collecting.model.FileDescriptor;
import com.agilab.log_collecting.model.SortKey;
import com.agilab.log_collecting.model.SourceConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Selection and ordering of file descriptors. Stateless, performs no I/O.
 */
@Slf4j
public final class FilterEngine {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FilterEngine() {
    }

    public static List<FileDescriptor> filterAll(List<FileDescriptor> files) {
        log.debug("Filter ALL: {} files", files.size());
        return files;
    }

    /**
     * Keeps descriptors whose relative name contains a match for {@code pattern}.
     */
    public static List<FileDescriptor> filterByRegex(List<FileDescriptor> files, String pattern) {
        Pattern regex;
        try {
            regex = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(pattern, "Invalid regular expression: " + e.getDescription(), e);
        }
        var filtered = files.stream()
                .filter(file -> regex.matcher(file.name()).find())
                .toList();
        log.info("Filter REGEX '{}': selected {} of {} files", pattern, filtered.size(), files.size());
        return filtered;
    }

    public static List<FileDescriptor> filterByDate(List<FileDescriptor> files, Instant sinceInclusive) {
        var filtered = files.stream()
                .filter(file -> !file.modifiedAt().isBefore(sinceInclusive))
                .toList();
        log.info("Filter DATE since {}: selected {} of {} files", sinceInclusive, filtered.size(), files.size());
        return filtered;
    }

    /**
     * Keeps files ending in one of the extensions, compared case-insensitively. A leading dot is optional.
     */
    public static List<FileDescriptor> filterByExtension(List<FileDescriptor> files, List<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            return files;
        }
        var suffixes = extensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                .toList();
        var filtered = files.stream()
                .filter(file -> suffixes.stream().anyMatch(file.name().toLowerCase(Locale.ROOT)::endsWith))
                .toList();
        log.info("Filter EXTENSION {}: selected {} of {} files", extensions, filtered.size(), files.size());
        return filtered;
    }

    public static List<FileDescriptor> filterBySizeRange(List<FileDescriptor> files, long minBytes, Long maxBytes) {
        var filtered = files.stream()
                .filter(file -> file.sizeBytes() >= minBytes)
                .filter(file -> maxBytes == null || file.sizeBytes() <= maxBytes)
                .toList();
        log.info("Filter SIZE [{}, {}]: selected {} of {} files", minBytes, maxBytes, filtered.size(), files.size());
        return filtered;
    }

    public static List<FileDescriptor> applyFilter(List<FileDescriptor> files, SourceConfig config) {
        return applyFilter(files, config, ZoneId.systemDefault());
    }

    /**
     * Applies the filter named by {@code config}. Date values are read in {@code zone}.
     * A missing value for a regex or date filter returns the list unfiltered and logs a warning.
     */
    public static List<FileDescriptor> applyFilter(List<FileDescriptor> files, SourceConfig config, ZoneId zone) {
        if (files.isEmpty()) {
            log.info("No files to filter");
            return List.of();
        }
        log.info("Applying filter {} to {} files", config.filterKind(), files.size());

        switch (config.filterKind()) {
            case REGEX -> {
                if (StringUtils.isBlank(config.filterValue())) {
                    log.warn("Regex filter selected without a pattern, returning all files");
                    return files;
                }
                return filterByRegex(files, config.filterValue());
            }
            case DATE -> {
                if (StringUtils.isBlank(config.filterValue())) {
                    log.warn("Date filter selected without a date, returning all files");
                    return files;
                }
                var since = parseFilterDate(config.filterValue()).atZone(zone).toInstant();
                return filterByDate(files, since);
            }
            default -> {
                return filterAll(files);
            }
        }
    }

    /**
     * Parses {@code yyyy-MM-dd} or {@code yyyy-MM-dd HH:mm:ss}, with either a space or {@code T} between date and time.
     */
    public static LocalDateTime parseFilterDate(String value) {
        var trimmed = value.trim();
        try {
            if (trimmed.contains("T") || trimmed.contains(" ")) {
                return LocalDateTime.parse(trimmed.replace('T', ' '), DATE_TIME);
            }
            return LocalDate.parse(trimmed, DATE).atStartOfDay();
        } catch (DateTimeParseException e) {
            log.error("Unparseable filter date '{}', expected yyyy-MM-dd or yyyy-MM-dd HH:mm:ss", value);
            throw new InvalidFilterValueException(value,
                    "Invalid date '" + value + "', expected yyyy-MM-dd or yyyy-MM-dd HH:mm:ss", e);
        }
    }

    public static List<FileDescriptor> sortFiles(List<FileDescriptor> files, SortKey key, boolean descending) {
        Comparator<FileDescriptor> comparator = switch (key) {
            case SIZE -> Comparator.comparingLong(FileDescriptor::sizeBytes);
            case DATE -> Comparator.comparing(FileDescriptor::modifiedAt);
            case NAME -> Comparator.comparing((FileDescriptor file) -> file.name().toLowerCase(Locale.ROOT));
        };
        if (descending) {
            comparator = comparator.reversed();
        }
        log.debug("Sorting {} files by {} (descending={})", files.size(), key, descending);
        return files.stream().sorted(comparator).toList();
    }

    public static long totalSize(List<FileDescriptor> files) {
        return files.stream().mapToLong(FileDescriptor::sizeBytes).sum();
    }

    /**
     * Binary-prefixed size with two decimals, e.g. {@code 1536 -> "1.50 KB"}.
     */
    public static String humanSize(long bytes) {
        double size = bytes;
        for (var unit : SIZE_UNITS) {
            if (size < 1024.0) {
                return String.format(Locale.ROOT, "%.2f %s", size, unit);
            }
            size /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.2f PB", size);
    }
}
