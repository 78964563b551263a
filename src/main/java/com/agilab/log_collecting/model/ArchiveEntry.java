package com.agilab.log_collecting.model;

public record ArchiveEntry(String name, long size, long compressedSize, boolean directory) {
}
