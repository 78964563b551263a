package com.agilab.log_collecting.model;

/**
 * Formats the remote host can produce with its own shell tools.
 */
public enum ArchiveKind {
    TAR_GZ,
    GZ
}
