package com.agilab.log_collecting.model;

/**
 * Origins of log files. The kind decides remoteness, display name and archive naming.
 */
public enum SourceKind {
    KERNEL_LOG("Controller kernel log", "controller_kernel_log", ".tar.gz", true),
    SERVER_LOG("Controller log", "controller_log", ".tar.gz", true),
    CLIENT_LOG("User software log", "user_app_log", ".zip", false);

    private final String displayName;
    private final String archiveBaseName;
    private final String archiveExtension;
    private final boolean remote;

    SourceKind(String displayName, String archiveBaseName, String archiveExtension, boolean remote) {
        this.displayName = displayName;
        this.archiveBaseName = archiveBaseName;
        this.archiveExtension = archiveExtension;
        this.remote = remote;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getArchiveBaseName() {
        return archiveBaseName;
    }

    public String getArchiveExtension() {
        return archiveExtension;
    }

    public boolean isRemote() {
        return remote;
    }
}
