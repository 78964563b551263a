package com.agilab.log_collecting.model;

public record CommandResult(String stdout, String stderr, int exitCode) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
