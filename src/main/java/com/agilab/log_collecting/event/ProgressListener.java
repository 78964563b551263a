package com.agilab.log_collecting.event;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> {
    };

    void onProgress(ProgressEvent event);
}
