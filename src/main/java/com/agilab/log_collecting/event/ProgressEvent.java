package com.agilab.log_collecting.event;

/**
 * Progress of a collection run, emitted per file or per phase.
 */
public record ProgressEvent(String currentItemLabel,
                            int currentIndex,
                            int totalItems,
                            int percentComplete,
                            boolean complete,
                            boolean cancelled) {

    /**
     * Emitted before item {@code index} (1-based) is transferred, so the percentage counts finished items only.
     */
    public static ProgressEvent item(String label, int index, int total) {
        var percent = total == 0 ? 0 : (int) ((long) (index - 1) * 100 / total);
        return new ProgressEvent(label, index, total, percent, false, false);
    }

    public static ProgressEvent phase(String label, int total, int percent) {
        return new ProgressEvent(label, 0, total, percent, false, false);
    }

    public static ProgressEvent completed(int total) {
        return new ProgressEvent("", total, total, 100, true, false);
    }

    public static ProgressEvent cancelled(int index, int total) {
        var percent = total == 0 ? 0 : (int) ((long) index * 100 / total);
        return new ProgressEvent("", index, total, percent, false, true);
    }
}
