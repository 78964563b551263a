package com.agilab.log_collecting.event;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Hands progress events from the worker thread to a consumer loop on another thread.
 * Events keep the order they were produced in.
 */
@Slf4j
public class ProgressChannel implements ProgressListener {

    private final BlockingQueue<ProgressEvent> queue = new LinkedBlockingQueue<>();

    @Override
    public void onProgress(ProgressEvent event) {
        if (!queue.offer(event)) {
            log.warn("Progress event dropped: {}", event);
        }
    }

    public Optional<ProgressEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public List<ProgressEvent> drain() {
        var events = new ArrayList<ProgressEvent>();
        queue.drainTo(events);
        return events;
    }
}
