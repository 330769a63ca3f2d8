package com.qdrantup.uploader.progress;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects progress and completion events for assertions.
 */
public class RecordingProgressListener implements ProgressListener {

    private final List<ProgressEvent> events = new ArrayList<>();
    private final List<CompletionEvent> completions = new ArrayList<>();

    @Override
    public void onBatchUploaded(ProgressEvent event) {
        events.add(event);
    }

    @Override
    public void onComplete(CompletionEvent event) {
        completions.add(event);
    }

    public List<ProgressEvent> events() {
        return events;
    }

    public List<CompletionEvent> completions() {
        return completions;
    }
}
