package com.qdrantup.uploader.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Writes the machine-readable progress stream: {@code progress:{...}} per batch and
 * {@code done:{...}} at the end, one JSON object per line. Diagnostics never go here;
 * they are logged to stderr.
 */
public class StdoutProgressReporter implements ProgressListener {

    static final String PROGRESS_PREFIX = "progress:";
    static final String DONE_PREFIX = "done:";

    private final PrintStream out;
    private final ObjectMapper objectMapper;

    public StdoutProgressReporter() {
        this(System.out);
    }

    public StdoutProgressReporter(PrintStream out) {
        this.out = out;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void onBatchUploaded(ProgressEvent event) {
        emit(PROGRESS_PREFIX, event);
    }

    @Override
    public void onComplete(CompletionEvent event) {
        emit(DONE_PREFIX, event);
    }

    private void emit(String prefix, Object event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + event, e);
        }
        out.println(prefix + json);
        out.flush();
    }
}
