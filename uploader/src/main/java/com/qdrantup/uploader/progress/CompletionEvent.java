package com.qdrantup.uploader.progress;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Emitted once, after the last batch of a fully successful run.
 */
public record CompletionEvent(
        @JsonProperty("total_points") int totalPoints
) {}
