package com.qdrantup.uploader.progress;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Emitted once per successfully upserted batch.
 *
 * @param batch  1-based index of the batch
 * @param total  total number of batches in the run
 * @param points number of points in this batch
 */
@JsonPropertyOrder({"batch", "total", "points"})
public record ProgressEvent(
        @JsonProperty("batch") int batch,
        @JsonProperty("total") int total,
        @JsonProperty("points") int points
) {}
