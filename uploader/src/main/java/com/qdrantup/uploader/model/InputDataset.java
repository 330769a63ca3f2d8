package com.qdrantup.uploader.model;

import java.util.List;

/**
 * The parsed input file: an ordered, read-only list of points.
 */
public record InputDataset(List<Point> points) {

    public InputDataset {
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
