package com.qdrantup.uploader.loader;

import com.qdrantup.uploader.exception.StoreException;
import com.qdrantup.uploader.model.Point;

import java.util.List;

/**
 * The three store operations the upload pipeline needs. Implementations block until
 * the remote call completes.
 */
public interface VectorStore {

    boolean collectionExists(String collection) throws StoreException;

    void createCollection(String collection, int dimensions, DistanceMetric metric) throws StoreException;

    /**
     * Writes (inserts or overwrites) the given points in a single call.
     */
    void upsert(String collection, List<Point> points) throws StoreException;
}
