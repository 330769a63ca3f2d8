package com.qdrantup.uploader.loader;

import com.google.common.util.concurrent.ListenableFuture;
import com.qdrantup.uploader.exception.StoreException;
import com.qdrantup.uploader.model.Point;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * {@link VectorStore} backed by the Qdrant gRPC client. Each call is awaited before
 * returning, so at most one request is in flight per caller thread.
 */
public class QdrantVectorStore implements VectorStore {

    private static final Logger logger = LoggerFactory.getLogger(QdrantVectorStore.class);

    private final QdrantClient client;
    private final PointConverter converter;

    public QdrantVectorStore(QdrantClient client) {
        this(client, new PointConverter());
    }

    QdrantVectorStore(QdrantClient client, PointConverter converter) {
        this.client = client;
        this.converter = converter;
    }

    @Override
    public boolean collectionExists(String collection) throws StoreException {
        String action = "checking collection " + collection;
        try {
            return await(client.collectionExistsAsync(collection), action);
        } catch (RuntimeException e) {
            throw failure(action, e);
        }
    }

    @Override
    public void createCollection(String collection, int dimensions, DistanceMetric metric)
            throws StoreException {
        VectorParams params = VectorParams.newBuilder()
                .setSize(dimensions)
                .setDistance(toDistance(metric))
                .build();
        String action = "creating collection " + collection;
        try {
            await(client.createCollectionAsync(collection, params), action);
        } catch (RuntimeException e) {
            throw failure(action, e);
        }
    }

    @Override
    public void upsert(String collection, List<Point> points) throws StoreException {
        List<PointStruct> structs = new ArrayList<>(points.size());
        for (Point point : points) {
            structs.add(converter.toPointStruct(point));
        }

        String action = "upserting " + structs.size() + " points into " + collection;
        UpdateResult result;
        try {
            result = await(client.upsertAsync(collection, structs), action);
        } catch (RuntimeException e) {
            throw failure(action, e);
        }
        logger.debug("Upsert into {} finished: operation_id={}, status={}",
                collection, result.getOperationId(), result.getStatus());
    }

    static Distance toDistance(DistanceMetric metric) {
        return switch (metric) {
            case COSINE -> Distance.Cosine;
        };
    }

    private static <T> T await(ListenableFuture<T> future, String action) throws StoreException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new StoreException("Interrupted while " + action, e);
        } catch (ExecutionException e) {
            throw failure(action, e.getCause() != null ? e.getCause() : e);
        }
    }

    private static StoreException failure(String action, Throwable cause) {
        return new StoreException("Failed " + action + ": " + describe(cause), cause);
    }

    static String describe(Throwable cause) {
        if (cause instanceof StatusRuntimeException sre) {
            Status status = sre.getStatus();
            return status.getCode() + (status.getDescription() != null ? " " + status.getDescription() : "");
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
