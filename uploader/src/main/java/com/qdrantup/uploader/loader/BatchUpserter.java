package com.qdrantup.uploader.loader;

import com.qdrantup.uploader.exception.StoreException;
import com.qdrantup.uploader.exception.UpsertException;
import com.qdrantup.uploader.model.InputDataset;
import com.qdrantup.uploader.model.Point;
import com.qdrantup.uploader.progress.CompletionEvent;
import com.qdrantup.uploader.progress.ProgressEvent;
import com.qdrantup.uploader.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes a dataset to the store in contiguous, fixed-size batches.
 *
 * <p>Batches are sent strictly one after another in input order. The first failed batch
 * ends the run: it is not retried, later batches are not attempted, and no completion
 * event is emitted.
 */
public class BatchUpserter {

    private static final Logger logger = LoggerFactory.getLogger(BatchUpserter.class);

    private final VectorStore store;

    public BatchUpserter(VectorStore store) {
        this.store = store;
    }

    /**
     * @return how many batches were sent and how many points they held
     * @throws IllegalArgumentException if {@code batchSize} is less than 1
     * @throws UpsertException          carrying the 1-based index of the failed batch
     */
    public BatchUploadResult upsertAll(String collection, InputDataset dataset, int batchSize, ProgressListener listener)
            throws UpsertException {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batch size must be at least 1, got: " + batchSize);
        }

        List<Point> points = dataset.points();
        int totalBatches = totalBatches(points.size(), batchSize);
        logger.info("Uploading {} points to {} in {} batches of up to {}",
                points.size(), collection, totalBatches, batchSize);

        for (int batchIndex = 1; batchIndex <= totalBatches; batchIndex++) {
            int from = (batchIndex - 1) * batchSize;
            int to = Math.min(from + batchSize, points.size());
            List<Point> batch = points.subList(from, to);

            try {
                store.upsert(collection, batch);
            } catch (StoreException e) {
                logger.error("Batch {}/{} failed: {}", batchIndex, totalBatches, e.getMessage());
                throw new UpsertException(batchIndex, totalBatches, e);
            }

            logger.debug("Batch {}/{} stored ({} points)", batchIndex, totalBatches, batch.size());
            listener.onBatchUploaded(new ProgressEvent(batchIndex, totalBatches, batch.size()));
        }

        listener.onComplete(new CompletionEvent(points.size()));
        return new BatchUploadResult(totalBatches, points.size());
    }

    static int totalBatches(int pointCount, int batchSize) {
        return (int) ((pointCount + (long) batchSize - 1) / batchSize);
    }
}
