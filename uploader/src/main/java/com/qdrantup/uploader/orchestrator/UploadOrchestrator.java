package com.qdrantup.uploader.orchestrator;

import com.qdrantup.uploader.client.EndpointNormalizer;
import com.qdrantup.uploader.client.QdrantConnector;
import com.qdrantup.uploader.client.StoreConnection;
import com.qdrantup.uploader.config.AppConfig;
import com.qdrantup.uploader.exception.UploadException;
import com.qdrantup.uploader.input.InputLoader;
import com.qdrantup.uploader.loader.BatchUploadResult;
import com.qdrantup.uploader.loader.BatchUpserter;
import com.qdrantup.uploader.loader.CollectionProvisioner;
import com.qdrantup.uploader.loader.QdrantVectorStore;
import com.qdrantup.uploader.loader.VectorStore;
import com.qdrantup.uploader.model.InputDataset;
import com.qdrantup.uploader.progress.ProgressListener;
import io.qdrant.client.QdrantClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.function.Function;

/**
 * Runs the upload pipeline: load input -> normalize endpoint -> connect ->
 * provision collection -> upsert batches. Any stage failure aborts the run and is
 * rethrown unchanged; nothing is retried and nothing is checkpointed.
 */
public class UploadOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(UploadOrchestrator.class);

    private final InputLoader inputLoader;
    private final QdrantConnector connector;
    private final Function<QdrantClient, VectorStore> storeFactory;

    public UploadOrchestrator() {
        this(new InputLoader(), new QdrantConnector(), QdrantVectorStore::new);
    }

    // Visible for testing
    UploadOrchestrator(InputLoader inputLoader, QdrantConnector connector,
                       Function<QdrantClient, VectorStore> storeFactory) {
        this.inputLoader = inputLoader;
        this.connector = connector;
        this.storeFactory = storeFactory;
    }

    /**
     * Runs one upload.
     *
     * @param config   resolved configuration
     * @param listener receives one event per stored batch and a final completion event
     * @return summary of the run
     * @throws UploadException from whichever stage failed first
     */
    public UploadSummary run(AppConfig config, ProgressListener listener) throws UploadException {
        Instant runStart = Instant.now();
        logger.info("Starting upload of {} into collection {}", config.getInputPath(), config.getCollection());

        InputDataset dataset = inputLoader.load(config.getInputPath());
        URI endpoint = EndpointNormalizer.normalize(config.getUrl());

        try (StoreConnection connection = connector.connect(endpoint, config)) {
            VectorStore store = storeFactory.apply(connection.client());

            CollectionProvisioner.Outcome outcome = new CollectionProvisioner(store)
                    .ensureCollection(config.getCollection(), config.getDimensions());

            BatchUploadResult uploaded = new BatchUpserter(store)
                    .upsertAll(config.getCollection(), dataset, config.getBatchSize(), listener);

            UploadSummary summary = new UploadSummary(
                    config.getCollection(),
                    outcome,
                    uploaded.totalBatches(),
                    uploaded.totalPoints(),
                    elapsed(runStart));
            logSummary(summary);
            return summary;
        }
    }

    private void logSummary(UploadSummary summary) {
        logger.info("=== Upload Summary ===");
        logger.info("Collection: {} ({})", summary.collection(),
                summary.collectionCreated() ? "created" : "existing");
        logger.info("Points: {} in {} batches", summary.totalPoints(), summary.totalBatches());
        logger.info("Duration: {}ms", summary.durationMs());
    }

    private long elapsed(Instant start) {
        return Instant.now().toEpochMilli() - start.toEpochMilli();
    }
}
