package com.qdrantup.uploader.client;

import io.qdrant.client.QdrantClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * An open client handle together with the resources it owns. Closing it closes the
 * Qdrant client (which shuts down its channel) and then the channel executor.
 */
public class StoreConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StoreConnection.class);

    private static final long EXECUTOR_SHUTDOWN_SECONDS = 5;

    private final QdrantClient client;
    private final ExecutorService executor;
    private final URI endpoint;
    private final String compressionCodec;

    StoreConnection(QdrantClient client, ExecutorService executor, URI endpoint, String compressionCodec) {
        this.client = client;
        this.executor = executor;
        this.endpoint = endpoint;
        this.compressionCodec = compressionCodec;
    }

    public QdrantClient client() {
        return client;
    }

    public URI endpoint() {
        return endpoint;
    }

    /**
     * @return the codec applied to outgoing requests, or {@code null} when uncompressed
     */
    public String compressionCodec() {
        return compressionCodec;
    }

    @Override
    public void close() {
        try {
            client.close();
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
            logger.debug("Closed connection to {}", endpoint);
        }
    }
}
