package com.qdrantup.uploader.client;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.qdrantup.uploader.config.AppConfig;
import com.qdrantup.uploader.config.CompressionMode;
import com.qdrantup.uploader.exception.ConnectionException;
import io.grpc.CompressorRegistry;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Builds a configured Qdrant gRPC client for a normalized endpoint.
 *
 * <p>The channel is created lazily, so no network call happens here. Settings applied:
 * <ul>
 *   <li>API key (when one is configured) and per-call timeout</li>
 *   <li>HTTP/2 keep-alive pings even while idle, so the connection survives between batches</li>
 *   <li>no server version compatibility check</li>
 *   <li>request compression; codecs missing from the gRPC registry fall back to gzip</li>
 *   <li>a channel executor sized by the configured pool size</li>
 * </ul>
 */
public class QdrantConnector {

    private static final Logger logger = LoggerFactory.getLogger(QdrantConnector.class);

    static final long KEEP_ALIVE_SECONDS = 30;
    static final String FALLBACK_CODEC = CompressionMode.GZIP.codecName();

    private final CompressorRegistry compressorRegistry;

    public QdrantConnector() {
        this(CompressorRegistry.getDefaultInstance());
    }

    // Visible for testing
    QdrantConnector(CompressorRegistry compressorRegistry) {
        this.compressorRegistry = compressorRegistry;
    }

    /**
     * @param endpoint output of {@link EndpointNormalizer#normalize(String)}
     * @throws ConnectionException if the channel or client cannot be built
     */
    public StoreConnection connect(URI endpoint, AppConfig config) throws ConnectionException {
        logger.info("Connecting to: {}", endpoint);
        logger.info("Timeout: {}s, Pool size: {}, Compression: {}",
                config.getTimeout().toSeconds(), config.getPoolSize(), config.getCompression().label());

        String codec = resolveCodec(config.getCompression());
        ExecutorService executor = Executors.newFixedThreadPool(config.getPoolSize(),
                new ThreadFactoryBuilder()
                        .setNameFormat("qdrant-grpc-%d")
                        .setDaemon(true)
                        .build());

        try {
            ManagedChannel channel = buildChannel(endpoint, codec, executor);

            QdrantGrpcClient.Builder grpcBuilder = QdrantGrpcClient.newBuilder(channel, true, false)
                    .withTimeout(config.getTimeout());
            if (config.hasApiKey()) {
                grpcBuilder = grpcBuilder.withApiKey(config.getApiKey());
            }

            QdrantClient client = new QdrantClient(grpcBuilder.build());
            return new StoreConnection(client, executor, endpoint, codec);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw new ConnectionException("Failed to create Qdrant client for " + endpoint, e);
        }
    }

    ManagedChannel buildChannel(URI endpoint, String codec, ExecutorService executor) {
        ManagedChannelBuilder<?> builder = ManagedChannelBuilder
                .forAddress(endpoint.getHost(), endpoint.getPort())
                .keepAliveTime(KEEP_ALIVE_SECONDS, TimeUnit.SECONDS)
                .keepAliveWithoutCalls(true)
                .executor(executor);

        if (usesTls(endpoint)) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        if (codec != null) {
            builder.intercept(new CompressionInterceptor(codec));
        }
        return builder.build();
    }

    /**
     * Maps the requested mode to a codec the transport can actually use.
     *
     * @return the codec name, or {@code null} for no compression
     */
    String resolveCodec(CompressionMode requested) {
        String codec = requested.codecName();
        if (codec == null) {
            return null;
        }
        if (compressorRegistry.lookupCompressor(codec) != null) {
            return codec;
        }
        logger.warn("Warning: {} compression not available, using {}",
                requested.label(), FALLBACK_CODEC);
        return FALLBACK_CODEC;
    }

    static boolean usesTls(URI endpoint) {
        String scheme = endpoint.getScheme().toLowerCase(Locale.ROOT);
        return scheme.equals("https") || scheme.equals("grpcs");
    }
}
