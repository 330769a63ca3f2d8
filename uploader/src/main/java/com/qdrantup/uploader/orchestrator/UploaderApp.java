package com.qdrantup.uploader.orchestrator;

import com.qdrantup.uploader.config.AppConfig;
import com.qdrantup.uploader.exception.UploadException;
import com.qdrantup.uploader.exception.UpsertException;
import com.qdrantup.uploader.progress.StdoutProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Qdrant uploader.
 *
 * <p>Usage:
 * <pre>
 *   java -jar uploader.jar --url https://xyz.cloud.qdrant.io --api-key KEY --input points.json \
 *       [--collection documents] [--dimensions 768] [--batch-size 100] [--timeout 30] \
 *       [--pool-size 3] [--compression none|gzip|zstd|lz4]
 * </pre>
 *
 * <p>Progress lines go to stdout; everything else is logged to stderr. Exits 0 on
 * success and 1 on any failure.
 */
public class UploaderApp {

    private static final Logger logger = LoggerFactory.getLogger(UploaderApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        System.exit(run(args, new UploadOrchestrator()));
    }

    static int run(String[] args, UploadOrchestrator orchestrator) {
        AppConfig config;
        try {
            config = AppConfig.fromArgs(args);
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            orchestrator.run(config, new StdoutProgressReporter());
            logger.info("Upload finished successfully.");
            return EXIT_OK;
        } catch (UpsertException e) {
            logger.error("Upload aborted at batch {}", e.getBatchIndex(), e);
            return EXIT_FAILURE;
        } catch (UploadException e) {
            logger.error("Upload failed during {} stage", e.getStage(), e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            logger.error("Fatal error during upload", e);
            return EXIT_FAILURE;
        }
    }
}
