package com.qdrantup.uploader.loader;

import com.qdrantup.uploader.exception.ProvisioningException;
import com.qdrantup.uploader.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure the target collection exists before any point is written. An existing
 * collection is used as-is, even if its size or metric differ from the requested ones.
 */
public class CollectionProvisioner {

    private static final Logger logger = LoggerFactory.getLogger(CollectionProvisioner.class);

    public enum Outcome {
        CREATED,
        EXISTING
    }

    private final VectorStore store;

    public CollectionProvisioner(VectorStore store) {
        this.store = store;
    }

    /**
     * Creates {@code collection} with cosine distance if it does not exist yet.
     *
     * @throws ProvisioningException if the existence check or the create call fails
     */
    public Outcome ensureCollection(String collection, int dimensions) throws ProvisioningException {
        boolean exists;
        try {
            exists = store.collectionExists(collection);
        } catch (StoreException e) {
            throw new ProvisioningException("Failed to check whether collection exists: " + collection, e);
        }

        if (exists) {
            logger.debug("Collection already exists: {}", collection);
            return Outcome.EXISTING;
        }

        logger.info("Creating collection: {} (size={}, distance=cosine)", collection, dimensions);
        try {
            store.createCollection(collection, dimensions, DistanceMetric.COSINE);
        } catch (StoreException e) {
            throw new ProvisioningException("Failed to create collection: " + collection, e);
        }
        return Outcome.CREATED;
    }
}
