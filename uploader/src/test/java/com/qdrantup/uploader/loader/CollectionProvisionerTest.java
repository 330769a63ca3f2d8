package com.qdrantup.uploader.loader;

import com.qdrantup.uploader.exception.ProvisioningException;
import com.qdrantup.uploader.exception.StoreException;
import com.qdrantup.uploader.exception.UploadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link CollectionProvisioner}.
 */
@ExtendWith(MockitoExtension.class)
class CollectionProvisionerTest {

    @Mock
    private VectorStore store;

    @Test
    @DisplayName("Missing collection is created with the requested size and cosine distance")
    void missingCollection_created() throws Exception {
        InMemoryVectorStore fake = new InMemoryVectorStore();

        CollectionProvisioner.Outcome outcome = new CollectionProvisioner(fake).ensureCollection("documents", 768);

        assertEquals(CollectionProvisioner.Outcome.CREATED, outcome);
        assertEquals(1, fake.createCalls());
        assertEquals(new InMemoryVectorStore.CollectionSpec(768, DistanceMetric.COSINE), fake.collection("documents"));
    }

    @Test
    @DisplayName("Running twice issues no second create call and no error")
    void secondRun_isIdempotent() throws Exception {
        InMemoryVectorStore fake = new InMemoryVectorStore();
        CollectionProvisioner provisioner = new CollectionProvisioner(fake);

        provisioner.ensureCollection("documents", 768);
        CollectionProvisioner.Outcome second = provisioner.ensureCollection("documents", 768);

        assertEquals(CollectionProvisioner.Outcome.EXISTING, second);
        assertEquals(1, fake.createCalls());
        assertEquals(2, fake.existsCalls());
    }

    @Test
    @DisplayName("Existing collection with a different size is left untouched")
    void existingCollection_notRevalidated() throws Exception {
        InMemoryVectorStore fake = new InMemoryVectorStore()
                .withCollection("documents", 384, DistanceMetric.COSINE);

        CollectionProvisioner.Outcome outcome = new CollectionProvisioner(fake).ensureCollection("documents", 768);

        assertEquals(CollectionProvisioner.Outcome.EXISTING, outcome);
        assertEquals(0, fake.createCalls());
        assertEquals(new InMemoryVectorStore.CollectionSpec(384, DistanceMetric.COSINE), fake.collection("documents"));
    }

    @Test
    @DisplayName("Existence check failure is a ProvisioningException and nothing is created")
    void existsFailure_throws() throws Exception {
        when(store.collectionExists("documents")).thenThrow(new StoreException("UNAVAILABLE"));

        ProvisioningException ex = assertThrows(ProvisioningException.class,
                () -> new CollectionProvisioner(store).ensureCollection("documents", 768));

        assertEquals(UploadException.Stage.PROVISION, ex.getStage());
        assertTrue(ex.getMessage().contains("check"));
        verify(store, never()).createCollection(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("Create failure is a ProvisioningException naming the collection")
    void createFailure_throws() throws Exception {
        when(store.collectionExists("documents")).thenReturn(false);
        doThrow(new StoreException("PERMISSION_DENIED"))
                .when(store).createCollection("documents", 768, DistanceMetric.COSINE);

        ProvisioningException ex = assertThrows(ProvisioningException.class,
                () -> new CollectionProvisioner(store).ensureCollection("documents", 768));

        assertTrue(ex.getMessage().contains("create collection: documents"));
        assertInstanceOf(StoreException.class, ex.getCause());
    }
}
