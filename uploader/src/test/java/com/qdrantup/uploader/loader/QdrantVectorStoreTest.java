package com.qdrantup.uploader.loader;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.SettableFuture;
import com.qdrantup.uploader.exception.StoreException;
import com.qdrantup.uploader.model.Point;
import com.qdrantup.uploader.model.PointFixtures;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.CollectionOperationResponse;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.UpdateResult;
import io.qdrant.client.grpc.Points.UpdateStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link QdrantVectorStore} using a mocked Qdrant client. Covers request
 * construction, awaiting of the client's futures, and error translation.
 */
@ExtendWith(MockitoExtension.class)
class QdrantVectorStoreTest {

    @Mock
    private QdrantClient client;

    private QdrantVectorStore store;

    @BeforeEach
    void setUp() {
        store = new QdrantVectorStore(client);
    }

    // =========================================================================
    // Collection operations
    // =========================================================================

    @Test
    @DisplayName("collectionExists returns the client's answer")
    void collectionExists_delegates() throws Exception {
        when(client.collectionExistsAsync("documents")).thenReturn(Futures.immediateFuture(true));
        when(client.collectionExistsAsync("missing")).thenReturn(Futures.immediateFuture(false));

        assertTrue(store.collectionExists("documents"));
        assertFalse(store.collectionExists("missing"));
    }

    @Test
    @DisplayName("createCollection sends vector size and cosine distance")
    void createCollection_sendsVectorParams() throws Exception {
        when(client.createCollectionAsync(eq("documents"), any(VectorParams.class)))
                .thenReturn(Futures.immediateFuture(CollectionOperationResponse.getDefaultInstance()));

        store.createCollection("documents", 768, DistanceMetric.COSINE);

        ArgumentCaptor<VectorParams> captor = ArgumentCaptor.forClass(VectorParams.class);
        verify(client).createCollectionAsync(eq("documents"), captor.capture());
        assertEquals(768L, captor.getValue().getSize());
        assertEquals(Distance.Cosine, captor.getValue().getDistance());
    }

    // =========================================================================
    // Upsert
    // =========================================================================

    @Test
    @DisplayName("upsert converts every point and sends them in one call, in order")
    void upsert_sendsAllPointsInOneCall() throws Exception {
        when(client.upsertAsync(eq("documents"), anyList()))
                .thenReturn(Futures.immediateFuture(UpdateResult.newBuilder()
                        .setOperationId(1)
                        .setStatus(UpdateStatus.Completed)
                        .build()));
        List<Point> batch = PointFixtures.dataset(3).points();

        store.upsert("documents", batch);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<PointStruct>> captor = ArgumentCaptor.forClass(List.class);
        verify(client, times(1)).upsertAsync(eq("documents"), captor.capture());
        List<String> sentIds = captor.getValue().stream().map(p -> p.getId().getUuid()).toList();
        assertEquals(batch.stream().map(Point::id).toList(), sentIds);
    }

    @Test
    @DisplayName("A failed future becomes a StoreException carrying the gRPC status")
    void upsert_failedFuture_throws() {
        when(client.upsertAsync(eq("documents"), anyList()))
                .thenReturn(Futures.immediateFailedFuture(
                        new StatusRuntimeException(Status.DEADLINE_EXCEEDED.withDescription("deadline exceeded after 30s"))));

        StoreException ex = assertThrows(StoreException.class,
                () -> store.upsert("documents", PointFixtures.dataset(2).points()));

        assertTrue(ex.getMessage().contains("DEADLINE_EXCEEDED"));
        assertTrue(ex.getMessage().contains("deadline exceeded after 30s"));
        assertInstanceOf(StatusRuntimeException.class, ex.getCause());
    }

    @Test
    @DisplayName("A client that throws synchronously is reported as a StoreException")
    void collectionExists_synchronousFailure_throws() {
        when(client.collectionExistsAsync("documents")).thenThrow(new IllegalStateException("client closed"));

        StoreException ex = assertThrows(StoreException.class, () -> store.collectionExists("documents"));

        assertTrue(ex.getMessage().contains("client closed"));
    }

    @Test
    @DisplayName("Interruption while waiting restores the interrupt flag and cancels the call")
    void interrupted_restoresFlag() {
        SettableFuture<Boolean> pending = SettableFuture.create();
        when(client.collectionExistsAsync("documents")).thenReturn(pending);

        Thread.currentThread().interrupt();
        try {
            StoreException ex = assertThrows(StoreException.class, () -> store.collectionExists("documents"));
            assertTrue(ex.getMessage().startsWith("Interrupted"));
            assertTrue(Thread.currentThread().isInterrupted());
            assertTrue(pending.isCancelled());
        } finally {
            Thread.interrupted();
        }
    }
}
