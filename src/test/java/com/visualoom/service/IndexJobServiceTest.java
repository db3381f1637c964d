package com.visualoom.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visualoom.config.AppConfig;
import com.visualoom.dto.JobStatus;
import com.visualoom.model.ImageRecord;
import com.visualoom.model.JobState;
import com.visualoom.repository.CatalogRepository;
import com.visualoom.repository.TagRepository;
import com.visualoom.service.embedding.EmbeddingModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IndexJobServiceTest {

    @TempDir
    Path tempDir;

    private final ImageIndexerService indexer = mock(ImageIndexerService.class);

    /** Runs the job on the calling thread */
    private final IndexJobService directService = new IndexJobService(indexer, Runnable::run);

    @Test
    void completedJobReportsTotalsAndFullProgress() {
        when(indexer.index(any(Path.class), any(), any(IndexProgressListener.class))).thenAnswer(inv -> {
            IndexProgressListener listener = inv.getArgument(2);
            listener.onDiscovered(4);
            listener.onProgress(2, 1);
            JobStatus midway = directService.listJobs().get(0);
            assertEquals(JobState.RUNNING, midway.getState());
            assertEquals(50, midway.getProgress());
            assertEquals(1, midway.getIndexed());
            assertFalse(midway.isDone());
            listener.onProgress(4, 3);
            return List.of(new ImageRecord(), new ImageRecord(), new ImageRecord());
        });

        String jobId = directService.submit("/photos", null);
        JobStatus status = directService.status(jobId).orElseThrow();

        assertEquals(JobState.COMPLETED, status.getState());
        assertTrue(status.isDone());
        assertEquals(100, status.getProgress());
        assertEquals(4, status.getTotal());
        assertEquals(3, status.getIndexed());
        assertNull(status.getError());
        assertEquals("/photos", status.getPath());
    }

    @Test
    void tagIsTrimmedAndPassedToIndexer() {
        when(indexer.index(any(Path.class), any(), any(IndexProgressListener.class))).thenReturn(List.of());

        String jobId = directService.submit("/photos", "  Holiday ");

        verify(indexer).index(eq(Path.of("/photos")), eq("Holiday"), any(IndexProgressListener.class));
        assertEquals("Holiday", directService.status(jobId).orElseThrow().getTag());
    }

    @Test
    void blankTagIsDropped() {
        when(indexer.index(any(Path.class), any(), any(IndexProgressListener.class))).thenReturn(List.of());

        directService.submit("/photos", "   ");

        verify(indexer).index(eq(Path.of("/photos")), isNull(), any(IndexProgressListener.class));
    }

    @Test
    void failureIsRecordedOnTheJob() {
        when(indexer.index(any(Path.class), any(), any(IndexProgressListener.class))).thenAnswer(inv -> {
            IndexProgressListener listener = inv.getArgument(2);
            listener.onDiscovered(4);
            listener.onProgress(1, 0);
            throw new IllegalStateException("disk full");
        });

        String jobId = assertDoesNotThrow(() -> directService.submit("/photos", null));
        JobStatus status = directService.status(jobId).orElseThrow();

        assertEquals(JobState.FAILED, status.getState());
        assertTrue(status.isDone());
        assertEquals("disk full", status.getError());
        assertEquals(25, status.getProgress());
    }

    @Test
    void failureWithoutMessageUsesExceptionName() {
        when(indexer.index(any(Path.class), any(), any(IndexProgressListener.class)))
                .thenThrow(new NullPointerException());

        String jobId = directService.submit("/photos", null);

        assertEquals(NullPointerException.class.getName(), directService.status(jobId).orElseThrow().getError());
    }

    @Test
    void rejectedSubmissionFailsTheJob() {
        IndexJobService service = new IndexJobService(indexer, task -> {
            throw new RejectedExecutionException("full");
        });

        String jobId = service.submit("/photos", null);
        JobStatus status = service.status(jobId).orElseThrow();

        assertEquals(JobState.FAILED, status.getState());
        assertEquals("Indexing queue is full", status.getError());
    }

    @Test
    void blankPathIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> directService.submit("  ", null));
        assertThrows(IllegalArgumentException.class, () -> directService.submit(null, null));
        assertTrue(directService.listJobs().isEmpty());
    }

    @Test
    void unknownJobHasNoStatus() {
        assertTrue(directService.status("no-such-job").isEmpty());
        assertTrue(directService.status(null).isEmpty());
    }

    @Test
    void submitReturnsBeforeTheSweepFinishes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(indexer.index(any(Path.class), any(), any(IndexProgressListener.class))).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            IndexJobService service = new IndexJobService(indexer, executor);

            String jobId = service.submit("/photos", null);
            assertFalse(service.status(jobId).orElseThrow().isDone());

            release.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            assertEquals(JobState.COMPLETED, service.status(jobId).orElseThrow().getState());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void jobWithNoNewImagesCompletesAtFullProgress() throws Exception {
        AppConfig appConfig = new AppConfig();
        appConfig.setCatalogFile(tempDir.resolve("image_data.json").toString());
        appConfig.setTagFile(tempDir.resolve("tags.json").toString());
        ObjectMapper mapper = new ObjectMapper();
        CatalogRepository catalogRepository = new CatalogRepository(appConfig, mapper);
        catalogRepository.load();
        TagRepository tagRepository = new TagRepository(appConfig, mapper);
        tagRepository.load();
        EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
        when(embeddingModel.imageEmbedding(any(Path.class))).thenReturn(Optional.empty());
        ImageIndexerService realIndexer = new ImageIndexerService(catalogRepository, new EmbeddingStore(),
                new MetadataExtractor(), embeddingModel, new TagService(tagRepository, catalogRepository), appConfig);
        Path photos = tempDir.resolve("photos");
        TestImages.png(photos.resolve("a.png"));
        realIndexer.index(photos);

        IndexJobService service = new IndexJobService(realIndexer, Runnable::run);
        String jobId = service.submit(photos.toString(), null);
        JobStatus status = service.status(jobId).orElseThrow();

        assertTrue(status.isDone());
        assertEquals(JobState.COMPLETED, status.getState());
        assertEquals(100, status.getProgress());
        assertEquals(0, status.getTotal());
        assertEquals(0, status.getIndexed());
    }

    @Test
    void missingDirectoryFailsTheJob() {
        ImageIndexerService realIndexer = new ImageIndexerService(null, new EmbeddingStore(),
                new MetadataExtractor(), null, null, new AppConfig());
        IndexJobService service = new IndexJobService(realIndexer, Runnable::run);

        String jobId = service.submit(tempDir.resolve("missing").toString(), null);
        JobStatus status = service.status(jobId).orElseThrow();

        assertEquals(JobState.FAILED, status.getState());
        assertTrue(status.getError().startsWith("Not a directory"));
    }

    @Test
    void listJobsReturnsEveryJob() {
        when(indexer.index(any(Path.class), any(), any(IndexProgressListener.class))).thenReturn(List.of());

        directService.submit("/a", null);
        directService.submit("/b", null);

        assertEquals(2, directService.listJobs().size());
    }
}
