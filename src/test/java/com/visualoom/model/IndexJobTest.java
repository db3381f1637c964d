package com.visualoom.model;

import com.visualoom.dto.JobStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndexJobTest {

    @Test
    void newJobIsCreatedAndNotDone() {
        JobStatus status = new IndexJob("j1", "/photos", null).snapshot();

        assertEquals(JobState.CREATED, status.getState());
        assertFalse(status.isDone());
        assertEquals(0, status.getProgress());
    }

    @Test
    void progressIsFlooredPercentageOfProcessed() {
        IndexJob job = new IndexJob("j1", "/photos", null);
        job.markRunning();
        job.start(3);

        job.update(1, 1);
        assertEquals(33, job.snapshot().getProgress());

        job.update(2, 1);
        assertEquals(66, job.snapshot().getProgress());
        assertEquals(1, job.snapshot().getIndexed());
    }

    @Test
    void zeroTotalKeepsProgressAtZeroUntilCompletion() {
        IndexJob job = new IndexJob("j1", "/photos", null);
        job.markRunning();
        job.start(0);
        job.update(0, 0);
        assertEquals(0, job.snapshot().getProgress());

        job.complete(0);

        assertEquals(100, job.snapshot().getProgress());
        assertTrue(job.snapshot().isDone());
    }

    @Test
    void terminalStateIsFinal() {
        IndexJob job = new IndexJob("j1", "/photos", null);
        job.markRunning();
        job.start(4);
        job.update(1, 0);
        job.fail("boom");

        job.complete(4);
        job.update(4, 4);
        job.fail("second");

        JobStatus status = job.snapshot();
        assertEquals(JobState.FAILED, status.getState());
        assertEquals("boom", status.getError());
        assertEquals(25, status.getProgress());
        assertEquals(0, status.getIndexed());
    }
}
