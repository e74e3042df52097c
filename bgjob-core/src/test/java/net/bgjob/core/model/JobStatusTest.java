package net.bgjob.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

    @Test
    void terminal_states_are_exactly_completed_tagged_failed_canceled() {
        for (JobStatus s : JobStatus.values()) {
            boolean expected = s == JobStatus.COMPLETED || s == JobStatus.COMPLETED_BY_TAG
                    || s == JobStatus.FAILED || s == JobStatus.CANCELED;
            assertEquals(expected, s.isTerminal(), s.name());
        }
    }

    @Test
    void streaming_substates_and_running_are_in_progress() {
        assertTrue(JobStatus.PREPARING_INPUT.isInProgress());
        assertTrue(JobStatus.GENERATING_STREAM.isInProgress());
        assertTrue(JobStatus.PROCESSING_STREAM.isInProgress());
        assertTrue(JobStatus.RUNNING.isInProgress());
        assertFalse(JobStatus.QUEUED.isInProgress());
        assertFalse(JobStatus.ACKNOWLEDGED_BY_WORKER.isInProgress());
    }

    @Test
    void from_accepts_wire_code_and_enum_name() {
        assertEquals(JobStatus.ACKNOWLEDGED_BY_WORKER, JobStatus.from("acknowledged_by_worker"));
        assertEquals(JobStatus.COMPLETED_BY_TAG, JobStatus.from("COMPLETED_BY_TAG"));
        assertThrows(IllegalArgumentException.class, () -> JobStatus.from("paused"));
        assertThrows(IllegalArgumentException.class, () -> JobStatus.from(null));
    }
}
