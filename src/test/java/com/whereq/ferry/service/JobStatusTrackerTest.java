package com.whereq.ferry.service;

import com.whereq.ferry.model.JobStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusTrackerTest {

    private final JobStatusTracker tracker = new JobStatusTracker();

    @Test
    void lifecycleSetsTimestamps() {
        tracker.register("1", "align");
        tracker.updateStatus("1", JobStatus.SUBMITTED);
        tracker.updateStatus("1", JobStatus.RUNNING);
        tracker.updateStatus("1", JobStatus.SUCCEEDED);

        JobStatusTracker.JobMetadata metadata = tracker.getMetadata("1").orElseThrow();
        assertThat(metadata.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(metadata.getCreatedAt()).isNotNull();
        assertThat(metadata.getSubmittedAt()).isNotNull();
        assertThat(metadata.getStartedAt()).isNotNull();
        assertThat(metadata.getCompletedAt()).isNotNull();
    }

    @Test
    void terminalStatusIsFinal() {
        tracker.register("1", "align");
        tracker.updateStatus("1", JobStatus.FAILED, "out of memory");
        tracker.updateStatus("1", JobStatus.CANCELLED);

        JobStatusTracker.JobMetadata metadata = tracker.getMetadata("1").orElseThrow();
        assertThat(metadata.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(metadata.getErrorMessage()).isEqualTo("out of memory");
    }

    @Test
    void unknownJobsAreIgnored() {
        tracker.updateStatus("missing", JobStatus.RUNNING);

        assertThat(tracker.getMetadata("missing")).isEmpty();
    }

    @Test
    void metadataIsACopy() {
        tracker.register("1", "align");
        tracker.getMetadata("1").orElseThrow().setStatus(JobStatus.SUCCEEDED);

        assertThat(tracker.getMetadata("1").orElseThrow().getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(tracker.getByStatus(JobStatus.PENDING)).hasSize(1);
    }
}
