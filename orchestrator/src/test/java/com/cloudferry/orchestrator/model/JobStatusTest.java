package com.cloudferry.orchestrator.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusTest {

    @Test
    void terminalAndActive_partitionAllStatuses() {
        assertThat(JobStatus.terminalStatuses()).containsExactlyInAnyOrder(
                JobStatus.COMPLETED, JobStatus.CANCELLED,
                JobStatus.FETCH_FAILED, JobStatus.STAGE_FAILED, JobStatus.PUSH_FAILED, JobStatus.FAILED);
        assertThat(JobStatus.activeStatuses()).hasSize(JobStatus.values().length - 6)
                .doesNotContainAnyElementsOf(JobStatus.terminalStatuses());
    }

    @ParameterizedTest
    @EnumSource(JobStatus.class)
    void everyStatus_hasExactlyOneKind(JobStatus status) {
        int kinds = 0;
        if (status.isActive())    kinds++;
        if (status.isCompleted()) kinds++;
        if (status.isFailed())    kinds++;
        if (status.isCancelled()) kinds++;
        assertThat(kinds).isEqualTo(1);
        assertThat(status.isTerminal()).isEqualTo(!status.isActive());
    }

    @Test
    void retryStatuses_areActive() {
        assertThat(JobStatus.FETCH_RETRY.isActive()).isTrue();
        assertThat(JobStatus.STAGE_RETRY.isRetrying()).isTrue();
        assertThat(JobStatus.PUSH_RETRY.isTerminal()).isFalse();
    }

    @Test
    void workerTransitions_areForwardOnly() {
        assertThat(JobStatus.QUEUED.allowsWorkerTransitionTo(JobStatus.FETCHING)).isTrue();
        assertThat(JobStatus.FETCH_RETRY.allowsWorkerTransitionTo(JobStatus.FETCHING)).isTrue();
        assertThat(JobStatus.FETCHING.allowsWorkerTransitionTo(JobStatus.STAGING)).isTrue();
        assertThat(JobStatus.STAGING.allowsWorkerTransitionTo(JobStatus.PENDING_PUSH)).isTrue();
        assertThat(JobStatus.PUSHING.allowsWorkerTransitionTo(JobStatus.COMPLETED)).isTrue();

        assertThat(JobStatus.STAGING.allowsWorkerTransitionTo(JobStatus.FETCHING)).isFalse();
        assertThat(JobStatus.PUSHING.allowsWorkerTransitionTo(JobStatus.PENDING_PUSH)).isFalse();
    }

    @Test
    void workerTransitions_neverLeaveOrEnterOutOfBandStatuses() {
        assertThat(JobStatus.COMPLETED.allowsWorkerTransitionTo(JobStatus.COMPLETED)).isFalse();
        assertThat(JobStatus.FETCH_FAILED.allowsWorkerTransitionTo(JobStatus.FETCHING)).isFalse();
        assertThat(JobStatus.FETCHING.allowsWorkerTransitionTo(JobStatus.CANCELLED)).isFalse();
        assertThat(JobStatus.PUSHING.allowsWorkerTransitionTo(JobStatus.PUSH_FAILED)).isFalse();
    }

    @Test
    void phaseLookups() {
        assertThat(JobStatus.retryStatusOf(Phase.STAGE)).isEqualTo(JobStatus.STAGE_RETRY);
        assertThat(JobStatus.failureStatusOf(Phase.PUSH)).isEqualTo(JobStatus.PUSH_FAILED);
        assertThat(JobStatus.failureStatusOf(Phase.NONE)).isEqualTo(JobStatus.FAILED);
        assertThatThrownBy(() -> JobStatus.retryStatusOf(Phase.NONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(JobStatus.statusesOf(Phase.PUSH)).containsExactlyInAnyOrder(
                JobStatus.PENDING_PUSH, JobStatus.PUSH_RETRY, JobStatus.PUSHING, JobStatus.PUSH_FAILED);
    }
}
