package org.example.imagegen.service;

import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.entity.GenerationJobStatus;
import org.example.imagegen.model.StatusEvent;
import org.example.imagegen.repository.GenerationJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobTransitionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneId.of("UTC"));

    @Mock
    private GenerationJobRepository jobRepository;

    @Mock
    private JobStatusBroadcaster broadcaster;

    @Mock
    private TransactionTemplate transactionTemplate;

    private JobTransitionService service;
    private GenerationJobEntity job;

    @BeforeEach
    void setUp() {
        job = new GenerationJobEntity("user-1", "A scenic landscape", "m1", 512, 512, 1);
        job.setId("job-1");
        job.setStatus(GenerationJobStatus.PROCESSING);
        lenient().when(jobRepository.findById("job-1")).thenAnswer(invocation -> Optional.of(job));
        lenient().when(jobRepository.saveAndFlush(any(GenerationJobEntity.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(transactionTemplate.execute(any()))
                .thenAnswer(invocation -> invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
        service = new JobTransitionService(jobRepository, broadcaster, transactionTemplate, CLOCK);
    }

    @Test
    void transition_appliesMutatorAndPublishesEvent() {
        JobTransitionService.TransitionResult result = service.transition("job-1", GenerationJobStatus.COMPLETED,
                row -> row.setContentId("content-1"));

        assertTrue(result.applied());
        assertEquals(GenerationJobStatus.COMPLETED, job.getStatus());
        assertEquals("content-1", job.getContentId());
        assertNotNull(job.getCompletedAt());

        ArgumentCaptor<StatusEvent> event = ArgumentCaptor.forClass(StatusEvent.class);
        verify(broadcaster).publishAfterCommit(event.capture());
        assertEquals("completed", event.getValue().status());
        assertEquals("content-1", event.getValue().contentId());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), event.getValue().timestamp());
    }

    @Test
    void transition_fromTerminalStatus_isRejectedWithoutSideEffects() {
        job.setStatus(GenerationJobStatus.CANCELLED);

        JobTransitionService.TransitionResult result = service.transition("job-1", GenerationJobStatus.COMPLETED,
                row -> row.setContentId("content-1"));

        assertFalse(result.applied());
        assertEquals(GenerationJobStatus.CANCELLED, result.status());
        assertNull(job.getContentId());
        verify(jobRepository, never()).saveAndFlush(any());
        verify(broadcaster, never()).publishAfterCommit(any());
    }

    @Test
    void transition_skippingAState_isRejected() {
        job.setStatus(GenerationJobStatus.QUEUED);

        JobTransitionService.TransitionResult result = service.transition("job-1", GenerationJobStatus.COMPLETED);

        assertFalse(result.applied());
        assertEquals(GenerationJobStatus.QUEUED, job.getStatus());
    }

    @Test
    void fail_clearsContentAndRecordsMessage() {
        job.setOutputPathsJson("[\"a.png\"]");

        JobTransitionService.TransitionResult result = service.fail("job-1", "x".repeat(2500), "[\"Try again\"]");

        assertTrue(result.applied());
        assertEquals(GenerationJobStatus.FAILED, job.getStatus());
        assertEquals(2000, job.getErrorMessage().length());
        assertEquals("[\"Try again\"]", job.getRecoverySuggestionsJson());
        assertNull(job.getContentId());
        assertNull(job.getOutputPathsJson());
    }

    @Test
    void transition_retriesAfterOptimisticLockConflict() {
        doThrow(new ObjectOptimisticLockingFailureException(GenerationJobEntity.class, "job-1"))
                .doAnswer(invocation -> invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null))
                .when(transactionTemplate).execute(any());

        JobTransitionService.TransitionResult result = service.transition("job-1", GenerationJobStatus.CANCELLED);

        assertTrue(result.applied());
        assertEquals(GenerationJobStatus.CANCELLED, job.getStatus());
        verify(transactionTemplate, times(2)).execute(any());
    }

    @Test
    void transition_givesUpAfterRepeatedConflicts() {
        doThrow(new ObjectOptimisticLockingFailureException(GenerationJobEntity.class, "job-1"))
                .when(transactionTemplate).execute(any());

        JobTransitionService.TransitionResult result = service.transition("job-1", GenerationJobStatus.CANCELLED);

        assertFalse(result.applied());
        assertEquals(GenerationJobStatus.PROCESSING, result.status());
        verify(transactionTemplate, times(5)).execute(any());
    }

    @Test
    void transition_forMissingJob_throwsNotFound() {
        when(jobRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(JobNotFoundException.class, () -> service.transition("missing", GenerationJobStatus.CANCELLED));
    }
}
