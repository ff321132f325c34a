package org.example.imagegen.repository;

import org.example.imagegen.entity.GenerationTaskEntity;
import org.example.imagegen.entity.GenerationTaskStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class GenerationTaskRepositoryTest {

    @Autowired
    private GenerationTaskRepository taskRepository;

    @Test
    void claimLease_preventsDoubleClaimAndAllowsStaleReclaim() {
        LocalDateTime now = LocalDateTime.now();
        GenerationTaskEntity task = persistTask("job-1", now.minusSeconds(1));

        int claimed = taskRepository.claimLease(
                task.getId(),
                now,
                now.plusMinutes(15),
                "worker-a",
                GenerationTaskStatus.AVAILABLE,
                GenerationTaskStatus.CLAIMED
        );
        assertEquals(1, claimed);

        GenerationTaskEntity claimedEntity = taskRepository.findById(task.getId()).orElseThrow();
        assertEquals(GenerationTaskStatus.CLAIMED, claimedEntity.getStatus());
        assertEquals("worker-a", claimedEntity.getLeaseOwner());
        assertEquals(1, claimedEntity.getDeliveryCount());
        assertNotNull(claimedEntity.getLeaseExpiresAt());

        int secondClaim = taskRepository.claimLease(
                task.getId(),
                now.plusMinutes(1),
                now.plusMinutes(16),
                "worker-b",
                GenerationTaskStatus.AVAILABLE,
                GenerationTaskStatus.CLAIMED
        );
        assertEquals(0, secondClaim);

        int staleReclaim = taskRepository.claimLease(
                task.getId(),
                now.plusMinutes(16),
                now.plusMinutes(31),
                "worker-b",
                GenerationTaskStatus.AVAILABLE,
                GenerationTaskStatus.CLAIMED
        );
        assertEquals(1, staleReclaim);

        GenerationTaskEntity reclaimedEntity = taskRepository.findById(task.getId()).orElseThrow();
        assertEquals("worker-b", reclaimedEntity.getLeaseOwner());
        assertEquals(2, reclaimedEntity.getDeliveryCount());
    }

    @Test
    void claimLease_blocksUntilTaskIsAvailable() {
        LocalDateTime now = LocalDateTime.now();
        GenerationTaskEntity task = persistTask("job-later", now.plusMinutes(2));

        int earlyClaim = taskRepository.claimLease(
                task.getId(),
                now,
                now.plusMinutes(15),
                "worker-a",
                GenerationTaskStatus.AVAILABLE,
                GenerationTaskStatus.CLAIMED
        );
        assertEquals(0, earlyClaim);

        int dueClaim = taskRepository.claimLease(
                task.getId(),
                now.plusMinutes(3),
                now.plusMinutes(18),
                "worker-a",
                GenerationTaskStatus.AVAILABLE,
                GenerationTaskStatus.CLAIMED
        );
        assertEquals(1, dueClaim);
    }

    @Test
    void acknowledge_onlySucceedsForCurrentLeaseOwner() {
        LocalDateTime now = LocalDateTime.now();
        GenerationTaskEntity task = persistTask("job-ack", now.minusSeconds(1));
        taskRepository.claimLease(task.getId(), now, now.plusMinutes(15), "worker-a",
                GenerationTaskStatus.AVAILABLE, GenerationTaskStatus.CLAIMED);

        int wrongOwner = taskRepository.acknowledge(task.getId(), "worker-b", now,
                GenerationTaskStatus.CLAIMED, GenerationTaskStatus.DONE);
        assertEquals(0, wrongOwner);

        int acknowledged = taskRepository.acknowledge(task.getId(), "worker-a", now.plusSeconds(5),
                GenerationTaskStatus.CLAIMED, GenerationTaskStatus.DONE);
        assertEquals(1, acknowledged);

        GenerationTaskEntity done = taskRepository.findById(task.getId()).orElseThrow();
        assertEquals(GenerationTaskStatus.DONE, done.getStatus());
        assertNull(done.getLeaseExpiresAt());
        assertNotNull(done.getFinishedAt());

        int reclaim = taskRepository.claimLease(task.getId(), now.plusHours(1), now.plusHours(2), "worker-c",
                GenerationTaskStatus.AVAILABLE, GenerationTaskStatus.CLAIMED);
        assertEquals(0, reclaim);
    }

    @Test
    void findClaimCandidates_returnsAvailableAndExpiredTasksOldestFirst() {
        LocalDateTime now = LocalDateTime.now();
        GenerationTaskEntity older = persistTask("job-older", now.minusMinutes(5));
        GenerationTaskEntity newer = persistTask("job-newer", now.minusMinutes(1));
        persistTask("job-future", now.plusMinutes(5));

        GenerationTaskEntity leased = persistTask("job-leased", now.minusMinutes(10));
        taskRepository.claimLease(leased.getId(), now.minusMinutes(10), now.plusMinutes(5), "worker-a",
                GenerationTaskStatus.AVAILABLE, GenerationTaskStatus.CLAIMED);

        GenerationTaskEntity expired = persistTask("job-expired", now.minusMinutes(30));
        taskRepository.claimLease(expired.getId(), now.minusMinutes(30), now.minusMinutes(15), "worker-gone",
                GenerationTaskStatus.AVAILABLE, GenerationTaskStatus.CLAIMED);

        List<String> candidates = taskRepository.findClaimCandidates(
                now,
                GenerationTaskStatus.AVAILABLE,
                GenerationTaskStatus.CLAIMED,
                PageRequest.of(0, 10));

        assertEquals(List.of(expired.getId(), older.getId(), newer.getId()), candidates);
    }

    @Test
    void existsByJobIdAndStatusIn_ignoresFinishedTasks() {
        LocalDateTime now = LocalDateTime.now();
        GenerationTaskEntity task = persistTask("job-open", now.minusSeconds(1));
        List<GenerationTaskStatus> open = List.of(GenerationTaskStatus.AVAILABLE, GenerationTaskStatus.CLAIMED);

        assertTrue(taskRepository.existsByJobIdAndStatusIn("job-open", open));
        assertEquals(1, taskRepository.countByStatus(GenerationTaskStatus.AVAILABLE));

        taskRepository.claimLease(task.getId(), now, now.plusMinutes(15), "worker-a",
                GenerationTaskStatus.AVAILABLE, GenerationTaskStatus.CLAIMED);
        taskRepository.acknowledge(task.getId(), "worker-a", now,
                GenerationTaskStatus.CLAIMED, GenerationTaskStatus.DONE);

        assertFalse(taskRepository.existsByJobIdAndStatusIn("job-open", open));
        assertEquals(1, taskRepository.countByStatus(GenerationTaskStatus.DONE));
    }

    private GenerationTaskEntity persistTask(String jobId, LocalDateTime availableAt) {
        GenerationTaskEntity task = new GenerationTaskEntity(jobId);
        task.setAvailableAt(availableAt);
        return taskRepository.saveAndFlush(task);
    }
}
