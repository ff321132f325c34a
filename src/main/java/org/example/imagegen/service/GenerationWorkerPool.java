package org.example.imagegen.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.example.imagegen.config.GenerationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of workers, each looping claim, process, acknowledge. Workers
 * share nothing in memory; ownership of a job comes only from the task lease.
 */
@Service
public class GenerationWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(GenerationWorkerPool.class);

    private final GenerationTaskQueue taskQueue;
    private final GenerationJobProcessor processor;
    private final boolean enabled;
    private final int threads;
    private final Duration idlePollInterval;
    private final String workerId;
    private final AtomicInteger busyWorkers = new AtomicInteger();

    private ExecutorService executor;
    private volatile boolean running = false;

    public GenerationWorkerPool(
            GenerationTaskQueue taskQueue,
            GenerationJobProcessor processor,
            GenerationProperties properties) {
        this.taskQueue = taskQueue;
        this.processor = processor;
        GenerationProperties.Worker worker = properties.getWorker();
        this.enabled = worker.isEnabled();
        this.threads = Math.max(1, worker.getThreads());
        this.idlePollInterval = worker.getIdlePollInterval();
        this.workerId = (worker.getId() != null && !worker.getId().isBlank())
                ? worker.getId()
                : "generation-" + UUID.randomUUID();
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Generation workers disabled (generation.worker.enabled=false)");
            return;
        }
        running = true;
        executor = Executors.newFixedThreadPool(threads, new GenerationWorkerThreadFactory());
        for (int i = 1; i <= threads; i++) {
            String leaseOwner = workerId + "-" + i;
            executor.submit(() -> runWorker(leaseOwner));
        }
        log.info("Started {} generation worker(s) (workerId={})", threads, workerId);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Generation workers did not stop within 5s; unfinished tasks will be redelivered after lease expiry");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Generation worker pool shut down");
    }

    private void runWorker(String leaseOwner) {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<GenerationTaskQueue.ClaimedTask> claimed = taskQueue.claimNext(leaseOwner);
                if (claimed.isEmpty()) {
                    taskQueue.awaitWork(idlePollInterval);
                    continue;
                }
                GenerationTaskQueue.ClaimedTask task = claimed.get();
                busyWorkers.incrementAndGet();
                try {
                    processor.process(task.jobId(), task.deliveryCount());
                } finally {
                    busyWorkers.decrementAndGet();
                }
                if (!Thread.currentThread().isInterrupted()) {
                    taskQueue.acknowledge(task);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                if (!running) {
                    break;
                }
                log.error("Generation worker {} hit an error; backing off", leaseOwner, e);
                try {
                    Thread.sleep(Math.max(1L, idlePollInterval.toMillis()));
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        log.debug("Generation worker {} stopped", leaseOwner);
    }

    public boolean isRunning() {
        return running;
    }

    public int getThreads() {
        return enabled ? threads : 0;
    }

    public int getBusyWorkers() {
        return busyWorkers.get();
    }

    public String getWorkerId() {
        return workerId;
    }

    private static final class GenerationWorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "generation-worker-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
