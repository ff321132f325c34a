package org.example.imagegen.model;

public record GenerationJobCounts(
        long pending,
        long queued,
        long running,
        long processing,
        long completed,
        long failed,
        long cancelled
) {
    public static GenerationJobCounts of(
            long pending,
            long queued,
            long running,
            long processing,
            long completed,
            long failed,
            long cancelled) {
        return new GenerationJobCounts(
                Math.max(0L, pending),
                Math.max(0L, queued),
                Math.max(0L, running),
                Math.max(0L, processing),
                Math.max(0L, completed),
                Math.max(0L, failed),
                Math.max(0L, cancelled)
        );
    }

    public long active() {
        return pending + queued + running + processing;
    }

    public long total() {
        return active() + completed + failed + cancelled;
    }
}
