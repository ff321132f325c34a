package org.example.imagegen.service;

import org.example.imagegen.model.StatusEvent;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One client stream shared by the subscriptions of several jobs. Each job gets
 * its own view; the underlying stream completes once every job has delivered
 * its terminal event, and a client disconnect closes all of them.
 */
class MultiJobStatusSink {

    private final StatusEventSink delegate;
    private final Set<String> unfinishedJobs;
    private final List<Runnable> closeCallbacks = new CopyOnWriteArrayList<>();
    private final Object sendLock = new Object();
    private volatile boolean closed;

    MultiJobStatusSink(StatusEventSink delegate, Collection<String> jobIds) {
        this.delegate = delegate;
        this.unfinishedJobs = new LinkedHashSet<>(jobIds);
        delegate.onClose(this::closeAll);
    }

    StatusEventSink forJob(String jobId) {
        return new StatusEventSink() {
            @Override
            public void send(StatusEvent event) throws IOException {
                if (closed) {
                    throw new IllegalStateException("Status stream already closed");
                }
                synchronized (sendLock) {
                    try {
                        delegate.send(event);
                    } catch (IOException | IllegalStateException e) {
                        // remaining subscriptions close themselves on their next offer
                        closed = true;
                        throw e;
                    }
                }
            }

            @Override
            public void complete() {
                finished(jobId);
            }

            @Override
            public void onClose(Runnable callback) {
                closeCallbacks.add(callback);
                if (closed) {
                    callback.run();
                }
            }
        };
    }

    private void finished(String jobId) {
        boolean allDone;
        synchronized (this) {
            allDone = unfinishedJobs.remove(jobId) && unfinishedJobs.isEmpty();
        }
        if (allDone) {
            delegate.complete();
        }
    }

    private void closeAll() {
        closed = true;
        for (Runnable callback : closeCallbacks) {
            callback.run();
        }
    }
}
