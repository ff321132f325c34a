package org.example.imagegen.service;

import org.example.imagegen.model.StatusEvent;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

public class SseStatusEventSink implements StatusEventSink {

    static final String EVENT_NAME = "status";

    private final SseEmitter emitter;

    public SseStatusEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(StatusEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .name(EVENT_NAME)
                .id(event.jobId() + ":" + event.status())
                .data(event, MediaType.APPLICATION_JSON));
    }

    @Override
    public void complete() {
        emitter.complete();
    }

    @Override
    public void onClose(Runnable callback) {
        emitter.onCompletion(callback);
        emitter.onTimeout(callback);
        emitter.onError(error -> callback.run());
    }
}
