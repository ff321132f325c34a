package org.example.imagegen.service;

import org.example.imagegen.model.StatusEvent;

import java.io.IOException;

/**
 * Client-facing end of one status subscription.
 */
public interface StatusEventSink {

    void send(StatusEvent event) throws IOException;

    /**
     * Close the stream normally.
     */
    void complete();

    /**
     * Run the callback once the client side goes away (disconnect, timeout,
     * error or normal completion).
     */
    void onClose(Runnable callback);
}
