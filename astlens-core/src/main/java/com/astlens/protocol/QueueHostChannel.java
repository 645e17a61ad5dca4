package com.astlens.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A {@link HostChannel} backed by an unbounded queue that the host drains at its own pace.
 */
public class QueueHostChannel implements HostChannel {

    private final BlockingQueue<HostMessage> queue = new LinkedBlockingQueue<>();

    @Override
    public void post(HostMessage message) {
        queue.add(message);
    }

    /**
     * Removes the next message, waiting up to {@code timeout}; returns null on timeout.
     */
    public HostMessage poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Removes and returns all queued messages without waiting.
     */
    public List<HostMessage> drain() {
        List<HostMessage> messages = new ArrayList<>();
        queue.drainTo(messages);
        return messages;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
