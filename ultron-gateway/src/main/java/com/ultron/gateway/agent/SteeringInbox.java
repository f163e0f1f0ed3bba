package com.ultron.gateway.agent;

import com.ultron.gateway.inbound.InboundMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Messages attached to a running unit in steer mode. The executor drains it
 * before its next tool step; whatever is left when the unit is released is
 * handed back to the lane.
 */
public class SteeringInbox {

    private final List<InboundMessage> pending = new ArrayList<>();
    private final List<InboundMessage> drained = new ArrayList<>();
    private boolean closed;

    /**
     * Attach messages. Returns false once the inbox is closed.
     */
    public synchronized boolean offer(List<InboundMessage> messages) {
        if (closed) {
            return false;
        }
        pending.addAll(messages);
        return true;
    }

    /**
     * Take all waiting messages.
     */
    public synchronized List<InboundMessage> drain() {
        List<InboundMessage> taken = List.copyOf(pending);
        drained.addAll(taken);
        pending.clear();
        return taken;
    }

    public synchronized boolean hasPending() {
        return !pending.isEmpty();
    }

    /** Messages the executor has drained so far, in order. */
    public synchronized List<InboundMessage> drainedMessages() {
        return List.copyOf(drained);
    }

    /**
     * Close the inbox and return messages that were never drained.
     */
    public synchronized List<InboundMessage> close() {
        closed = true;
        List<InboundMessage> leftovers = new ArrayList<>(pending);
        pending.clear();
        return leftovers;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
