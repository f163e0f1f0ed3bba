package com.ultron.gateway.agent;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag handed to an agent run. Executors check it
 * at their safe points; nothing is interrupted forcibly.
 */
@Slf4j
public class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Raise the flag. Only the first call has an effect.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why != null ? why : "cancelled")) {
            return false;
        }
        for (Runnable listener : listeners) {
            // whoever removes the listener runs it
            if (!listeners.remove(listener)) {
                continue;
            }
            try {
                listener.run();
            } catch (Exception e) {
                log.warn("cancellation listener failed: {}", e.getMessage());
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        String why = reason.get();
        if (why != null) {
            throw new CancellationException(why);
        }
    }

    /**
     * Run {@code listener} once on cancellation, immediately if already
     * cancelled.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
    }
}
