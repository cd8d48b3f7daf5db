package com.delta.backgrounder.check.engine;

import com.delta.backgrounder.check.model.RunEvent;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Hands run events from the thread executing a check to the thread relaying them to a
 * client. A channel ends exactly once, by {@link #close()} or {@link #fail(Throwable)}.
 */
public class RunEventChannel {
    private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
    private volatile boolean ended;

    public synchronized void publish(RunEvent event) {
        Objects.requireNonNull(event, "event");
        if (ended) {
            throw new IllegalStateException("Channel already ended");
        }
        queue.add(new Signal(event, null, false));
    }

    public synchronized void close() {
        if (!ended) {
            ended = true;
            queue.add(new Signal(null, null, true));
        }
    }

    public synchronized void fail(Throwable failure) {
        if (!ended) {
            ended = true;
            queue.add(new Signal(null, Objects.requireNonNull(failure, "failure"), true));
        }
    }

    public boolean isEnded() {
        return ended;
    }

    /**
     * Blocks, passing each event to {@code onEvent} in publish order, until the channel ends.
     * A failed run, or an interrupt while waiting, is reported to {@code onFailure}.
     */
    public void drain(Consumer<RunEvent> onEvent, Consumer<Throwable> onFailure) {
        while (true) {
            Signal signal;
            try {
                signal = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                onFailure.accept(e);
                return;
            }
            if (signal.event() != null) {
                onEvent.accept(signal.event());
            }
            if (signal.last()) {
                if (signal.failure() != null) {
                    onFailure.accept(signal.failure());
                }
                return;
            }
        }
    }

    private record Signal(RunEvent event, Throwable failure, boolean last) {
    }
}
