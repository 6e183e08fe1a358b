package com.keystone.apiserver.startup;

import java.util.concurrent.CompletionException;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the {@link StartupSequencer} inside the Spring lifecycle, ahead of the embedded web server.
 *
 * <p>{@link #start()} blocks until the sequence finishes. An aborted sequence rethrows its
 * {@link StartupAbortedException}, which fails the context refresh so the web server is never
 * started.
 */
public class StartupLifecycle implements SmartLifecycle {

    /** Lower than the embedded web server's lifecycle phase, so this starts first. */
    public static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 8192;

    private final StartupSequencer sequencer;

    public StartupLifecycle(StartupSequencer sequencer) {
        this.sequencer = sequencer;
    }

    @Override
    public void start() {
        if (sequencer.state() != StartupState.IDLE) {
            return;
        }
        try {
            sequencer.start().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof StartupAbortedException aborted) {
                throw aborted;
            }
            throw e;
        }
    }

    @Override
    public void stop() {
        // The web server lifecycle owns shutdown of the listener.
    }

    @Override
    public boolean isRunning() {
        return sequencer.state() == StartupState.READY;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
