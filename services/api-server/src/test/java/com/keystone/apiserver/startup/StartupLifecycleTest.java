package com.keystone.apiserver.startup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.keystone.database.verification.DataStoreVerificationException;
import com.keystone.database.verification.DataStoreVerifier;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.SmartLifecycle;

@DisplayName("StartupLifecycle")
class StartupLifecycleTest {

    private final DataStoreVerifier verifier = mock(DataStoreVerifier.class);
    private final ServerListener listener = mock(ServerListener.class);

    @Test
    @DisplayName("runs before the default lifecycle phase")
    void phaseBeforeWebServer() {
        var lifecycle = new StartupLifecycle(new StartupSequencer(verifier, listener, 0));

        assertThat(lifecycle.getPhase()).isLessThan(SmartLifecycle.DEFAULT_PHASE);
        assertThat(lifecycle.isAutoStartup()).isTrue();
    }

    @Test
    @DisplayName("is running once the listener is bound")
    void runningWhenReady() {
        when(verifier.verify()).thenReturn(CompletableFuture.completedFuture(null));
        when(listener.bind(0)).thenReturn(40000);
        var lifecycle = new StartupLifecycle(new StartupSequencer(verifier, listener, 0));

        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
        verify(listener).bind(0);
    }

    @Test
    @DisplayName("rethrows the abort so the context refresh fails")
    void rethrowsAbort() {
        when(verifier.verify()).thenReturn(
                CompletableFuture.failedFuture(new DataStoreVerificationException("down")));
        var lifecycle = new StartupLifecycle(new StartupSequencer(verifier, listener, 0));

        assertThatThrownBy(lifecycle::start)
                .isInstanceOf(StartupAbortedException.class)
                .hasCauseInstanceOf(DataStoreVerificationException.class);
        assertThat(lifecycle.isRunning()).isFalse();
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("a second start is a no-op")
    void secondStartIgnored() {
        when(verifier.verify()).thenReturn(CompletableFuture.completedFuture(null));
        var lifecycle = new StartupLifecycle(new StartupSequencer(verifier, listener, 0));

        lifecycle.start();
        lifecycle.start();

        verify(verifier).verify();
    }
}
