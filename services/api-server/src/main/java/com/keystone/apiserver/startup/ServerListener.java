package com.keystone.apiserver.startup;

/**
 * The network listener the {@link StartupSequencer} binds once the data store is verified.
 */
public interface ServerListener {

    /**
     * Binds the listener and starts accepting connections.
     *
     * @param port the configured port; 0 asks for an ephemeral port
     * @return the port actually bound
     * @throws IllegalStateException if the listener cannot be bound on {@code port}
     */
    int bind(int port);

    /** Whether {@link #bind(int)} has succeeded. */
    boolean isBound();
}
