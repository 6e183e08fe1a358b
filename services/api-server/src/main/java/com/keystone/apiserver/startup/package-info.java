/**
 * Startup sequencing: the listener binds only after the data store is verified.
 *
 * <p>{@link com.keystone.apiserver.startup.StartupSequencer} holds the state machine;
 * {@link com.keystone.apiserver.startup.StartupLifecycle} and
 * {@link com.keystone.apiserver.startup.EmbeddedWebServerListener} plug it into the application
 * context.
 */
package com.keystone.apiserver.startup;
