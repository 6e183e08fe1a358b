package com.keystone.apiserver.startup;

import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.boot.web.server.WebServer;
import org.springframework.context.ApplicationContext;

/**
 * {@link ServerListener} backed by Spring Boot's embedded web server.
 *
 * <p>The embedded server is created during context refresh but its connector only binds when
 * {@link WebServer#start()} runs. This listener calls it; Spring's own web-server lifecycle, which
 * runs later, finds the server already started and only publishes the initialized event.
 */
public final class EmbeddedWebServerListener implements ServerListener {

    private final ApplicationContext context;
    private volatile boolean bound;

    public EmbeddedWebServerListener(ApplicationContext context) {
        this.context = context;
    }

    @Override
    public int bind(int port) {
        WebServer webServer = webServer();
        webServer.start();
        int actual = webServer.getPort();
        if (port != 0 && actual != port) {
            throw new IllegalStateException(
                    "Embedded web server bound port " + actual + " instead of " + port);
        }
        bound = true;
        return actual;
    }

    @Override
    public boolean isBound() {
        return bound;
    }

    private WebServer webServer() {
        if (context instanceof WebServerApplicationContext webContext
                && webContext.getWebServer() != null) {
            return webContext.getWebServer();
        }
        throw new IllegalStateException("No embedded web server available to bind");
    }
}
