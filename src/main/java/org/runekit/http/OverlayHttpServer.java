package org.runekit.http;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

/**
 * Embedded Javalin server hosting the {@link OverlayController}.
 */
public class OverlayHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OverlayHttpServer.class);

    private final HttpSettings settings;
    private final OverlayController controller;
    private Javalin app;

    public OverlayHttpServer(HttpSettings settings, OverlayController controller) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.controller = Objects.requireNonNull(controller, "controller");
    }

    /**
     * Starts the server.
     *
     * @throws IllegalStateException if it is already running.
     */
    public synchronized void start() {
        if (app != null) {
            throw new IllegalStateException("HTTP server already started");
        }
        app = Javalin.create(config -> config.showJavalinBanner = false);
        controller.registerRoutes(app, settings.basePath());
        app.start(settings.host(), settings.port());
        log.info("Overlay HTTP API listening on http://{}:{}{}", settings.host(), app.port(), settings.basePath());
    }

    /**
     * @return the bound port; differs from the configured one when that is {@code 0}.
     */
    public synchronized int port() {
        if (app == null) {
            throw new IllegalStateException("HTTP server not started");
        }
        return app.port();
    }

    @Override
    public synchronized void close() {
        if (app != null) {
            app.stop();
            app = null;
            log.info("Overlay HTTP API stopped");
        }
    }
}
