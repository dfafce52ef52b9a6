package org.runekit.http;

import java.awt.Rectangle;

import org.runekit.overlay.OverlayEngine;
import org.runekit.overlay.OverlaySettings;
import org.runekit.overlay.render.scene.SceneRenderSurface;
import org.runekit.overlay.scheduling.EngineThreadExecutor;
import org.runekit.overlay.window.StaticWindowTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;

/**
 * A running headless overlay: engine thread, scene surface, engine and HTTP server.
 * <p>
 * Closing the host stops the HTTP server first and the engine thread last.
 */
public final class OverlayHost implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OverlayHost.class);

    /** Name of the engine thread. */
    public static final String ENGINE_THREAD_NAME = "overlay-engine";

    private final EngineThreadExecutor executor;
    private final OverlayEngine engine;
    private final StaticWindowTracker window;
    private final HideEventBroadcaster events;
    private final OverlayHttpServer server;

    private OverlayHost(EngineThreadExecutor executor, OverlayEngine engine, StaticWindowTracker window,
                        HideEventBroadcaster events, OverlayHttpServer server) {
        this.executor = executor;
        this.engine = engine;
        this.window = window;
        this.events = events;
        this.server = server;
    }

    /**
     * Builds and starts a host from the application configuration.
     *
     * @param config configuration containing the {@code runekit.overlay} and
     *               {@code runekit.http} blocks.
     * @return the running host.
     */
    public static OverlayHost start(Config config) {
        OverlaySettings settings = OverlaySettings.fromConfig(config);
        HttpSettings httpSettings = HttpSettings.fromConfig(config);

        EngineThreadExecutor executor = new EngineThreadExecutor(ENGINE_THREAD_NAME);
        try {
            SceneRenderSurface surface = new SceneRenderSurface(settings.surfaceWidth(), settings.surfaceHeight(),
                    executor::currentTimeMillis);
            StaticWindowTracker window = new StaticWindowTracker(
                    new Rectangle(0, 0, settings.surfaceWidth(), settings.surfaceHeight()));
            HideEventBroadcaster events = new HideEventBroadcaster();
            OverlayEngine engine = new OverlayEngine(executor, surface, window, settings, events);

            OverlayController controller = new OverlayController(engine, new ObjectMapper(),
                    httpSettings.stateTimeout(), events, window);
            OverlayHttpServer server = new OverlayHttpServer(httpSettings, controller);
            server.start();
            log.info("Overlay engine started: surface {}x{}", settings.surfaceWidth(), settings.surfaceHeight());
            return new OverlayHost(executor, engine, window, events, server);
        } catch (RuntimeException e) {
            executor.close();
            throw e;
        }
    }

    public OverlayEngine engine() {
        return engine;
    }

    public StaticWindowTracker window() {
        return window;
    }

    public HideEventBroadcaster events() {
        return events;
    }

    public int port() {
        return server.port();
    }

    @Override
    public void close() {
        server.close();
        executor.close();
    }
}
