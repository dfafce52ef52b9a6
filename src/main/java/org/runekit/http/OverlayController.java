package org.runekit.http;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.imageio.ImageIO;

import org.runekit.http.dto.AcceptedResponseDto;
import org.runekit.http.dto.BatchRequest;
import org.runekit.http.dto.EnqueueRequest;
import org.runekit.http.dto.ErrorResponseDto;
import org.runekit.http.dto.PointerRequest;
import org.runekit.overlay.OverlayEngine;
import org.runekit.overlay.protocol.BatchEntry;
import org.runekit.overlay.protocol.ProtocolViolationException;
import org.runekit.overlay.render.scene.SceneRenderSurface;
import org.runekit.overlay.window.StaticWindowTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;

/**
 * HTTP transport of the overlay engine.
 * <p>
 * Routes, relative to the base path:
 * <ul>
 *   <li>{@code POST /enqueue}: one sequenced command;</li>
 *   <li>{@code POST /batch}: unsequenced commands run in the given order;</li>
 *   <li>{@code POST /pointer}: moves the headless pointer (pointer-follow groups);</li>
 *   <li>{@code GET /state}: engine snapshot as JSON;</li>
 *   <li>{@code GET /frame.png}: the current scene rendered to PNG;</li>
 *   <li>{@code SSE /events}: {@code hide-group} events.</li>
 * </ul>
 * Requests never touch engine state directly: every call is marshalled onto the engine
 * thread and awaited for at most the configured timeout.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe.
 */
public class OverlayController {

    private static final Logger LOGGER = LoggerFactory.getLogger(OverlayController.class);

    private final OverlayEngine engine;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final HideEventBroadcaster events;
    private final StaticWindowTracker pointer;

    /**
     * @param engine       the engine to drive.
     * @param objectMapper parses request bodies.
     * @param timeout      maximum wait for the engine thread per request.
     * @param events       hide event broadcaster backing the SSE route.
     * @param pointer      headless pointer, or {@code null} if the pointer is tracked elsewhere.
     */
    public OverlayController(OverlayEngine engine, ObjectMapper objectMapper, Duration timeout,
                             HideEventBroadcaster events, StaticWindowTracker pointer) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.events = Objects.requireNonNull(events, "events");
        this.pointer = pointer;
    }

    /**
     * Registers all routes under {@code basePath}.
     */
    public void registerRoutes(Javalin app, String basePath) {
        String base = basePath == null ? "" : basePath;
        LOGGER.debug("Registering overlay endpoints under '{}'", base.isEmpty() ? "/" : base);

        app.post(base + "/enqueue", this::enqueue);
        app.post(base + "/batch", this::batch);
        app.post(base + "/pointer", this::movePointer);
        app.get(base + "/state", this::state);
        app.get(base + "/frame.png", this::frame);
        app.sse(base + "/events", events::connect);

        app.exception(EngineUnavailableException.class, (e, ctx) -> {
            LOGGER.warn("Engine unavailable: {}", e.getMessage());
            error(ctx, HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled error for {} {}", ctx.method(), ctx.path(), e);
            error(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        });
    }

    void enqueue(Context ctx) {
        EnqueueRequest request = parse(ctx, EnqueueRequest.class);
        if (request == null) {
            return;
        }
        if (request.callId() == null || request.callId() < 0) {
            error(ctx, HttpStatus.BAD_REQUEST, "callId must be a non-negative integer");
            return;
        }
        if (request.command() == null || request.command().isBlank()) {
            error(ctx, HttpStatus.BAD_REQUEST, "command is required");
            return;
        }
        if (!engine.isAttached()) {
            error(ctx, HttpStatus.SERVICE_UNAVAILABLE, "Overlay is not attached");
            return;
        }

        List<Object> args = request.args() == null ? List.of() : request.args();
        boolean accepted = await(engine.submit(request.callId(), request.command(), args));
        if (!accepted) {
            error(ctx, HttpStatus.BAD_REQUEST, "Rejected command '" + request.command() + "'");
            return;
        }
        ctx.status(HttpStatus.ACCEPTED).json(new AcceptedResponseDto(1));
    }

    void batch(Context ctx) {
        BatchRequest request = parse(ctx, BatchRequest.class);
        if (request == null) {
            return;
        }
        if (request.commands() == null) {
            error(ctx, HttpStatus.BAD_REQUEST, "commands is required");
            return;
        }
        if (!engine.isAttached()) {
            error(ctx, HttpStatus.SERVICE_UNAVAILABLE, "Overlay is not attached");
            return;
        }

        List<BatchEntry> entries = new ArrayList<>(request.commands().size());
        try {
            for (Object wire : request.commands()) {
                entries.add(BatchEntry.fromWire(wire));
            }
        } catch (ProtocolViolationException e) {
            LOGGER.warn("Rejected batch: {}", e.getMessage());
            error(ctx, HttpStatus.BAD_REQUEST, e.getMessage());
            return;
        }
        await(engine.submitBatch(entries));
        ctx.status(HttpStatus.ACCEPTED).json(new AcceptedResponseDto(entries.size()));
    }

    void movePointer(Context ctx) {
        if (pointer == null) {
            error(ctx, HttpStatus.NOT_FOUND, "Pointer is not controlled over HTTP");
            return;
        }
        PointerRequest request = parse(ctx, PointerRequest.class);
        if (request == null) {
            return;
        }
        if (request.x() == null || request.y() == null) {
            error(ctx, HttpStatus.BAD_REQUEST, "x and y are required");
            return;
        }
        pointer.movePointer(request.x(), request.y());
        ctx.status(HttpStatus.ACCEPTED).json(new AcceptedResponseDto(1));
    }

    void state(Context ctx) {
        ctx.json(await(engine.snapshotAsync()));
    }

    void frame(Context ctx) {
        if (!(engine.getSurface().orElse(null) instanceof SceneRenderSurface scene)) {
            error(ctx, HttpStatus.NOT_FOUND, "No scene surface attached");
            return;
        }
        BufferedImage frame = await(engine.getExecutor().submit(scene::renderFrame));
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        try {
            ImageIO.write(frame, "png", png);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode frame", e);
        }
        ctx.contentType("image/png").result(png.toByteArray());
    }

    private <T> T parse(Context ctx, Class<T> type) {
        try {
            T value = objectMapper.readValue(ctx.body(), type);
            if (value == null) {
                error(ctx, HttpStatus.BAD_REQUEST, "Request body is required");
            }
            return value;
        } catch (JsonProcessingException e) {
            LOGGER.warn("Malformed {} body: {}", type.getSimpleName(), e.getOriginalMessage());
            error(ctx, HttpStatus.BAD_REQUEST, "Malformed request body: " + e.getOriginalMessage());
            return null;
        }
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new EngineUnavailableException("Engine did not respond within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("Interrupted while waiting for the engine", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Engine task failed", e.getCause());
        }
    }

    private static void error(Context ctx, HttpStatus status, String message) {
        ctx.status(status).json(ErrorResponseDto.of(status.getCode(), status.getMessage(), message));
    }

    /**
     * The engine thread did not answer in time.
     */
    static class EngineUnavailableException extends RuntimeException {
        EngineUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
