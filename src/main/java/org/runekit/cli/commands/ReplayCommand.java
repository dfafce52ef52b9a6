package org.runekit.cli.commands;

import java.awt.Rectangle;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

import javax.imageio.ImageIO;

import org.runekit.cli.CommandLineInterface;
import org.runekit.overlay.OverlayEngine;
import org.runekit.overlay.OverlaySettings;
import org.runekit.overlay.OverlaySnapshot;
import org.runekit.overlay.protocol.BatchEntry;
import org.runekit.overlay.render.scene.SceneRenderSurface;
import org.runekit.overlay.scheduling.VirtualTimeExecutor;
import org.runekit.overlay.window.StaticWindowTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Replays a JSON-lines command log through an engine running on virtual time and writes
 * the resulting frame as PNG.
 * <p>
 * Each line is one object:
 * <pre>
 * {"callId": 1, "command": "overlay_rect", "args": [4278190335, 10, 10, 50, 50, 5000, 10], "delayMs": 0}
 * </pre>
 * {@code delayMs} advances the clock before the command is delivered. A line without
 * {@code callId} runs unsequenced, like a one-entry batch. A line with {@code pointer}
 * ({@code [x, y]}) moves the pointer instead.
 */
@Command(
    name = "replay",
    description = "Replay a JSON-lines command log on virtual time and render the final frame"
)
public class ReplayCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplayCommand.class);

    /**
     * One line of a command log.
     */
    record LogLine(Long callId, String command, List<Object> args, Long delayMs, List<Integer> pointer) {}

    @Option(names = {"-i", "--input"}, required = true, description = "JSON-lines command log.")
    private File input;

    @Option(names = {"-o", "--output"}, required = true, description = "PNG file to write.")
    private File output;

    @Option(names = "--advance", defaultValue = "0",
            description = "Milliseconds of virtual time to run after the last command (default: 0).")
    private long advanceMillis;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        OverlaySettings settings;
        try {
            settings = OverlaySettings.fromConfig(parent.getConfig());
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }
        if (!input.isFile()) {
            err.println("Input file not found: " + input.getAbsolutePath());
            return 1;
        }
        if (advanceMillis < 0) {
            err.println("--advance must not be negative");
            return 1;
        }

        VirtualTimeExecutor executor = new VirtualTimeExecutor();
        SceneRenderSurface surface = new SceneRenderSurface(settings.surfaceWidth(), settings.surfaceHeight(),
                executor::currentTimeMillis);
        StaticWindowTracker window = new StaticWindowTracker(
                new Rectangle(0, 0, settings.surfaceWidth(), settings.surfaceHeight()));
        OverlayEngine engine = new OverlayEngine(executor, surface, window, settings,
                name -> log.debug("Group '{}' hidden at {} ms", name, executor.currentTimeMillis()));

        int replayed;
        try (BufferedReader reader = Files.newBufferedReader(input.toPath(), StandardCharsets.UTF_8)) {
            replayed = replay(reader, engine, executor, window, new ObjectMapper());
        } catch (MalformedLogException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Failed to read " + input.getAbsolutePath() + ": " + e.getMessage());
            return 1;
        }
        executor.advanceBy(advanceMillis);

        try {
            File target = output.getAbsoluteFile();
            if (target.getParentFile() != null) {
                Files.createDirectories(target.getParentFile().toPath());
            }
            ImageIO.write(surface.renderFrame(), "png", target);
        } catch (IOException e) {
            err.println("Failed to write " + output.getAbsolutePath() + ": " + e.getMessage());
            return 1;
        }

        OverlaySnapshot snapshot = engine.snapshot();
        out.printf("Replayed %d line(s) over %d ms: %d active group(s), %d frozen group(s), %d pending%n",
                replayed, executor.currentTimeMillis(), snapshot.activeGroups().size(),
                snapshot.frozenGroups().size(), snapshot.pendingCallIds().size());
        out.println("Frame written to " + output.getAbsolutePath());
        return 0;
    }

    /**
     * Feeds every line of a command log to the engine, advancing virtual time as requested.
     *
     * @return the number of non-blank lines replayed.
     * @throws MalformedLogException if a line is not a valid log entry.
     */
    static int replay(BufferedReader reader, OverlayEngine engine, VirtualTimeExecutor executor,
                      StaticWindowTracker window, ObjectMapper mapper) throws IOException {
        int count = 0;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            LogLine entry;
            try {
                entry = mapper.readValue(line, LogLine.class);
            } catch (JsonProcessingException e) {
                throw new MalformedLogException("Line " + lineNumber + ": " + e.getOriginalMessage());
            }
            if (entry == null || (entry.command() == null && entry.pointer() == null)) {
                throw new MalformedLogException("Line " + lineNumber + ": expected 'command' or 'pointer'");
            }
            if (entry.delayMs() != null && entry.delayMs() > 0) {
                executor.advanceBy(entry.delayMs());
            }

            if (entry.pointer() != null) {
                if (entry.pointer().size() != 2) {
                    throw new MalformedLogException("Line " + lineNumber + ": 'pointer' must be [x, y]");
                }
                window.movePointer(entry.pointer().get(0), entry.pointer().get(1));
            } else if (entry.callId() != null) {
                engine.enqueue(entry.callId(), entry.command(), entry.args());
            } else {
                engine.batch(List.of(new BatchEntry(entry.command(), entry.args())));
            }
            executor.runPending();
            count++;
        }
        return count;
    }

    /**
     * A command log line could not be understood.
     */
    static class MalformedLogException extends RuntimeException {
        MalformedLogException(String message) {
            super(message);
        }
    }
}
