package org.runekit.overlay;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.runekit.overlay.group.GroupContextStack;
import org.runekit.overlay.group.GroupRegistry;
import org.runekit.overlay.group.OverlayEventListener;
import org.runekit.overlay.primitives.ImageDecoder;
import org.runekit.overlay.primitives.OverlayFonts;
import org.runekit.overlay.primitives.PrimitiveBuilder;
import org.runekit.overlay.protocol.BatchEntry;
import org.runekit.overlay.protocol.CommandArgs;
import org.runekit.overlay.protocol.CommandHandler;
import org.runekit.overlay.protocol.CommandSequencer;
import org.runekit.overlay.protocol.OverlayCommand;
import org.runekit.overlay.protocol.ProtocolViolationException;
import org.runekit.overlay.render.RenderSurface;
import org.runekit.overlay.scheduling.DeferredExecutor;
import org.runekit.overlay.template.TemplateBindings;
import org.runekit.overlay.window.MoveTracker;
import org.runekit.overlay.window.WindowTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The overlay command protocol and group lifecycle engine.
 * <p>
 * Wires the sequencer, the group registry, the group context stack, the template
 * bindings, the primitive builders and pointer tracking together, and dispatches
 * commands from the closed {@link OverlayCommand} table to them.
 * <p>
 * <b>Entry points:</b>
 * <ul>
 *   <li>{@link #enqueue(long, String, List)} and {@link #batch(List)}: the sequenced
 *       transport entry points;</li>
 *   <li>the direct lifecycle and draw methods ({@link #setGroup(String, Map)},
 *       {@link #freezeGroup(String)}, {@link #rect}, ...);</li>
 *   <li>{@link #submit(long, String, List)} and {@link #submitBatch(List)} for callers on
 *       other threads.</li>
 * </ul>
 * Without a rendering surface the engine is <i>detached</i>: every overlay entry point
 * is a no-op.
 * <p>
 * <strong>Thread Safety:</strong> Only the {@code submit*} methods may be called from any
 * thread. Everything else must run on the executor's engine thread.
 */
public class OverlayEngine implements CommandHandler {

    private static final Logger log = LoggerFactory.getLogger(OverlayEngine.class);

    private final DeferredExecutor executor;
    private final OverlaySettings settings;
    private final RenderSurface surface;
    private final GroupContextStack contexts = new GroupContextStack();
    private final CommandSequencer sequencer;
    private final GroupRegistry registry;
    private final TemplateBindings bindings;
    private final PrimitiveBuilder builder;
    private final MoveTracker moveTracker;

    /**
     * @param executor the engine thread.
     * @param surface  the rendering surface, or {@code null} to run detached.
     * @param window   the windowing collaborator used by pointer-follow groups.
     * @param settings engine tunables.
     * @param listener receives hide notifications.
     */
    public OverlayEngine(DeferredExecutor executor, RenderSurface surface, WindowTracker window,
                         OverlaySettings settings, OverlayEventListener listener) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.surface = surface;
        this.sequencer = new CommandSequencer(executor, this, this::resetGroups, settings.internalCommandPrefix());

        if (surface != null) {
            this.registry = new GroupRegistry(surface, executor, settings, listener);
            this.bindings = new TemplateBindings(surface, registry);
            OverlayFonts fonts = new OverlayFonts(settings.maxFontSize(), settings.macFallbackFont(),
                    System.getProperty("os.name"));
            this.builder = new PrimitiveBuilder(surface, registry, contexts, bindings, fonts,
                    new ImageDecoder(settings.imageCacheSize()), settings);
            this.moveTracker = new MoveTracker(window, executor, registry, bindings, surface);
        } else {
            log.info("No rendering surface attached, overlay commands will be ignored");
            this.registry = null;
            this.bindings = null;
            this.builder = null;
            this.moveTracker = null;
        }
    }

    public boolean isAttached() {
        return surface != null;
    }

    // --- transport entry points (engine thread) ---

    /**
     * Hands a sequenced command to the sequencer.
     *
     * @return false if the engine is detached or the command name was rejected.
     */
    public boolean enqueue(long callId, String command, List<?> args) {
        if (!isAttached()) {
            log.debug("Overlay not attached, dropping #{} {}", callId, command);
            return false;
        }
        return sequencer.enqueue(callId, command, args);
    }

    /**
     * Runs commands in order without sequencing; each entry fails independently.
     */
    public void batch(List<BatchEntry> commands) {
        if (!isAttached()) {
            return;
        }
        sequencer.executeBatch(commands);
    }

    // --- cross-thread entry points ---

    /**
     * Enqueues a command from any thread.
     *
     * @return a future completed on the engine thread with the result of
     *         {@link #enqueue(long, String, List)}.
     */
    public CompletableFuture<Boolean> submit(long callId, String command, List<?> args) {
        return executor.submit(() -> enqueue(callId, command, args));
    }

    /**
     * Runs a batch from any thread.
     */
    public CompletableFuture<Void> submitBatch(List<BatchEntry> commands) {
        return executor.submit(() -> {
            batch(commands);
            return null;
        });
    }

    /**
     * Takes a snapshot from any thread.
     */
    public CompletableFuture<OverlaySnapshot> snapshotAsync() {
        return executor.submit(this::snapshot);
    }

    // --- dispatch ---

    @Override
    public void handle(OverlayCommand command, CommandArgs args) {
        switch (command) {
            case RECT -> rect(args.getColor(0), args.getInt(1), args.getInt(2), args.getInt(3), args.getInt(4),
                    args.getInt(5), args.getInt(6));
            case LINE -> line(args.getColor(0), args.getInt(1), args.getInt(2), args.getInt(3), args.getInt(4),
                    args.getInt(5), args.getInt(6));
            case TEXT -> text(args.getString(0), args.getColor(1), args.getInt(2), args.getInt(3), args.getInt(4),
                    args.getInt(5), args.getString(6), args.getBoolean(7), args.getBoolean(8));
            case IMAGE -> image(args.getBytes(0), args.getInt(1), args.getInt(2), args.getInt(3));
            case SET_GROUP -> setGroup(args.getString(0), args.getModel(1).orElse(null));
            case CLEAR_GROUP -> clearGroup(args.getString(0));
            case FREEZE_GROUP -> freezeGroup(args.getString(0));
            case CONTINUE_GROUP -> continueGroup(args.getString(0));
            case REFRESH_GROUP -> refreshGroup(args.getString(0));
            case MOVE_GROUP -> moveGroup(args.getString(0), args.getBoolean(1));
            case SET_GROUP_Z -> setGroupZ(args.getString(0), args.getInt(1));
            case BATCH -> batch(toBatchEntries(args.getList(0)));
        }
    }

    private static List<BatchEntry> toBatchEntries(List<?> wire) {
        List<BatchEntry> entries = new ArrayList<>(wire.size());
        for (Object item : wire) {
            try {
                entries.add(BatchEntry.fromWire(item));
            } catch (ProtocolViolationException e) {
                log.warn("Skipping batch entry: {}", e.getMessage());
            }
        }
        return entries;
    }

    // --- group lifecycle ---

    /**
     * Makes {@code name} the current group and, if a model is given, binds it and
     * refreshes the group's texts.
     */
    public void setGroup(String name, Map<String, Object> model) {
        if (!isAttached()) {
            return;
        }
        contexts.push(name);
        if (model != null) {
            bindings.bind(name, model);
        }
    }

    public void clearGroup(String name) {
        if (!isAttached()) {
            return;
        }
        registry.clear(name);
    }

    /**
     * Freezes an active group. If the group is not active, records it as the current
     * group instead.
     */
    public void freezeGroup(String name) {
        if (!isAttached()) {
            return;
        }
        if (!registry.freeze(name)) {
            contexts.push(name);
        }
    }

    /**
     * Continues a frozen group with the default timeout. If the group is not frozen,
     * records it as the current group instead.
     */
    public void continueGroup(String name) {
        if (!isAttached()) {
            return;
        }
        if (!registry.continueGroup(name)) {
            contexts.push(name);
        }
    }

    /**
     * Rebuilds a frozen group and re-evaluates its texts.
     */
    public void refreshGroup(String name) {
        if (!isAttached()) {
            return;
        }
        if (registry.refresh(name)) {
            bindings.refresh(name);
        }
    }

    /**
     * Starts or stops pointer-follow for a frozen group.
     */
    public void moveGroup(String name, boolean enable) {
        if (!isAttached()) {
            return;
        }
        if (enable) {
            moveTracker.enable(name);
        } else {
            moveTracker.disable(name);
        }
    }

    public void setGroupZ(String name, int z) {
        if (!isAttached()) {
            return;
        }
        registry.setZ(name, z);
    }

    // --- draw commands ---

    public void rect(int color, int x, int y, int w, int h, int timeout, int lineWidth) {
        if (isAttached()) {
            builder.rect(color, x, y, w, h, timeout, lineWidth);
        }
    }

    public void line(int color, int lineWidth, int x1, int y1, int x2, int y2, int timeout) {
        if (isAttached()) {
            builder.line(color, lineWidth, x1, y1, x2, y2, timeout);
        }
    }

    public void text(String message, int color, int size, int x, int y, int timeout, String fontName,
                     boolean centered, boolean shadow) {
        if (isAttached()) {
            builder.text(message, color, size, x, y, timeout, fontName, centered, shadow);
        }
    }

    public void image(byte[] image, int x, int y, int timeout) {
        if (isAttached()) {
            builder.image(image, x, y, timeout);
        }
    }

    // --- state ---

    /**
     * Resets the engine: pending commands, last processed call id, both registries, the
     * context stack, text models and pointer listeners.
     */
    public void reset() {
        sequencer.reset();
        resetGroups();
    }

    private void resetGroups() {
        contexts.clear();
        if (isAttached()) {
            moveTracker.reset();
            bindings.clear();
            registry.reset();
        }
    }

    public OverlaySnapshot snapshot() {
        Long last = sequencer.getLastProcessedCallId().isPresent()
                ? sequencer.getLastProcessedCallId().getAsLong()
                : null;
        if (!isAttached()) {
            return OverlaySnapshot.detached(last, sequencer.getPendingCallIds());
        }
        return new OverlaySnapshot(true, last, sequencer.getPendingCallIds(), registry.activeTimeouts(),
                registry.frozenNames(), contexts.snapshot(), bindings.snapshot(), moveTracker.trackedNames());
    }

    public Optional<RenderSurface> getSurface() {
        return Optional.ofNullable(surface);
    }

    public DeferredExecutor getExecutor() {
        return executor;
    }

    public OverlaySettings getSettings() {
        return settings;
    }

    public CommandSequencer getSequencer() {
        return sequencer;
    }

    public GroupContextStack getContextStack() {
        return contexts;
    }

    /**
     * @return the registry, or {@code null} while detached.
     */
    public GroupRegistry getRegistry() {
        return registry;
    }

    /**
     * @return the template bindings, or {@code null} while detached.
     */
    public TemplateBindings getBindings() {
        return bindings;
    }

    /**
     * @return the pointer tracker, or {@code null} while detached.
     */
    public MoveTracker getMoveTracker() {
        return moveTracker;
    }
}
