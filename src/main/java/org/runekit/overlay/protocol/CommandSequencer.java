package org.runekit.overlay.protocol;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

import org.runekit.overlay.scheduling.DeferredExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders incoming overlay commands and dispatches them with selective barrier
 * synchronization.
 * <p>
 * The sender assigns monotonically increasing call ids but delivery may be out of order
 * or lossy. Pure visual commands run as soon as they reach the head of the pending list.
 * Barrier commands (state-affecting lifecycle commands) only run when their call id is
 * exactly one past the last processed id, so a stale freeze can never overtake a newer
 * continue. Call id {@code 0} is the reset signal.
 * <p>
 * <b>Drain algorithm:</b>
 * <ol>
 *   <li>Inspect the head of the pending list (lowest call id).</li>
 *   <li>If it is a barrier, the last processed id is known and the head is not its
 *       direct successor, stop and wait for the missing predecessor.</li>
 *   <li>Otherwise pop it, record its id as processed and run it inside a failure boundary.
 *       A fault is logged and still counts as processed.</li>
 * </ol>
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. All methods must run on the engine
 * thread of the {@link DeferredExecutor}.
 */
public class CommandSequencer {

    private static final Logger log = LoggerFactory.getLogger(CommandSequencer.class);

    /** Maximum length of an argument list rendered into a log line. */
    static final int MAX_LOGGED_ARGS_LENGTH = 180;

    /** Call id that resets the engine. */
    public static final long RESET_CALL_ID = 0;

    /**
     * A command waiting to be drained.
     *
     * @param callId  sender-assigned sequence number.
     * @param command resolved command table entry.
     * @param args    raw, not yet validated arguments.
     */
    public record PendingCall(long callId, OverlayCommand command, List<?> args) {}

    private final DeferredExecutor executor;
    private final CommandHandler handler;
    private final Runnable resetHook;
    private final String internalPrefix;

    private final List<PendingCall> pending = new ArrayList<>();
    private Long lastProcessedCallId;

    /**
     * @param executor       the engine thread used to schedule drains.
     * @param handler        executes dispatched commands.
     * @param resetHook      clears engine state when call id 0 arrives.
     * @param internalPrefix names starting with this prefix are rejected.
     */
    public CommandSequencer(DeferredExecutor executor, CommandHandler handler, Runnable resetHook,
                            String internalPrefix) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.resetHook = Objects.requireNonNull(resetHook, "resetHook");
        this.internalPrefix = Objects.requireNonNull(internalPrefix, "internalPrefix");
    }

    /**
     * Adds a command to the pending list and schedules a drain pass.
     * <p>
     * The drain runs as a zero-delay deferred callback, so a burst of enqueues coalesces
     * into one pass and callers never re-enter the drain loop.
     *
     * @param callId  sender-assigned call id; {@code 0} resets the engine first.
     * @param name    wire name of the command.
     * @param args    raw arguments.
     * @return false if the command was rejected (marker-prefixed or unknown name).
     */
    public boolean enqueue(long callId, String name, List<?> args) {
        OverlayCommand command = OverlayCommand.resolve(name, internalPrefix).orElse(null);
        if (command == null) {
            log.warn("Rejected command #{} '{}': not an accepted overlay command", callId, name);
            return false;
        }

        if (callId == RESET_CALL_ID) {
            log.info("Call ID reset");
            reset();
            resetHook.run();
        }

        pending.add(new PendingCall(callId, command, args == null ? List.of() : args));
        pending.sort(Comparator.comparingLong(PendingCall::callId));
        log.debug("{} {} {}", callId, command, abbreviate(args));

        executor.post(this::processQueue);
        return true;
    }

    /**
     * Drains the pending list until it is empty or blocked by a barrier gap.
     */
    public void processQueue() {
        while (!pending.isEmpty()) {
            PendingCall head = pending.get(0);
            if (head.command().isBarrier()
                    && lastProcessedCallId != null
                    && head.callId() != lastProcessedCallId + 1) {
                log.debug("Holding barrier #{} {} until #{} is processed",
                        head.callId(), head.command(), lastProcessedCallId + 1);
                return;
            }

            pending.remove(0);
            // last processed = highest call id run so far, so a late lower id never rewinds it.
            lastProcessedCallId = lastProcessedCallId == null
                    ? head.callId()
                    : Math.max(lastProcessedCallId, head.callId());
            execute(head);
        }
    }

    /**
     * Runs commands in the given order without ordering or barrier semantics. Each entry
     * is isolated: a rejected or failing entry does not stop the rest.
     *
     * @param entries the commands to run.
     */
    public void executeBatch(List<BatchEntry> entries) {
        for (BatchEntry entry : entries) {
            OverlayCommand command = OverlayCommand.resolve(entry.command(), internalPrefix).orElse(null);
            if (command == null) {
                log.warn("Rejected batch command '{}': not an accepted overlay command", entry.command());
                continue;
            }
            if (command == OverlayCommand.BATCH) {
                log.warn("Rejected nested {} inside a batch", command);
                continue;
            }
            try {
                handler.handle(command, CommandArgs.validate(command, entry.args()));
            } catch (RuntimeException e) {
                log.error("API batch call exception {}({})", command, abbreviate(entry.args()), e);
            }
        }
    }

    /**
     * Discards all pending commands and forgets the last processed call id.
     */
    public void reset() {
        pending.clear();
        lastProcessedCallId = null;
    }

    /**
     * @return the call id of the most recently processed command, if any.
     */
    public OptionalLong getLastProcessedCallId() {
        return lastProcessedCallId == null ? OptionalLong.empty() : OptionalLong.of(lastProcessedCallId);
    }

    /**
     * @return call ids still waiting, in drain order.
     */
    public List<Long> getPendingCallIds() {
        return pending.stream().map(PendingCall::callId).toList();
    }

    private void execute(PendingCall call) {
        try {
            handler.handle(call.command(), CommandArgs.validate(call.command(), call.args()));
        } catch (RuntimeException e) {
            log.error("API call exception #{} {}({})", call.callId(), call.command(), abbreviate(call.args()), e);
        }
    }

    static String abbreviate(Object args) {
        String text = String.valueOf(args);
        return text.length() <= MAX_LOGGED_ARGS_LENGTH ? text : text.substring(0, MAX_LOGGED_ARGS_LENGTH) + "...";
    }
}
