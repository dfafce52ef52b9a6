package org.runekit.overlay.protocol;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of commands accepted by the overlay engine.
 *
 * <p>Each entry maps a wire name to a typed parameter list and carries the barrier
 * capability bit. A barrier command only runs once the call id immediately preceding it
 * has been processed; all other commands run as soon as they reach the head of the
 * pending queue.
 *
 * <p>Command families:
 * <ul>
 *   <li>Draw commands: {@link #RECT}, {@link #LINE}, {@link #TEXT}, {@link #IMAGE}</li>
 *   <li>Group lifecycle (barriers): {@link #CLEAR_GROUP}, {@link #FREEZE_GROUP},
 *       {@link #CONTINUE_GROUP}, {@link #REFRESH_GROUP}</li>
 *   <li>Group context: {@link #SET_GROUP}, {@link #MOVE_GROUP}, {@link #SET_GROUP_Z}</li>
 *   <li>Composite: {@link #BATCH}</li>
 * </ul>
 *
 * <p>This enum is thread-safe as it contains only immutable constants.
 */
public enum OverlayCommand {

    RECT("overlay_rect", false,
            Param.required("color", ArgType.COLOR),
            Param.required("x", ArgType.INT),
            Param.required("y", ArgType.INT),
            Param.required("w", ArgType.INT),
            Param.required("h", ArgType.INT),
            Param.required("timeout", ArgType.INT),
            Param.required("lineWidth", ArgType.INT)),

    LINE("overlay_line", false,
            Param.required("color", ArgType.COLOR),
            Param.required("lineWidth", ArgType.INT),
            Param.required("x1", ArgType.INT),
            Param.required("y1", ArgType.INT),
            Param.required("x2", ArgType.INT),
            Param.required("y2", ArgType.INT),
            Param.required("timeout", ArgType.INT)),

    TEXT("overlay_text", false,
            Param.required("message", ArgType.STRING),
            Param.required("color", ArgType.COLOR),
            Param.required("size", ArgType.INT),
            Param.required("x", ArgType.INT),
            Param.required("y", ArgType.INT),
            Param.required("timeout", ArgType.INT),
            Param.required("fontName", ArgType.STRING),
            Param.required("centered", ArgType.BOOL),
            Param.required("shadow", ArgType.BOOL)),

    IMAGE("overlay_image", false,
            Param.required("image", ArgType.BYTES),
            Param.required("x", ArgType.INT),
            Param.required("y", ArgType.INT),
            Param.required("timeout", ArgType.INT)),

    SET_GROUP("overlay_set_group", false,
            Param.required("name", ArgType.STRING),
            Param.optional("model", ArgType.MODEL)),

    CLEAR_GROUP("overlay_clear_group", true,
            Param.required("name", ArgType.STRING)),

    FREEZE_GROUP("overlay_freeze_group", true,
            Param.required("name", ArgType.STRING)),

    CONTINUE_GROUP("overlay_continue_group", true,
            Param.required("name", ArgType.STRING)),

    REFRESH_GROUP("overlay_refresh_group", true,
            Param.required("name", ArgType.STRING)),

    MOVE_GROUP("overlay_move_group", false,
            Param.required("name", ArgType.STRING),
            Param.required("enable", ArgType.BOOL)),

    SET_GROUP_Z("overlay_set_group_z", false,
            Param.required("name", ArgType.STRING),
            Param.required("z", ArgType.INT)),

    BATCH("overlay_batch", false,
            Param.required("commands", ArgType.LIST));

    /**
     * The value types a command parameter may declare.
     */
    public enum ArgType {
        /** Any integral JSON number. */
        INT,
        /** Packed ARGB color; accepts the full unsigned 32-bit range. */
        COLOR,
        /** A string. */
        STRING,
        /** A boolean, or a number where non-zero means {@code true}. */
        BOOL,
        /** Raw bytes, a list of byte values, or a base64 string. */
        BYTES,
        /** A string-keyed map, or {@code null}. */
        MODEL,
        /** A list. */
        LIST
    }

    /**
     * A declared command parameter.
     *
     * @param name     parameter name, used in diagnostics.
     * @param type     expected value type.
     * @param optional whether trailing omission is allowed.
     */
    public record Param(String name, ArgType type, boolean optional) {

        static Param required(String name, ArgType type) {
            return new Param(name, type, false);
        }

        static Param optional(String name, ArgType type) {
            return new Param(name, type, true);
        }
    }

    private static final Map<String, OverlayCommand> BY_WIRE_NAME = new HashMap<>();

    static {
        for (OverlayCommand command : values()) {
            BY_WIRE_NAME.put(command.wireName, command);
        }
    }

    private final String wireName;
    private final boolean barrier;
    private final List<Param> params;
    private final int requiredCount;

    OverlayCommand(String wireName, boolean barrier, Param... params) {
        this.wireName = wireName;
        this.barrier = barrier;
        this.params = Collections.unmodifiableList(Arrays.asList(params));
        this.requiredCount = (int) this.params.stream().filter(p -> !p.optional()).count();
    }

    /**
     * Looks up a command by its wire name.
     *
     * @param wireName the name as sent by the client (e.g. {@code overlay_rect}).
     * @return the command, or empty if the name is not part of the command table.
     */
    public static Optional<OverlayCommand> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    /**
     * Resolves a client-supplied command name, applying the internal-use marker check.
     *
     * @param wireName       the name as sent by the client.
     * @param internalPrefix names starting with this prefix are never accepted.
     * @return the command, or empty if the name is marker-prefixed or unknown.
     */
    public static Optional<OverlayCommand> resolve(String wireName, String internalPrefix) {
        if (wireName == null || wireName.isEmpty()) {
            return Optional.empty();
        }
        if (!internalPrefix.isEmpty() && wireName.startsWith(internalPrefix)) {
            return Optional.empty();
        }
        return fromWireName(wireName);
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return true if this command must observe a contiguous call id sequence.
     */
    public boolean isBarrier() {
        return barrier;
    }

    public List<Param> params() {
        return params;
    }

    public int requiredCount() {
        return requiredCount;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
