package org.runekit.overlay.protocol;

import java.util.List;
import java.util.Map;

/**
 * One entry of a batch: a command name and its raw arguments, executed without
 * ordering or barrier semantics.
 *
 * @param command the wire name of the command.
 * @param args    the raw arguments.
 */
public record BatchEntry(String command, List<?> args) {

    public BatchEntry {
        args = args == null ? List.of() : args;
    }

    /**
     * Converts a wire value into a batch entry. Two shapes are accepted:
     * {@code ["overlay_rect", [..args..]]} and {@code {"command": "overlay_rect", "args": [..]}}.
     *
     * @param wire the decoded JSON value.
     * @return the batch entry.
     * @throws ProtocolViolationException if the value has neither shape.
     */
    public static BatchEntry fromWire(Object wire) {
        if (wire instanceof List<?> pair && !pair.isEmpty() && pair.size() <= 2
                && pair.get(0) instanceof String name) {
            Object args = pair.size() == 2 ? pair.get(1) : List.of();
            if (args == null || args instanceof List<?>) {
                return new BatchEntry(name, (List<?>) args);
            }
        }
        if (wire instanceof Map<?, ?> map && map.get("command") instanceof String name) {
            Object args = map.get("args");
            if (args == null || args instanceof List<?>) {
                return new BatchEntry(name, (List<?>) args);
            }
        }
        throw new ProtocolViolationException("Malformed batch entry: expected [command, args] or "
                + "{command, args}, got " + (wire == null ? "null" : wire.getClass().getSimpleName()));
    }
}
