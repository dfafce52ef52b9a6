package org.runekit.overlay.protocol;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.runekit.overlay.protocol.OverlayCommand.ArgType;
import org.runekit.overlay.protocol.OverlayCommand.Param;

/**
 * Validated, typed view of a command's argument list.
 * <p>
 * Created via {@link #validate(OverlayCommand, List)}, which checks the argument count and
 * every argument's type against the command table. The typed getters then convert the
 * loosely typed wire values (JSON numbers arrive as {@code Integer}, {@code Long} or
 * {@code Double}) into the Java types the handlers need.
 * <p>
 * <strong>Thread Safety:</strong> Immutable after construction.
 */
public final class CommandArgs {

    private final OverlayCommand command;
    private final List<Object> values;

    private CommandArgs(OverlayCommand command, List<Object> values) {
        this.command = command;
        this.values = values;
    }

    /**
     * Validates raw wire arguments against the parameter list of a command.
     *
     * @param command the command whose signature applies.
     * @param raw     the raw arguments, may be {@code null} for "no arguments".
     * @return the validated arguments.
     * @throws ProtocolViolationException if the count or any type does not match.
     */
    public static CommandArgs validate(OverlayCommand command, List<?> raw) {
        List<Object> values = raw == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(raw));
        List<Param> params = command.params();

        if (values.size() < command.requiredCount() || values.size() > params.size()) {
            String expected = command.requiredCount() == params.size()
                    ? String.valueOf(params.size())
                    : command.requiredCount() + ".." + params.size();
            throw new ProtocolViolationException(
                    command.wireName() + " expects " + expected + " arguments, got " + values.size());
        }

        for (int i = 0; i < values.size(); i++) {
            Param param = params.get(i);
            if (!accepts(param.type(), values.get(i))) {
                throw new ProtocolViolationException(command.wireName() + ": argument '" + param.name()
                        + "' must be " + param.type() + ", got " + describe(values.get(i)));
            }
        }
        return new CommandArgs(command, values);
    }

    private static boolean accepts(ArgType type, Object value) {
        return switch (type) {
            case INT -> value instanceof Number n && isIntegral(n);
            case COLOR -> value instanceof Number n && isIntegral(n)
                    && n.longValue() >= Integer.MIN_VALUE && n.longValue() <= 0xFFFFFFFFL;
            case STRING -> value instanceof String;
            case BOOL -> value instanceof Boolean || value instanceof Number;
            case BYTES -> value instanceof byte[] || value instanceof String || isByteList(value);
            case MODEL -> value == null || value instanceof Map;
            case LIST -> value instanceof List;
        };
    }

    private static boolean isIntegral(Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return true;
    }

    private static boolean isByteList(Object value) {
        if (!(value instanceof List<?> list)) {
            return false;
        }
        for (Object item : list) {
            if (!(item instanceof Number n) || !isIntegral(n) || n.longValue() < -128 || n.longValue() > 255) {
                return false;
            }
        }
        return true;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    public OverlayCommand command() {
        return command;
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns an integer argument. Values outside the {@code int} range saturate at
     * {@link Integer#MIN_VALUE} or {@link Integer#MAX_VALUE}.
     */
    public int getInt(int index) {
        return saturatedInt((Number) values.get(index));
    }

    private static int saturatedInt(Number value) {
        if (value instanceof BigInteger big) {
            return big.signum() < 0
                    ? big.max(BigInteger.valueOf(Integer.MIN_VALUE)).intValue()
                    : big.min(BigInteger.valueOf(Integer.MAX_VALUE)).intValue();
        }
        long n = value.longValue();
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, n));
    }

    /**
     * Returns a packed ARGB color. Values above {@link Integer#MAX_VALUE} are
     * reinterpreted as their unsigned 32-bit pattern.
     */
    public int getColor(int index) {
        return (int) ((Number) values.get(index)).longValue();
    }

    public String getString(int index) {
        return (String) values.get(index);
    }

    public boolean getBoolean(int index) {
        Object value = values.get(index);
        if (value instanceof Boolean b) {
            return b;
        }
        return ((Number) value).doubleValue() != 0.0;
    }

    /**
     * Returns a byte payload, decoding base64 strings and byte-value lists.
     *
     * @throws ProtocolViolationException if a string argument is not valid base64.
     */
    public byte[] getBytes(int index) {
        Object value = values.get(index);
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof String s) {
            try {
                return Base64.getMimeDecoder().decode(s);
            } catch (IllegalArgumentException e) {
                throw new ProtocolViolationException(command.wireName() + ": argument '"
                        + command.params().get(index).name() + "' is not valid base64", e);
            }
        }
        List<?> list = (List<?>) value;
        byte[] bytes = new byte[list.size()];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) ((Number) list.get(i)).intValue();
        }
        return bytes;
    }

    /**
     * Returns an optional map argument; absent when omitted or explicitly {@code null}.
     */
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getModel(int index) {
        if (index >= values.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable((Map<String, Object>) values.get(index));
    }

    public List<?> getList(int index) {
        return (List<?>) values.get(index);
    }

    public List<Object> raw() {
        return values;
    }
}
