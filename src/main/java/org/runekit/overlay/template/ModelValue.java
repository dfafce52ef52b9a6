package org.runekit.overlay.template;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A value inside a {@link TextModel}: string, number, boolean, null, nested model or list.
 * <p>
 * {@link #of(Object)} converts decoded JSON (maps, lists, scalars) into this tree, so
 * templates can reference arbitrarily nested fields.
 */
public sealed interface ModelValue
        permits ModelValue.Text, ModelValue.Num, ModelValue.Flag, ModelValue.Null, ModelList, TextModel {

    /**
     * A string value.
     */
    record Text(String value) implements ModelValue {
        public Text {
            if (value == null) {
                throw new IllegalArgumentException("value must not be null");
            }
        }
    }

    /**
     * A number. Integral values are held as {@link Long}, all others as {@link Double}.
     */
    record Num(Number value) implements ModelValue {

        public Num {
            if (!(value instanceof Long) && !(value instanceof Double)) {
                throw new IllegalArgumentException("Num holds Long or Double, got " + value);
            }
        }

        public static Num of(long value) {
            return new Num(value);
        }

        public static Num of(double value) {
            return new Num(value);
        }

        public boolean isIntegral() {
            return value instanceof Long;
        }

        public double doubleValue() {
            return value.doubleValue();
        }

        public long longValue() {
            return value.longValue();
        }
    }

    /**
     * A boolean value.
     */
    record Flag(boolean value) implements ModelValue {}

    /**
     * The null value.
     */
    enum Null implements ModelValue {
        INSTANCE
    }

    /**
     * Converts a decoded JSON value into a model value.
     *
     * @param raw a map, list, string, number, boolean, {@code null} or model value.
     * @return the converted value; unknown types become their string form.
     */
    static ModelValue of(Object raw) {
        if (raw == null) {
            return Null.INSTANCE;
        }
        if (raw instanceof ModelValue value) {
            return value;
        }
        if (raw instanceof String s) {
            return new Text(s);
        }
        if (raw instanceof Boolean b) {
            return new Flag(b);
        }
        if (raw instanceof Number n) {
            return number(n);
        }
        if (raw instanceof Map<?, ?> map) {
            return TextModel.fromMap(map);
        }
        if (raw instanceof List<?> list) {
            List<ModelValue> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new ModelList(items);
        }
        return new Text(String.valueOf(raw));
    }

    private static Num number(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return Num.of(n.longValue());
        }
        if (n instanceof BigInteger big) {
            return big.bitLength() < 64 ? Num.of(big.longValue()) : Num.of(big.doubleValue());
        }
        if (n instanceof BigDecimal dec) {
            return Num.of(dec.doubleValue());
        }
        return Num.of(n.doubleValue());
    }

    /**
     * Converts this value back to plain Java objects (maps, lists, scalars).
     */
    default Object toPlain() {
        if (this instanceof Text t) {
            return t.value();
        }
        if (this instanceof Num n) {
            return n.value();
        }
        if (this instanceof Flag f) {
            return f.value();
        }
        if (this instanceof ModelList list) {
            List<Object> items = new ArrayList<>();
            for (ModelValue item : list.items()) {
                items.add(item.toPlain());
            }
            return items;
        }
        if (this instanceof TextModel model) {
            return model.toMap();
        }
        return null;
    }
}
