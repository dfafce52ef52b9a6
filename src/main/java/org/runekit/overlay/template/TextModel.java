package org.runekit.overlay.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A named-field model bound to a group and read by its text templates.
 * <p>
 * Fields are ordered by insertion. Nested maps become nested models, lists become
 * {@link ModelList}s, scalars are kept as is. Unlike the other model values a
 * {@code TextModel} is mutable: pointer-follow groups update their {@code mouse_x} and
 * {@code mouse_y} fields in place.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Engine thread only.
 */
public final class TextModel implements ModelValue {

    /** A model carrying this key plays the highlight animation on changed texts. */
    public static final String ANIMATE_KEY = "__animate";

    private final Map<String, ModelValue> fields = new LinkedHashMap<>();

    public TextModel() {
    }

    /**
     * Builds a model from a decoded JSON object.
     *
     * @param map the object; keys are converted with {@link String#valueOf(Object)}.
     * @return the model.
     */
    public static TextModel fromMap(Map<?, ?> map) {
        TextModel model = new TextModel();
        map.forEach((key, value) -> model.fields.put(String.valueOf(key), ModelValue.of(value)));
        return model;
    }

    /**
     * @return the field, or empty if the model has no such field.
     */
    public Optional<ModelValue> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public void put(String name, ModelValue value) {
        fields.put(name, value);
    }

    public void put(String name, Object value) {
        fields.put(name, ModelValue.of(value));
    }

    /**
     * @return true if texts refreshed from this model should play the highlight animation.
     */
    public boolean requestsAnimation() {
        return has(ANIMATE_KEY);
    }

    public Map<String, ModelValue> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * @return the model as plain nested maps, lists and scalars.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        fields.forEach((key, value) -> result.put(key, value.toPlain()));
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TextModel other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return TemplateFormatter.repr(this);
    }
}
