package org.runekit.overlay.template;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.runekit.overlay.group.GroupRegistry;
import org.runekit.overlay.render.GroupHandle;
import org.runekit.overlay.render.PrimitiveHandle;
import org.runekit.overlay.render.RenderSurface;

/**
 * Binds text models to group names and keeps the group's text primitives in sync.
 * <p>
 * Text primitives remember the template they were created with under
 * {@link #TEMPLATE_DATA_KEY}. Replacing a group's model re-evaluates every templated text
 * of that group, descending into nested groups. Only texts whose formatted value changed
 * are updated, and those play the highlight animation when the model asks for it.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Engine thread only.
 */
public class TemplateBindings {

    /** Surface data key holding a text primitive's template. */
    public static final String TEMPLATE_DATA_KEY = "runekit.template";

    private final RenderSurface surface;
    private final GroupRegistry registry;
    private final Map<String, TextModel> models = new LinkedHashMap<>();

    public TemplateBindings(RenderSurface surface, GroupRegistry registry) {
        this.surface = Objects.requireNonNull(surface, "surface");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Replaces the model bound to a group and refreshes the group's texts.
     *
     * @param name  the group name.
     * @param model decoded JSON object.
     * @throws TemplateException if a text template of the group cannot be evaluated.
     */
    public void bind(String name, Map<String, Object> model) {
        bind(name, TextModel.fromMap(model));
    }

    /**
     * Replaces the model bound to a group and refreshes the group's texts.
     *
     * @throws TemplateException if a text template of the group cannot be evaluated.
     */
    public void bind(String name, TextModel model) {
        models.put(name, Objects.requireNonNull(model, "model"));
        refresh(name);
    }

    public Optional<TextModel> model(String name) {
        return Optional.ofNullable(models.get(name));
    }

    /**
     * @return the bound model, binding an empty one first if there is none.
     */
    public TextModel modelOrCreate(String name) {
        return models.computeIfAbsent(name, k -> new TextModel());
    }

    /**
     * Formats a new text's template against the model of the group it is drawn into.
     *
     * @return the formatted text, or the raw template if the group has no model.
     */
    public String render(String groupName, String template) {
        TextModel model = models.get(groupName);
        return model == null ? template : TemplateFormatter.format(template, model);
    }

    /**
     * Re-evaluates the texts of an active or frozen group against its bound model. Does
     * nothing if the group or the model does not exist.
     */
    public void refresh(String name) {
        TextModel model = models.get(name);
        if (model == null) {
            return;
        }
        registry.handle(name).ifPresent(group -> refreshTexts(group, model));
    }

    private void refreshTexts(GroupHandle group, TextModel model) {
        for (PrimitiveHandle child : surface.children(group)) {
            if (child instanceof GroupHandle nested) {
                refreshTexts(nested, model);
                continue;
            }
            if (child.kind() != PrimitiveHandle.Kind.TEXT
                    || !(surface.data(child, TEMPLATE_DATA_KEY) instanceof String template)) {
                continue;
            }
            String text = TemplateFormatter.format(template, model);
            if (!text.equals(surface.text(child))) {
                surface.setText(child, text);
                if (model.requestsAnimation()) {
                    surface.animate(child);
                }
            }
        }
    }

    public void unbind(String name) {
        models.remove(name);
    }

    public void clear() {
        models.clear();
    }

    /**
     * @return bound models as plain maps, by group name.
     */
    public Map<String, Map<String, Object>> snapshot() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        models.forEach((name, model) -> result.put(name, model.toMap()));
        return result;
    }
}
