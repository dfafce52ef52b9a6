package org.runekit.overlay.template;

import java.util.List;

/**
 * A list of model values, addressed with {@code [index]} in templates.
 */
public record ModelList(List<ModelValue> items) implements ModelValue {

    public ModelList {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    /**
     * Returns an item, counting negative indexes from the end.
     *
     * @throws TemplateException if the index is out of range.
     */
    public ModelValue get(int index) {
        int resolved = index < 0 ? items.size() + index : index;
        if (resolved < 0 || resolved >= items.size()) {
            throw new TemplateException("list index out of range: " + index);
        }
        return items.get(resolved);
    }
}
