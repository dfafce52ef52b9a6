package org.runekit.overlay.group;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;

/**
 * Most-recently-used list of group names that resolves the implicit target group of draw
 * commands.
 * <p>
 * A name appears at most once. {@link #push(String)} moves a name to the front; draw
 * commands {@link #peek()} and never pop, so repeated draws keep targeting the same group
 * until another name is pushed. An empty stack resolves to the default group
 * {@value #DEFAULT_GROUP}.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Engine thread only.
 */
public class GroupContextStack {

    /** Name of the group used when no name was ever pushed. */
    public static final String DEFAULT_GROUP = "";

    private final LinkedList<String> names = new LinkedList<>();

    /**
     * Moves {@code name} to the front, inserting it if absent.
     */
    public void push(String name) {
        names.remove(name);
        names.addFirst(name);
    }

    /**
     * @return the most recently pushed name, or empty.
     */
    public Optional<String> peek() {
        return Optional.ofNullable(names.peekFirst());
    }

    /**
     * Removes and returns the front name.
     *
     * @return the removed name, or empty if the stack was empty.
     */
    public Optional<String> pop() {
        return Optional.ofNullable(names.pollFirst());
    }

    /**
     * @return the current target group, or {@value #DEFAULT_GROUP} if the stack is empty.
     */
    public String current() {
        return peek().orElse(DEFAULT_GROUP);
    }

    public void clear() {
        names.clear();
    }

    public int size() {
        return names.size();
    }

    /**
     * @return a copy of the names, most recent first.
     */
    public List<String> snapshot() {
        return new ArrayList<>(names);
    }
}
