package org.runekit.overlay.protocol;

/**
 * Executes a single validated command. Implementations run on the engine thread.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * Executes a command.
     *
     * @param command the resolved command table entry.
     * @param args    the arguments, already validated against the command's signature.
     * @throws RuntimeException on any execution fault; the caller isolates it.
     */
    void handle(OverlayCommand command, CommandArgs args);
}
