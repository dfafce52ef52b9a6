package org.runekit.overlay.protocol;

/**
 * Thrown when a command does not match the shape declared in the command table:
 * wrong argument count, wrong argument type, or an undecodable payload.
 * <p>
 * Raised while a dispatched command runs, so the sequencer's failure boundary logs it
 * like any other execution fault and ordering still advances past the offending call.
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
