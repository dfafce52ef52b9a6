package org.runekit.overlay.template;

/**
 * Thrown when a text template is malformed or references a field the model does not have.
 */
public class TemplateException extends RuntimeException {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
