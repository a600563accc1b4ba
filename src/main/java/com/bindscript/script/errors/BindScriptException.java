package com.bindscript.script.errors;

/**
 * Base of every error raised by the binding core. Unchecked, like the rest of
 * the runtime; nested evaluation errors of other types pass through as-is.
 */
public class BindScriptException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public BindScriptException(String message) {
        super(message);
    }

    public BindScriptException(String message, Throwable cause) {
        super(message, cause);
    }
}
