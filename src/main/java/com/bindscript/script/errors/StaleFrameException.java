package com.bindscript.script.errors;

/** A spent invocation record was queried through the user-facing view. */
public class StaleFrameException extends BindScriptException {
    private static final long serialVersionUID = 1L;

    public StaleFrameException(String message) {
        super(message);
    }
}
