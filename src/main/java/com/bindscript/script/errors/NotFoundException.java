package com.bindscript.script.errors;

/** A word has no binding, or a path step produced no value to continue from. */
public class NotFoundException extends BindScriptException {
    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }
}
