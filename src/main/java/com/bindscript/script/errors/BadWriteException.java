package com.bindscript.script.errors;

/** A write had no addressable backing, or an unset value was read as data. */
public class BadWriteException extends BindScriptException {
    private static final long serialVersionUID = 1L;

    public BadWriteException(String message) {
        super(message);
    }
}
