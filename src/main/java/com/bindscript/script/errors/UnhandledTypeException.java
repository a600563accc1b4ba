package com.bindscript.script.errors;

/** The datatype is provided by a hook set that has not been loaded. */
public class UnhandledTypeException extends BindScriptException {
    private static final long serialVersionUID = 1L;

    public UnhandledTypeException(String message) {
        super(message);
    }
}
