package com.bindscript.script.errors;

/** Dotted access met a callable, or slashed access met a non-callable. */
public class PathPolicyException extends BindScriptException {
    private static final long serialVersionUID = 1L;

    public PathPolicyException(String message) {
        super(message);
    }
}
