package com.bindscript.script.errors;

/** A selector is not valid for the container it was applied to. */
public class BadSelectorException extends BindScriptException {
    private static final long serialVersionUID = 1L;

    private final String selector;

    public BadSelectorException(String selector, String message) {
        super(message);
        this.selector = selector;
    }

    public static BadSelectorException pick(String selector) {
        return new BadSelectorException(selector, "Cannot pick " + selector);
    }

    public static BadSelectorException poke(String selector) {
        return new BadSelectorException(selector, "Cannot poke " + selector);
    }

    public String selector() {
        return selector;
    }
}
