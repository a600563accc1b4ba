package com.bindscript.script.errors;

/** A write targeted a read-only context or a protected variable. */
public class ReadOnlyException extends BindScriptException {
    private static final long serialVersionUID = 1L;

    private final String structure;

    public ReadOnlyException(String structure) {
        super("Cannot modify read-only " + structure);
        this.structure = structure;
    }

    public String structure() {
        return structure;
    }
}
