package com.bindscript.script.errors;

/** A word occurred twice while collecting keys with duplicates forbidden. */
public class DuplicateKeyException extends BindScriptException {
    private static final long serialVersionUID = 1L;

    private final String word;

    public DuplicateKeyException(String word) {
        super("Duplicate variable name: " + word);
        this.word = word;
    }

    public String word() {
        return word;
    }
}
