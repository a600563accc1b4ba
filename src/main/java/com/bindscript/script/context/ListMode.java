package com.bindscript.script.context;

/** What {@link Contexts#toList} emits for each visible key. */
public enum ListMode {
    WORDS(true, false),
    VALUES(false, true),
    WORDS_AND_VALUES(true, true);

    private final boolean words;
    private final boolean values;

    ListMode(boolean words, boolean values) {
        this.words = words;
        this.values = values;
    }

    public boolean includesWords() { return words; }

    public boolean includesValues() { return values; }
}
