package com.bindscript.script.runtime;

/**
 * Writable reference to one stored value: a context variable, a block element.
 * Path dispatch remembers the last slot it read through so that a later step
 * can write an updated scalar back into it.
 */
public interface Slot {
    Value get();

    void set(Value value);
}
