package com.bindscript.script.context;

import com.bindscript.script.runtime.Value;

/** Deep copy applied to inherited and merged values. */
@FunctionalInterface
public interface Cloner {

    Value cloneOf(Value value);

    Cloner DEEP = Value::cloneDeep;
}
