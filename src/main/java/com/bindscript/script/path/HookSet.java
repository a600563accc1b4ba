package com.bindscript.script.path;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.bindscript.script.runtime.Value;

/**
 * A named group of hooks loaded into a {@link HookRegistry} at runtime, for
 * extension kinds (IMAGE, VECTOR, STRUCT) and named CUSTOM types.
 */
public final class HookSet {

    private final String name;
    private final Map<Value.Type, PathHook> typeHooks = new EnumMap<>(Value.Type.class);
    private final Map<String, PathHook> customHooks = new LinkedHashMap<>();

    public HookSet(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public HookSet hook(Value.Type type, PathHook hook) {
        if (type == Value.Type.CUSTOM) {
            throw new IllegalArgumentException("CUSTOM hooks are registered by type name");
        }
        typeHooks.put(type, hook);
        return this;
    }

    public HookSet custom(String typeName, PathHook hook) {
        customHooks.put(typeName, hook);
        return this;
    }

    Map<Value.Type, PathHook> typeHooks() {
        return Collections.unmodifiableMap(typeHooks);
    }

    Map<String, PathHook> customHooks() {
        return Collections.unmodifiableMap(customHooks);
    }
}
