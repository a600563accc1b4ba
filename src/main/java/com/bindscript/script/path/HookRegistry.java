package com.bindscript.script.path;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

import com.bindscript.debug.Debug;
import com.bindscript.script.errors.UnhandledTypeException;
import com.bindscript.script.runtime.Value;

/**
 * Per-type path hook table.
 *
 * A fresh registry fails every selector on every kind, except the extension
 * kinds, which hold the unhooked stub until a {@link HookSet} is loaded.
 * Built-in container behavior is installed by
 * {@link com.bindscript.script.hooks.CoreHooks}.
 */
public final class HookRegistry {

    private static final String TAG = "bindscript.hooks";

    /** Any selector is unhandled. */
    public static final PathHook FAIL = (state, picker, setValue) -> HookResult.unhandled();

    /** Placeholder for a kind whose hook set is not loaded. */
    public static final PathHook UNHOOKED = (state, picker, setValue) -> {
        Value out = state.out();
        String what = (out.getType() == Value.Type.CUSTOM) ? out.asCustom().typeName() : out.getType().name();
        throw new UnhandledTypeException("No path hooks loaded for " + what);
    };

    private final Map<Value.Type, PathHook> hooks = new EnumMap<>(Value.Type.class);
    private final Map<String, PathHook> customHooks = new HashMap<>();

    public HookRegistry() {
        for (Value.Type t : Value.Type.values()) hooks.put(t, FAIL);
        hooks.put(Value.Type.IMAGE, UNHOOKED);
        hooks.put(Value.Type.VECTOR, UNHOOKED);
        hooks.put(Value.Type.STRUCT, UNHOOKED);
        hooks.put(Value.Type.CUSTOM, UNHOOKED);
    }

    /** Replaces the hook for a built-in kind. */
    public void register(Value.Type type, PathHook hook) {
        if (hook == null) throw new IllegalArgumentException("hook must not be null");
        hooks.put(type, hook);
    }

    public PathHook hookFor(Value.Type type) {
        return hooks.get(type);
    }

    public PathHook hookFor(Value value) {
        if (value.getType() == Value.Type.CUSTOM) {
            PathHook h = customHooks.get(value.asCustom().typeName());
            return (h == null) ? UNHOOKED : h;
        }
        return hooks.get(value.getType());
    }

    public boolean isLoaded(Value.Type type) {
        return hooks.get(type) != UNHOOKED;
    }

    public boolean isLoaded(String customType) {
        return customHooks.containsKey(customType);
    }

    /**
     * Installs every hook of {@code set}. Each target must still be an unhooked
     * stub; nothing is installed if one is not.
     */
    public void load(HookSet set) {
        for (Value.Type t : set.typeHooks().keySet()) {
            if (hooks.get(t) != UNHOOKED) {
                throw new IllegalStateException("Hook set '" + set.name() + "' cannot replace the " + t + " hook");
            }
        }
        for (String name : set.customHooks().keySet()) {
            if (customHooks.containsKey(name)) {
                throw new IllegalStateException("Hook set '" + set.name() + "' cannot replace custom type " + name);
            }
        }

        hooks.putAll(set.typeHooks());
        customHooks.putAll(set.customHooks());
        Debug.get().d(TAG, "loaded hook set " + set.name());
    }

    /** Puts the stubs back for every hook {@code set} installed. */
    public void unload(HookSet set) {
        for (Map.Entry<Value.Type, PathHook> e : set.typeHooks().entrySet()) {
            if (hooks.get(e.getKey()) == e.getValue()) hooks.put(e.getKey(), UNHOOKED);
        }
        for (Map.Entry<String, PathHook> e : set.customHooks().entrySet()) {
            customHooks.remove(e.getKey(), e.getValue());
        }
        Debug.get().d(TAG, "unloaded hook set " + set.name());
    }
}
