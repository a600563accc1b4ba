package com.bindscript.script.path;

import com.bindscript.script.runtime.Value;

/**
 * Per-type behavior for one path step.
 *
 * {@code setValue} is non-null only on the last step of a SET walk. A hook may
 * replace {@link PathState#out()} (for {@link HookResult.Outcome#DEFERRED} and
 * {@link HookResult.Outcome#REDO} that is how it reports its work) and may
 * push refinement marks, but never touches the remembered reference.
 */
@FunctionalInterface
public interface PathHook {
    HookResult handle(PathState state, Value picker, Value setValue);
}
