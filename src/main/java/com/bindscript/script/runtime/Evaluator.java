package com.bindscript.script.runtime;

import java.util.List;

import com.bindscript.script.context.Symbol;

/**
 * Entry point into the expression evaluator, used by path dispatch for group
 * selectors and by action application.
 */
public interface Evaluator {

    /** Evaluates a block of code and returns its last value. */
    Value evaluate(List<Value> code);

    /** Invokes an action with already-evaluated arguments and refinements in use. */
    Value apply(ActionValue action, List<Value> args, List<Symbol> refinements);
}
