import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.bindscript.script.BindScript;
import com.bindscript.script.RuntimeConfig;
import com.bindscript.script.context.Binding;
import com.bindscript.script.context.Context;
import com.bindscript.script.context.Contexts;
import com.bindscript.script.errors.BindScriptException;
import com.bindscript.script.errors.NotFoundException;
import com.bindscript.script.errors.StaleFrameException;
import com.bindscript.script.runtime.ThrowSignal;
import com.bindscript.script.runtime.Value;
import com.bindscript.script.runtime.Word;

public class BlockEvaluatorTest {

    private BindScript es;

    @BeforeEach
    void setUp() {
        es = new BindScript(RuntimeConfig.defaults().maxCallDepth(16));
    }

    private static List<Value> code(Value... items) {
        return new ArrayList<>(List.of(items));
    }

    @Test
    void natives_consume_their_arguments() {
        assertEquals(Value.integer(3), es.evaluate(code(es.word("add"), Value.integer(1), Value.integer(2))));
        assertEquals(Value.integer(6), es.evaluate(code(
                es.word("add"), Value.integer(1), es.word("add"), Value.integer(2), Value.integer(3))));
        assertEquals(Value.decimal(-1.5), es.evaluate(code(es.word("negate"), Value.decimal(1.5))));
        assertEquals(Value.decimal(0.5), es.evaluate(code(es.word("subtract"), Value.integer(2), Value.decimal(1.5))));
    }

    @Test
    void refinement_in_a_call_path_is_activated() {
        Value plain = es.evaluate(code(es.word("join"), Value.text("a"), Value.text("b")));
        Value spaced = es.evaluate(code(es.path(es.word("join"), es.word("spaced")), Value.text("a"), Value.text("b")));

        assertEquals(Value.text("ab"), plain);
        assertEquals(Value.text("a b"), spaced);
    }

    @Test
    void make_object_evaluates_its_body_inside_the_object() {
        Context o = es.makeObject(code(
                es.setWord("a"), Value.integer(1),
                es.setWord("b"), es.word("add"), es.word("a"), Value.integer(2)), null);

        assertEquals(2, o.length());
        assertEquals(Value.integer(3), Contexts.select(o, es.intern("b")));
    }

    @Test
    void derived_object_leaves_its_parent_alone() {
        Context parent = es.makeObject(code(es.setWord("a"), Value.integer(1)), null);
        Context child = es.makeObject(code(es.setWord("a"), Value.integer(5), es.setWord("c"), Value.integer(2)), parent);

        assertEquals(Value.integer(1), Contexts.select(parent, es.intern("a")));
        assertEquals(Value.integer(5), Contexts.select(child, es.intern("a")));
        assertEquals(1, parent.length());
        assertEquals(2, child.length());
    }

    @Test
    void set_path_in_code_writes_through_the_path() {
        Context o = es.makeObject(code(
                es.setWord("p"), Value.pair(1, 2),
                es.setPath(es.word("p"), es.word("y")), Value.integer(9)), null);

        assertEquals(Value.pair(1, 9), Contexts.select(o, es.intern("p")));
    }

    @Test
    void unset_and_unbound_words_are_not_found() {
        Context o = es.makeObject(code(es.setWord("later"), Value.blank()), null);
        int n = Contexts.append(o, es.intern("fresh"));
        Value fresh = Value.word(Value.Type.WORD, new Word(es.intern("fresh"), o, n));

        assertThrows(NotFoundException.class, () -> es.evaluator().evaluate(code(fresh)));
        assertThrows(NotFoundException.class, () -> es.evaluate(code(es.word("nowhere"))));
    }

    @Test
    void missing_argument_is_reported() {
        BindScriptException ex = assertThrows(BindScriptException.class,
                () -> es.evaluate(code(es.word("add"), Value.integer(1))));
        assertTrue(ex.getMessage().contains("add"));
    }

    @Test
    void recursion_past_the_depth_limit_fails_and_unwinds() {
        es.registerNative("dive", List.of("n"),
                (frame, ev) -> es.evaluate(code(es.word("dive"), frame.get(1))));

        BindScriptException ex = assertThrows(BindScriptException.class,
                () -> es.evaluate(code(es.word("dive"), Value.integer(0))));
        assertEquals("Max call depth exceeded", ex.getMessage());
        assertEquals(0, es.evaluator().depth());
    }

    @Test
    void frame_is_stale_once_the_call_returns() {
        es.registerNative("leak", List.of("x"),
                (frame, ev) -> Value.word(Value.Type.WORD, new Word(frame.symbol(1), frame, 1)));

        Value leaked = es.evaluate(code(es.word("leak"), Value.integer(4)));

        assertThrows(StaleFrameException.class, () -> leaked.asWord().lookup());
    }

    @Test
    void throw_passes_through_evaluation() {
        ThrowSignal t = assertThrows(ThrowSignal.class,
                () -> es.evaluate(code(es.word("throw"), Value.text("out"), Value.integer(1))));
        assertEquals(Value.text("out"), t.value());
        assertNull(t.name());
        assertEquals(0, es.evaluator().depth());
    }

    @Test
    void pick_and_poke_natives_use_the_dispatcher() {
        Context o = es.makeObject(code(
                es.setWord("blk"), Value.block(Value.integer(1), Value.integer(2)),
                es.word("poke"), es.word("blk"), Value.integer(2), Value.integer(20),
                es.setWord("second"), es.word("pick"), es.word("blk"), Value.integer(2)), null);

        assertEquals(Value.integer(20), Contexts.select(o, es.intern("second")));
    }

    @Test
    void for_each_assigns_loop_variables_per_pass() {
        Context acc = es.makeObject(code(es.setWord("total"), Value.integer(0)), null);
        List<Value> body = code(es.setWord("total"), es.word("add"), es.word("total"), es.word("x"));
        Binding.bindDeep(body, acc);

        es.forEach(es.word("x"), List.of(Value.integer(1), Value.integer(2), Value.integer(3)), body);

        assertEquals(Value.integer(6), Contexts.select(acc, es.intern("total")));
    }

    @Test
    void for_each_with_several_variables_pads_with_null() {
        List<Value> seen = new ArrayList<>();
        es.registerNative("see", List.of("v"), (frame, ev) -> {
            seen.add(frame.get(1));
            return Value.nulled();
        });

        Value vars = Value.block(es.word("k"), es.word("v"));
        List<Value> series = List.of(Value.text("a"), Value.integer(1), Value.text("b"));
        es.forEach(vars, series, code(es.word("see"), es.word("v")));

        assertEquals(2, seen.size());
        assertEquals(Value.integer(1), seen.get(0));
        assertTrue(seen.get(1).isNull());
    }
}
