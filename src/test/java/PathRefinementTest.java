import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.bindscript.script.context.Context;
import com.bindscript.script.context.Contexts;
import com.bindscript.script.context.Symbol;
import com.bindscript.script.context.SymbolTable;
import com.bindscript.script.errors.BadSelectorException;
import com.bindscript.script.errors.PathPolicyException;
import com.bindscript.script.hooks.CoreHooks;
import com.bindscript.script.path.PathDispatcher;
import com.bindscript.script.path.PathFlags;
import com.bindscript.script.path.PathResult;
import com.bindscript.script.runtime.ActionValue;
import com.bindscript.script.runtime.Value;
import com.bindscript.script.runtime.Word;

public class PathRefinementTest {

    private SymbolTable syms;
    private PathDispatcher paths;
    private Context root;
    private Context obj;

    @BeforeEach
    void setUp() {
        syms = new SymbolTable();
        paths = new PathDispatcher(CoreHooks.registry(false), null);

        ActionValue copy = new ActionValue(List.of(
                new ActionValue.Param(syms.intern("value"), false),
                new ActionValue.Param(syms.intern("part"), true),
                new ActionValue.Param(syms.intern("deep"), true)),
                (frame, ev) -> frame.get(1));

        obj = Contexts.allocate(Value.Type.OBJECT, 2);
        obj.put(Contexts.append(obj, syms.intern("copy")), Value.action(copy));
        obj.put(Contexts.append(obj, syms.intern("n")), Value.integer(1));

        root = Contexts.allocate(Value.Type.MODULE, 2);
        root.put(Contexts.append(root, syms.intern("copy")), Value.action(copy));
        root.put(Contexts.append(root, syms.intern("obj")), Value.context(obj));
    }

    private Value w(String s) {
        return Value.word(syms.intern(s));
    }

    private Value head(String name) {
        Symbol s = syms.intern(name);
        return Value.word(Value.Type.WORD, new Word(s, root, Contexts.findSymbol(root, s, false)));
    }

    private List<Value> path(Value... items) {
        return new ArrayList<>(List.of(items));
    }

    private static List<String> spell(List<Symbol> syms) {
        List<String> out = new ArrayList<>();
        for (Symbol s : syms) out.add(s.spelling());
        return out;
    }

    @Test
    void refinements_specialize_in_the_order_written() {
        PathResult r = paths.evaluate(path(head("copy"), w("deep"), w("part")), null, PathFlags.NONE);

        ActionValue a = r.value().asAction();
        assertEquals(List.of("deep", "part"), spell(a.specialized()));
        assertTrue(r.refinements().isEmpty());
        assertEquals("copy", r.label().spelling());
        assertEquals("copy", a.label().spelling());
    }

    @Test
    void push_refinements_hands_back_the_raw_marks() {
        PathResult r = paths.evaluate(path(head("copy"), w("part"), w("deep")), null, PathFlags.PUSH_REFINEMENTS);

        assertEquals(List.of("part", "deep"), spell(r.refinements()));
        assertTrue(r.value().asAction().specialized().isEmpty());
    }

    @Test
    void action_reached_by_a_word_selector_takes_its_label() {
        PathResult r = paths.evaluate(path(head("obj"), w("copy"), w("part")), null, PathFlags.NONE);

        assertEquals("copy", r.label().spelling());
        assertEquals(List.of("part"), spell(r.value().asAction().specialized()));
    }

    @Test
    void unknown_or_repeated_refinement_is_a_bad_selector() {
        assertThrows(BadSelectorException.class,
                () -> paths.get(path(head("copy"), w("nope"))));
        assertThrows(BadSelectorException.class,
                () -> paths.get(path(head("copy"), w("part"), w("PART"))));
    }

    @Test
    void blank_selector_on_an_action_is_ignored() {
        Value got = paths.get(path(head("copy"), Value.blank()));
        assertTrue(got.asAction().specialized().isEmpty());
    }

    @Test
    void dotted_access_refuses_actions_and_slashed_access_requires_them() {
        assertThrows(PathPolicyException.class,
                () -> paths.evaluate(path(head("obj"), w("copy")), null, PathFlags.FORBID_ACTIVATION));
        assertEquals(Value.integer(1),
                paths.evaluate(path(head("obj"), w("n")), null, PathFlags.FORBID_ACTIVATION).value());

        assertThrows(PathPolicyException.class,
                () -> paths.evaluate(path(head("obj"), w("n")), null, PathFlags.REQUIRE_ACTIVATION));
        assertTrue(paths.evaluate(path(head("obj"), w("copy")), null, PathFlags.REQUIRE_ACTIVATION).value().isAction());
    }

    @Test
    void actions_cannot_be_written_through() {
        assertThrows(BadSelectorException.class,
                () -> paths.set(path(head("copy"), w("part")), Value.integer(1)));
    }

    @Test
    void group_selectors_need_an_evaluator() {
        assertThrows(IllegalStateException.class,
                () -> paths.get(path(head("obj"), Value.group(Value.integer(1)))));
    }
}
