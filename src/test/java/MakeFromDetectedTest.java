import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.bindscript.script.context.Context;
import com.bindscript.script.context.Contexts;
import com.bindscript.script.context.Key;
import com.bindscript.script.context.SymbolTable;
import com.bindscript.script.errors.ReadOnlyException;
import com.bindscript.script.runtime.ActionValue;
import com.bindscript.script.runtime.Value;
import com.bindscript.script.runtime.Word;

public class MakeFromDetectedTest {

    private final SymbolTable syms = new SymbolTable();

    private Value sw(String s) { return Value.setWord(syms.intern(s)); }

    @Test
    void set_words_become_unset_variables() {
        Context ctx = Contexts.makeFromDetected(Value.Type.OBJECT,
                List.of(sw("a"), Value.integer(1), Value.word(syms.intern("b")), sw("c"), Value.integer(2)), null);

        assertEquals(2, ctx.length());
        assertEquals("a", ctx.symbol(1).spelling());
        assertEquals("c", ctx.symbol(2).spelling());
        assertTrue(ctx.get(1).isUnset());
        assertTrue(ctx.get(2).isUnset());
        assertSame(ctx.keyList(), ctx.keyList().ancestor());
    }

    @Test
    void child_gets_copies_of_inherited_series() {
        Context parent = Contexts.makeFromDetected(Value.Type.OBJECT, List.of(sw("blk"), Value.blank()), null);
        Value blk = Value.block(Value.integer(1), Value.integer(2));
        parent.put(1, blk);

        Context child = Contexts.makeFromDetected(Value.Type.OBJECT, List.of(sw("extra"), Value.blank()), parent);

        assertEquals(2, child.length());
        assertEquals(blk, child.get(1));
        assertNotSame(blk.asList(), child.get(1).asList());

        child.get(1).asList().add(Value.integer(3));
        assertEquals(2, blk.asList().size());
    }

    @Test
    void child_with_new_words_has_its_own_derived_key_list() {
        Context parent = Contexts.makeFromDetected(Value.Type.OBJECT, List.of(sw("a"), Value.blank()), null);
        Context child = Contexts.makeFromDetected(Value.Type.OBJECT, List.of(sw("b"), Value.blank()), parent);

        assertNotSame(parent.keyList(), child.keyList());
        assertFalse(child.keyList().isShared());
        assertFalse(parent.keyList().isShared());
        assertTrue(child.keyList().isDerivedFrom(parent.keyList()));
    }

    @Test
    void inherited_words_and_actions_are_rebound_to_the_child() {
        Context parent = Contexts.makeFromDetected(Value.Type.OBJECT,
                List.of(sw("x"), Value.blank(), sw("code"), Value.blank(), sw("f"), Value.blank()), null);
        parent.put(1, Value.integer(1));
        parent.put(2, Value.block(Value.word(Value.Type.WORD, new Word(syms.intern("x"), parent, 1))));
        ActionValue f = new ActionValue(new ArrayList<>(), (frame, ev) -> Value.nulled()).withBinding(parent);
        parent.put(3, Value.action(f));

        Context child = Contexts.makeFromDetected(Value.Type.OBJECT, new ArrayList<>(), parent);
        child.put(1, Value.integer(2));

        Word inChild = child.get(2).asList().get(0).asWord();
        assertSame(child, inChild.binding());
        assertEquals(Value.integer(2), inChild.lookup().get());

        Word inParent = parent.get(2).asList().get(0).asWord();
        assertSame(parent, inParent.binding());
        assertEquals(Value.integer(1), inParent.lookup().get());

        assertSame(child, child.get(3).asAction().binding());
        assertSame(parent, parent.get(3).asAction().binding());
    }

    @Test
    void frame_bound_actions_are_left_alone() {
        Context frame = Contexts.allocate(Value.Type.FRAME, 0);
        Context parent = Contexts.makeFromDetected(Value.Type.OBJECT, List.of(sw("f"), Value.blank()), null);
        ActionValue f = new ActionValue(new ArrayList<>(), (fr, ev) -> Value.nulled()).withBinding(frame);
        parent.put(1, Value.action(f));

        Context child = Contexts.makeFromDetected(Value.Type.OBJECT, new ArrayList<>(), parent);

        assertSame(frame, child.get(1).asAction().binding());
    }

    @Test
    void key_flags_follow_the_keys_into_a_child_with_new_words() {
        Context parent = Contexts.makeFromDetected(Value.Type.OBJECT,
                List.of(sw("secret"), Value.blank(), sw("fixed"), Value.blank()), null);
        parent.setKeyFlag(1, Key.HIDDEN, true);
        parent.setKeyFlag(2, Key.PROTECTED, true);
        assertEquals(0, Contexts.findSymbol(parent, syms.intern("secret"), false));

        Context child = Contexts.makeFromDetected(Value.Type.OBJECT, List.of(sw("extra"), Value.blank()), parent);

        assertEquals(3, child.length());
        assertTrue(child.key(1).isHidden());
        assertEquals(0, Contexts.findSymbol(child, syms.intern("secret"), false));
        assertTrue(child.key(2).isProtected());
        assertThrows(ReadOnlyException.class, () -> child.put(2, Value.integer(1)));
        assertFalse(child.key(3).isHidden());
    }
}
