import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.bindscript.script.context.Context;
import com.bindscript.script.context.Contexts;
import com.bindscript.script.context.SymbolTable;
import com.bindscript.script.errors.BadSelectorException;
import com.bindscript.script.errors.BadWriteException;
import com.bindscript.script.hooks.CoreHooks;
import com.bindscript.script.path.PathDispatcher;
import com.bindscript.script.runtime.Value;

public class PickPokeTest {

    private final SymbolTable syms = new SymbolTable();
    private final PathDispatcher paths = new PathDispatcher(CoreHooks.registry(false), null);

    @Test
    void pick_and_poke_a_context_variable() {
        Context c = Contexts.allocate(Value.Type.OBJECT, 1);
        c.put(Contexts.append(c, syms.intern("v")), Value.integer(1));
        Value loc = Value.context(c);

        assertEquals(Value.integer(1), paths.pick(loc, Value.word(syms.intern("v"))));
        assertEquals(Value.integer(2), paths.poke(loc, Value.word(syms.intern("v")), Value.integer(2)));
        assertEquals(Value.integer(2), c.get(1));
    }

    @Test
    void pick_and_poke_block_items() {
        Value blk = Value.block(Value.text("a"), Value.text("b"));

        assertEquals(Value.text("b"), paths.pick(blk, Value.integer(2)));
        paths.poke(blk, Value.integer(1), Value.text("z"));
        assertEquals(Value.text("z"), blk.asList().get(0));

        BadSelectorException ex = assertThrows(BadSelectorException.class,
                () -> paths.poke(blk, Value.integer(5), Value.text("q")));
        assertEquals("Cannot poke 5", ex.getMessage());
    }

    @Test
    void poke_into_a_map_is_applied_in_place() {
        Map<String, Value> m = new LinkedHashMap<>();
        Value map = Value.map(m);

        paths.poke(map, Value.text("k"), Value.integer(1));
        assertEquals(Value.integer(1), m.get("k"));
        assertEquals(Value.integer(1), paths.pick(map, Value.text("K")));
    }

    @Test
    void poke_into_an_immutable_value_is_a_bad_write() {
        assertThrows(BadWriteException.class,
                () -> paths.poke(Value.pair(1, 2), Value.word(syms.intern("x")), Value.integer(5)));
        assertEquals(Value.integer(2), paths.pick(Value.pair(1, 2), Value.word(syms.intern("y"))));
    }

    @Test
    void pick_through_a_quoted_value() {
        Value q = Value.quoted(Value.block(Value.integer(7)));
        assertEquals(Value.integer(7), paths.pick(q, Value.integer(1)));
    }

    @Test
    void scalars_have_nothing_to_pick() {
        BadSelectorException ex = assertThrows(BadSelectorException.class,
                () -> paths.pick(Value.integer(3), Value.integer(1)));
        assertEquals("Cannot pick 1", ex.getMessage());
    }

    @Test
    void huge_block_index_is_a_miss_not_a_wrapped_item() {
        Value blk = Value.block(Value.integer(10), Value.integer(20));

        assertTrue(paths.pick(blk, Value.integer(4294967297L)).isNull());
        assertTrue(paths.pick(blk, Value.integer(Long.MIN_VALUE)).isNull());
        assertThrows(BadSelectorException.class,
                () -> paths.poke(blk, Value.integer(4294967297L), Value.integer(1)));
        assertEquals(Value.integer(10), blk.asList().get(0));
    }
}
