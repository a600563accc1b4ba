import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.bindscript.script.errors.UnhandledTypeException;
import com.bindscript.script.hooks.CoreHooks;
import com.bindscript.script.path.HookRegistry;
import com.bindscript.script.path.HookResult;
import com.bindscript.script.path.HookSet;
import com.bindscript.script.path.PathDispatcher;
import com.bindscript.script.runtime.Value;

public class HookRegistryTest {

    @Test
    void fresh_registry_fails_builtins_and_stubs_extensions() {
        HookRegistry r = new HookRegistry();

        assertSame(HookRegistry.FAIL, r.hookFor(Value.Type.BLOCK));
        assertSame(HookRegistry.UNHOOKED, r.hookFor(Value.Type.IMAGE));
        assertFalse(r.isLoaded(Value.Type.VECTOR));
        assertSame(HookRegistry.UNHOOKED, r.hookFor(Value.custom("money", 1)));
    }

    @Test
    void extension_kind_works_once_its_hook_set_is_loaded() {
        HookRegistry r = CoreHooks.registry(false);
        PathDispatcher paths = new PathDispatcher(r, null);
        Value img = Value.extension(Value.Type.IMAGE, new int[] { 640, 480 });

        UnhandledTypeException ex = assertThrows(UnhandledTypeException.class,
                () -> paths.pick(img, Value.integer(1)));
        assertTrue(ex.getMessage().contains("IMAGE"));

        HookSet images = new HookSet("image").hook(Value.Type.IMAGE, (state, picker, setValue) -> {
            int[] size = (int[]) state.out().value;
            return HookResult.value(Value.integer(size[(int) picker.asInteger() - 1]));
        });
        r.load(images);

        assertTrue(r.isLoaded(Value.Type.IMAGE));
        assertEquals(Value.integer(480), paths.pick(img, Value.integer(2)));

        r.unload(images);
        assertThrows(UnhandledTypeException.class, () -> paths.pick(img, Value.integer(1)));
    }

    @Test
    void loading_over_a_live_hook_fails_and_installs_nothing() {
        HookRegistry r = CoreHooks.registry(false);
        HookSet bad = new HookSet("bad")
                .hook(Value.Type.VECTOR, HookRegistry.FAIL)
                .hook(Value.Type.BLOCK, HookRegistry.FAIL);

        assertThrows(IllegalStateException.class, () -> r.load(bad));
        assertFalse(r.isLoaded(Value.Type.VECTOR));

        HookSet vectors = new HookSet("vec").hook(Value.Type.VECTOR, HookRegistry.FAIL);
        r.load(vectors);
        assertThrows(IllegalStateException.class, () -> r.load(vectors));
    }

    @Test
    void custom_values_dispatch_on_their_type_name() {
        HookRegistry r = CoreHooks.registry(false);
        PathDispatcher paths = new PathDispatcher(r, null);
        List<String> calls = new ArrayList<>();

        r.load(new HookSet("money").custom("money", (state, picker, setValue) -> {
            calls.add(picker.toString());
            return HookResult.value(Value.text("USD"));
        }));

        assertEquals(Value.text("USD"), paths.pick(Value.custom("money", 12), Value.integer(1)));
        assertEquals(List.of("1"), calls);
        assertThrows(UnhandledTypeException.class, () -> paths.pick(Value.custom("other", 1), Value.integer(1)));
        assertTrue(r.isLoaded("money"));
    }

    @Test
    void thrown_outcome_is_rethrown_as_is() {
        HookRegistry r = CoreHooks.registry(false);
        IllegalStateException boom = new IllegalStateException("boom");
        r.load(new HookSet("boom").custom("boom", (state, picker, setValue) -> HookResult.thrown(boom)));

        IllegalStateException got = assertThrows(IllegalStateException.class,
                () -> new PathDispatcher(r, null).pick(Value.custom("boom", null), Value.integer(1)));
        assertSame(boom, got);
    }

    @Test
    void custom_hooks_cannot_be_registered_by_kind() {
        assertThrows(IllegalArgumentException.class,
                () -> new HookSet("x").hook(Value.Type.CUSTOM, HookRegistry.FAIL));
    }
}
