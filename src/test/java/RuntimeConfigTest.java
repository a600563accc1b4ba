import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.bindscript.debug.DebugLevel;
import com.bindscript.script.BindScript;
import com.bindscript.script.RuntimeConfig;
import com.bindscript.script.errors.BadSelectorException;
import com.bindscript.script.errors.BindScriptException;
import com.bindscript.script.path.PathFlags;
import com.bindscript.script.runtime.Value;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class RuntimeConfigTest {

    @Test
    void defaults_when_nothing_is_set() {
        RuntimeConfig cfg = RuntimeConfig.fromJson("{}");

        assertEquals(64, cfg.maxCallDepth());
        assertFalse(cfg.strictLookup());
        assertTrue(cfg.allowPathGroups());
        assertFalse(cfg.pushRefinements());
        assertEquals(DebugLevel.INFO, cfg.debugLevel());
    }

    @Test
    void classpath_resource_is_read() {
        RuntimeConfig cfg = RuntimeConfig.load();
        assertEquals(64, cfg.maxCallDepth());

        RuntimeConfig strict = RuntimeConfig.load(getClass().getClassLoader(), "bindscript-strict.json");
        assertEquals(12, strict.maxCallDepth());
        assertTrue(strict.strictLookup());
        assertFalse(strict.allowPathGroups());
        assertEquals(DebugLevel.WARN, strict.debugLevel());
    }

    @Test
    void missing_resource_falls_back_to_defaults() {
        RuntimeConfig cfg = RuntimeConfig.load(getClass().getClassLoader(), "no-such-file.json");
        assertEquals(64, cfg.maxCallDepth());
    }

    @Test
    void bad_input_is_rejected() {
        assertThrows(BindScriptException.class, () -> RuntimeConfig.fromJson("{ not json"));
        assertThrows(BindScriptException.class, () -> RuntimeConfig.fromJson("[1, 2]"));
        assertThrows(BindScriptException.class, () -> RuntimeConfig.fromJson("{\"maxCallDepth\": 0}"));
        assertThrows(BindScriptException.class, () -> RuntimeConfig.fromJson("{\"maxCallDepth\": \"deep\"}"));
    }

    @Test
    void unknown_debug_level_keeps_the_default() {
        assertEquals(DebugLevel.INFO, RuntimeConfig.fromJson("{\"debugLevel\": \"LOUD\"}").debugLevel());
    }

    @Test
    void toJson_reflects_the_settings() {
        ObjectNode n = RuntimeConfig.defaults().maxCallDepth(5).pushRefinements(true).toJson();

        assertEquals(5, n.get("maxCallDepth").asInt());
        assertTrue(n.get("pushRefinements").asBoolean());
        assertEquals("INFO", n.get("debugLevel").asText());
    }

    @Test
    void engine_honors_path_group_setting() {
        BindScript es = new BindScript(RuntimeConfig.defaults().allowPathGroups(false));
        assertEquals(PathFlags.NO_PATH_GROUPS, es.pathFlags());

        Value blk = Value.block(Value.integer(1));
        Value p = es.path(blk, Value.group(Value.integer(1)));
        assertThrows(BadSelectorException.class, () -> es.get(p));

        BindScript open = new BindScript(RuntimeConfig.defaults());
        assertEquals(Value.integer(1), open.get(open.path(blk, Value.group(Value.integer(1)))));
    }
}
