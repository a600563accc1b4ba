package com.bindscript.protocol.util;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import com.bindscript.script.context.Context;
import com.bindscript.script.context.Contexts;
import com.bindscript.script.context.Key;
import com.bindscript.script.errors.BindScriptException;
import com.bindscript.script.runtime.Value;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON rendering of contexts for debugging and host export.
 *
 * Only visible keys are written. A context reached again while it is being
 * written becomes the string {@code "<cycle>"}. Kinds with no JSON
 * counterpart are written in their molded text form.
 */
public final class ContextJson {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    private ContextJson() {}

    /** {"kind": "object", "vars": {...}} */
    public static ObjectNode toJson(Context context) {
        return contextNode(context, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    public static JsonNode toJson(Value value) {
        return valueNode(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    public static String toJsonString(Context context) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(context));
        } catch (JsonProcessingException e) {
            throw new BindScriptException("Cannot render context as JSON", e);
        }
    }

    private static ObjectNode contextNode(Context context, Set<Context> active) {
        ObjectNode n = F.objectNode();
        n.put("kind", context.kind().name().toLowerCase(java.util.Locale.ROOT));
        ObjectNode vars = n.putObject("vars");

        active.add(context);
        try {
            for (int i = 1; i <= context.length(); i++) {
                Key key = context.key(i);
                if (!Contexts.visibility().isVisible(context, key)) continue;
                vars.set(key.symbol().spelling(), valueNode(context.get(i), active));
            }
        } finally {
            active.remove(context);
        }
        return n;
    }

    private static JsonNode valueNode(Value v, Set<Context> active) {
        switch (v.getType()) {
            case NULL:
            case UNSET:
                return F.nullNode();
            case LOGIC:
                return F.booleanNode(v.asLogic());
            case INTEGER:
                return F.numberNode(v.asInteger());
            case DECIMAL:
                return F.numberNode(v.asDecimal());
            case TEXT:
                return F.textNode(v.asText());

            case BLOCK:
            case GROUP: {
                ArrayNode arr = F.arrayNode();
                for (Value item : v.asList()) arr.add(valueNode(item, active));
                return arr;
            }

            case MAP: {
                ObjectNode obj = F.objectNode();
                for (Map.Entry<String, Value> e : v.asMap().entrySet()) {
                    obj.set(e.getKey(), valueNode(e.getValue(), active));
                }
                return obj;
            }

            case OBJECT:
            case MODULE:
            case ERROR:
            case FRAME: {
                Context c = v.asContext();
                if (active.contains(c)) return F.textNode("<cycle>");
                return contextNode(c, active);
            }

            default:
                return F.textNode(v.toString());
        }
    }
}
