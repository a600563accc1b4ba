package com.bindscript.script;

import java.io.IOException;
import java.io.InputStream;

import com.bindscript.debug.Debug;
import com.bindscript.debug.DebugLevel;
import com.bindscript.script.errors.BindScriptException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Engine settings, read from {@code bindscript.json} on the classpath.
 *
 * Missing keys keep their defaults; unknown keys are ignored.
 */
public final class RuntimeConfig {

    public static final String RESOURCE = "bindscript.json";

    private static final String TAG = "bindscript.config";
    private static final ObjectMapper om = new ObjectMapper();

    private int maxCallDepth = 64;
    private boolean strictLookup = false;
    private boolean allowPathGroups = true;
    private boolean pushRefinements = false;
    private DebugLevel debugLevel = DebugLevel.INFO;

    public static RuntimeConfig defaults() {
        return new RuntimeConfig();
    }

    /** Classpath {@link #RESOURCE}, or defaults when there is none. */
    public static RuntimeConfig load() {
        return load(RuntimeConfig.class.getClassLoader(), RESOURCE);
    }

    public static RuntimeConfig load(ClassLoader loader, String resource) {
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                Debug.get().d(TAG, resource + " not found, using defaults");
                return defaults();
            }
            RuntimeConfig cfg = fromTree(om.readTree(in));
            Debug.get().d(TAG, "loaded " + resource + ": " + cfg.toJson());
            return cfg;
        } catch (IOException e) {
            throw new BindScriptException("Cannot read configuration " + resource, e);
        }
    }

    public static RuntimeConfig fromJson(String json) {
        try {
            return fromTree(om.readTree(json));
        } catch (IOException e) {
            throw new BindScriptException("Invalid configuration JSON", e);
        }
    }

    public static RuntimeConfig fromTree(JsonNode root) {
        RuntimeConfig cfg = new RuntimeConfig();
        if (root == null || root.isMissingNode() || root.isNull()) return cfg;
        if (!root.isObject()) {
            throw new BindScriptException("Configuration must be a JSON object");
        }

        JsonNode n = root.path("maxCallDepth");
        if (!n.isMissingNode()) {
            if (!n.canConvertToInt() || n.asInt() < 1) {
                throw new BindScriptException("maxCallDepth must be a positive integer, got " + n);
            }
            cfg.maxCallDepth = n.asInt();
        }
        cfg.strictLookup = root.path("strictLookup").asBoolean(cfg.strictLookup);
        cfg.allowPathGroups = root.path("allowPathGroups").asBoolean(cfg.allowPathGroups);
        cfg.pushRefinements = root.path("pushRefinements").asBoolean(cfg.pushRefinements);
        cfg.debugLevel = DebugLevel.parse(root.path("debugLevel").asText(null), cfg.debugLevel);
        return cfg;
    }

    public ObjectNode toJson() {
        ObjectNode n = om.createObjectNode();
        n.put("maxCallDepth", maxCallDepth);
        n.put("strictLookup", strictLookup);
        n.put("allowPathGroups", allowPathGroups);
        n.put("pushRefinements", pushRefinements);
        n.put("debugLevel", debugLevel.name());
        return n;
    }

    public int maxCallDepth() { return maxCallDepth; }

    public boolean strictLookup() { return strictLookup; }

    public boolean allowPathGroups() { return allowPathGroups; }

    public boolean pushRefinements() { return pushRefinements; }

    public DebugLevel debugLevel() { return debugLevel; }

    public RuntimeConfig maxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be positive");
        this.maxCallDepth = depth;
        return this;
    }

    public RuntimeConfig strictLookup(boolean on) { this.strictLookup = on; return this; }

    public RuntimeConfig allowPathGroups(boolean on) { this.allowPathGroups = on; return this; }

    public RuntimeConfig pushRefinements(boolean on) { this.pushRefinements = on; return this; }

    public RuntimeConfig debugLevel(DebugLevel level) {
        this.debugLevel = (level == null) ? DebugLevel.INFO : level;
        return this;
    }
}
