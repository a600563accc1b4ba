package com.bindscript.script.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.bindscript.script.context.Context;
import com.bindscript.script.context.Symbol;

public class Value {
    public enum Type {
        NULL, UNSET, BLANK, LOGIC, INTEGER, DECIMAL, TEXT,
        WORD, SET_WORD, GET_WORD, REFINEMENT,
        BLOCK, GROUP, PATH, SET_PATH, QUOTED,
        PAIR, MAP,
        OBJECT, MODULE, ERROR, FRAME,
        ACTION,
        // provided by hook sets loaded at runtime
        IMAGE, VECTOR, STRUCT, CUSTOM
    }

    private static final Value NULLED = new Value(Type.NULL, null);
    private static final Value UNSET = new Value(Type.UNSET, null);
    private static final Value BLANK = new Value(Type.BLANK, null);

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    /** Soft miss: "no value". */
    public static Value nulled() { return NULLED; }

    /** Variable created but never assigned. */
    public static Value unset() { return UNSET; }

    public static Value blank() { return BLANK; }

    public static Value logic(boolean b) { return new Value(Type.LOGIC, b); }
    public static Value integer(long i) { return new Value(Type.INTEGER, i); }
    public static Value decimal(double d) { return new Value(Type.DECIMAL, d); }
    public static Value text(String s) { return new Value(Type.TEXT, s); }

    public static Value word(Symbol s) { return new Value(Type.WORD, new Word(s)); }
    public static Value setWord(Symbol s) { return new Value(Type.SET_WORD, new Word(s)); }
    public static Value getWord(Symbol s) { return new Value(Type.GET_WORD, new Word(s)); }
    public static Value refinement(Symbol s) { return new Value(Type.REFINEMENT, new Word(s)); }

    public static Value word(Type type, Word w) {
        if (!isWordType(type)) throw new IllegalArgumentException("Not a word kind: " + type);
        return new Value(type, w);
    }

    public static Value block(List<Value> items) { return new Value(Type.BLOCK, items); }
    public static Value group(List<Value> items) { return new Value(Type.GROUP, items); }
    public static Value path(List<Value> items) { return new Value(Type.PATH, items); }
    public static Value setPath(List<Value> items) { return new Value(Type.SET_PATH, items); }

    public static Value block(Value... items) { return block(new ArrayList<>(List.of(items))); }
    public static Value group(Value... items) { return group(new ArrayList<>(List.of(items))); }

    public static Value quoted(Value inner) { return new Value(Type.QUOTED, inner); }
    public static Value pair(Value x, Value y) { return new Value(Type.PAIR, new Pair(x, y)); }
    public static Value pair(long x, long y) { return pair(integer(x), integer(y)); }
    public static Value map(Map<String, Value> m) { return new Value(Type.MAP, m); }
    public static Value action(ActionValue a) { return new Value(Type.ACTION, a); }
    public static Value custom(String typeName, Object payload) { return new Value(Type.CUSTOM, new CustomValue(typeName, payload)); }

    public static Value extension(Type type, Object payload) {
        if (type != Type.IMAGE && type != Type.VECTOR && type != Type.STRUCT) {
            throw new IllegalArgumentException("Not an extension kind: " + type);
        }
        return new Value(type, payload);
    }

    /** The root value of a context. */
    public static Value context(Context c) { return c.archetype(); }

    public static boolean isContextType(Type t) {
        return t == Type.OBJECT || t == Type.MODULE || t == Type.ERROR || t == Type.FRAME;
    }

    public static boolean isWordType(Type t) {
        return t == Type.WORD || t == Type.SET_WORD || t == Type.GET_WORD || t == Type.REFINEMENT;
    }

    public static boolean isListType(Type t) {
        return t == Type.BLOCK || t == Type.GROUP || t == Type.PATH || t == Type.SET_PATH;
    }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }
    public boolean isUnset() { return type == Type.UNSET; }
    public boolean isBlank() { return type == Type.BLANK; }
    public boolean isWord() { return isWordType(type); }
    public boolean isList() { return isListType(type); }
    public boolean isContext() { return isContextType(type); }
    public boolean isAction() { return type == Type.ACTION; }

    public boolean asLogic() {
        if (type != Type.LOGIC) throw new RuntimeException("Expected logic, got " + type);
        return (boolean) value;
    }

    public long asInteger() {
        if (type != Type.INTEGER) throw new RuntimeException("Expected integer, got " + type);
        return (long) value;
    }

    public double asDecimal() {
        if (type != Type.DECIMAL) throw new RuntimeException("Expected decimal, got " + type);
        return (double) value;
    }

    /** Integer or decimal as a double. */
    public double asNumber() {
        if (type == Type.INTEGER) return (long) value;
        if (type == Type.DECIMAL) return (double) value;
        throw new RuntimeException("Expected number, got " + type);
    }

    public String asText() {
        if (type != Type.TEXT) throw new RuntimeException("Expected text, got " + type);
        return (String) value;
    }

    public Word asWord() {
        if (!isWord()) throw new RuntimeException("Expected word, got " + type);
        return (Word) value;
    }

    public Symbol asSymbol() {
        return asWord().symbol();
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (!isList()) throw new RuntimeException("Expected block, group or path, got " + type);
        return (List<Value>) value;
    }

    public Value asQuoted() {
        if (type != Type.QUOTED) throw new RuntimeException("Expected quoted, got " + type);
        return (Value) value;
    }

    public Pair asPair() {
        if (type != Type.PAIR) throw new RuntimeException("Expected pair, got " + type);
        return (Pair) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asMap() {
        if (type != Type.MAP) throw new RuntimeException("Expected map, got " + type);
        return (Map<String, Value>) value;
    }

    public Context asContext() {
        if (!isContext()) throw new RuntimeException("Expected context, got " + type);
        return (Context) value;
    }

    public ActionValue asAction() {
        if (type != Type.ACTION) throw new RuntimeException("Expected action, got " + type);
        return (ActionValue) value;
    }

    public CustomValue asCustom() {
        if (type != Type.CUSTOM) throw new RuntimeException("Expected custom value, got " + type);
        return (CustomValue) value;
    }

    /*
     * Central point: how values get copied when a context inherits from or
     * merges with another. Series and words are copied (words keep their
     * binding until rebound); contexts, actions and immutable scalars are
     * shared.
     */
    public Value cloneDeep() {
        switch (type) {
            case WORD:
            case SET_WORD:
            case GET_WORD:
            case REFINEMENT:
                return new Value(type, asWord().copy());

            case BLOCK:
            case GROUP:
            case PATH:
            case SET_PATH: {
                List<Value> src = asList();
                List<Value> out = new ArrayList<>(src.size());
                for (Value item : src) out.add(item == null ? NULLED : item.cloneDeep());
                return new Value(type, out);
            }

            case QUOTED:
                return quoted(asQuoted().cloneDeep());

            case MAP: {
                Map<String, Value> src = asMap();
                Map<String, Value> out = new LinkedHashMap<>();
                for (Map.Entry<String, Value> e : src.entrySet()) {
                    Value v = e.getValue();
                    out.put(e.getKey(), v == null ? NULLED : v.cloneDeep());
                }
                return map(out);
            }

            default:
                return this;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case WORD:
            case SET_WORD:
            case GET_WORD:
            case REFINEMENT:
                return asSymbol().sameAs(other.asSymbol(), false);
            case OBJECT:
            case MODULE:
            case ERROR:
            case FRAME:
            case ACTION:
                return value == other.value;
            default:
                return Objects.equals(value, other.value);
        }
    }

    @Override
    public int hashCode() {
        if (isWord()) return asSymbol().canon().hashCode();
        if (isContext() || isAction()) return System.identityHashCode(value);
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case NULL:
                return "null";
            case UNSET:
                return "~unset~";
            case BLANK:
                return "_";
            case LOGIC:
            case INTEGER:
            case DECIMAL:
                return String.valueOf(value);
            case TEXT:
                return '"' + asText() + '"';
            case WORD:
                return asWord().toString();
            case SET_WORD:
                return asWord() + ":";
            case GET_WORD:
                return ":" + asWord();
            case REFINEMENT:
                return "/" + asWord();
            case BLOCK:
                return "[" + join(asList(), " ") + "]";
            case GROUP:
                return "(" + join(asList(), " ") + ")";
            case PATH:
                return join(asList(), "/");
            case SET_PATH:
                return join(asList(), "/") + ":";
            case QUOTED:
                return "'" + asQuoted();
            case PAIR:
                return asPair().toString();
            case MAP:
                return "make map! " + asMap();
            case ACTION:
                return asAction().toString();
            case OBJECT:
            case MODULE:
            case ERROR:
            case FRAME:
                return asContext().toString();
            default:
                return "#[" + type.name().toLowerCase(Locale.ROOT) + "]";
        }
    }

    private static String join(List<Value> items, String sep) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(sep);
            Value v = items.get(i);
            if (v.type == Type.BLANK && sep.equals("/")) continue;
            sb.append(v);
        }
        return sb.toString();
    }
}
