package com.bindscript.script.runtime;

/** Payload of a CUSTOM value: dispatch keys off {@link #typeName()}. */
public final class CustomValue {

    private final String typeName;
    private final Object payload;

    public CustomValue(String typeName, Object payload) {
        if (typeName == null || typeName.isEmpty()) throw new IllegalArgumentException("Custom type name required");
        this.typeName = typeName;
        this.payload = payload;
    }

    public String typeName() { return typeName; }

    public Object payload() { return payload; }

    @Override
    public String toString() {
        return "#[" + typeName + "]";
    }
}
