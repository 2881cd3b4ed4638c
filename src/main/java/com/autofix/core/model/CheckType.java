package com.autofix.core.model;

/**
 * Verification checks, each backed by a package script of the same name.
 */
public enum CheckType {
    LINT("lint"),
    TYPECHECK("typecheck"),
    TEST("test");

    private final String scriptName;

    CheckType(String scriptName) {
        this.scriptName = scriptName;
    }

    public String scriptName() {
        return scriptName;
    }

    public static CheckType fromName(String name) {
        for (CheckType type : values()) {
            if (type.scriptName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown check: " + name);
    }
}
