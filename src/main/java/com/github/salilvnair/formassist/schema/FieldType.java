package com.github.salilvnair.formassist.schema;

public enum FieldType {
    STRING("string"),
    INTEGER("integer"),
    ENUM("enum"),
    DATE("date"),
    STRING_LIST("list of strings");

    private final String displayName;

    FieldType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
