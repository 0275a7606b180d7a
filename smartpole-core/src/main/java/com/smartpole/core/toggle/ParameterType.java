package com.smartpole.core.toggle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ParameterType {
    BOOLEAN("boolean"),
    ENUM("enum"),
    INTEGER("integer");

    private final String value;

    ParameterType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ParameterType fromValue(String value) {
        for (ParameterType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的参数类型: " + value);
    }
}
