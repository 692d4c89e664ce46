package com.vidnyan.vbuilder.domain.model;

import java.util.List;

/**
 * A module parameter. The default value is kept as unevaluated text.
 * Local parameters are recorded for display but cannot be overridden.
 */
public record Parameter(
    String name,
    String type,
    String defaultValue,
    List<WidthSpec> dimensions,
    boolean local
) {

    public Parameter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name is required");
        }
        type = type == null || type.isBlank() ? null : type;
        defaultValue = defaultValue == null ? "" : defaultValue;
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }

    public static Parameter of(String name, String defaultValue) {
        return new Parameter(name, null, defaultValue, List.of(), false);
    }

    public boolean isOverridable() {
        return !local;
    }

    /**
     * Declared type, or a guess from the default value when untyped.
     */
    public String typeOrInferred() {
        if (type != null) {
            return type;
        }
        if (!defaultValue.isEmpty() && Character.isDigit(defaultValue.charAt(0))) {
            return "int";
        }
        if (defaultValue.startsWith("\"")) {
            return "string";
        }
        return "value";
    }
}
