package com.vidnyan.vbuilder.domain.model;

/**
 * Declared direction of a module port.
 */
public enum PortDirection {
    INPUT("input"),
    OUTPUT("output"),
    INOUT("inout");

    private final String keyword;

    PortDirection(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Directionality rule: input ports take input or wire connections,
     * output ports take output or wire, inout ports take anything.
     */
    public boolean accepts(ConnectionKind kind) {
        return switch (this) {
            case INPUT -> kind != ConnectionKind.OUTPUT;
            case OUTPUT -> kind != ConnectionKind.INPUT;
            case INOUT -> true;
        };
    }

    public static boolean isKeyword(String value) {
        return fromKeyword(value) != null;
    }

    /**
     * Returns the direction for a keyword, or null when the text is not one.
     */
    public static PortDirection fromKeyword(String value) {
        if (value == null) {
            return null;
        }
        for (PortDirection dir : values()) {
            if (dir.keyword.equals(value)) {
                return dir;
            }
        }
        return null;
    }
}
