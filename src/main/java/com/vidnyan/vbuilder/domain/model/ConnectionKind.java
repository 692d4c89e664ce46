package com.vidnyan.vbuilder.domain.model;

/**
 * How an instance port is bound at the top level.
 * INPUT and OUTPUT become ports of the generated module, WIRE an internal net.
 */
public enum ConnectionKind {
    INPUT("input"),
    OUTPUT("output"),
    WIRE("wire");

    private final String keyword;

    ConnectionKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static ConnectionKind fromKeyword(String value) {
        for (ConnectionKind kind : values()) {
            if (kind.keyword.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown connection kind: " + value);
    }
}
