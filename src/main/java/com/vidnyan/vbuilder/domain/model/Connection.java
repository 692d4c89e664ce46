package com.vidnyan.vbuilder.domain.model;

/**
 * Binding of one instance port to a top-level signal.
 * An unset connection has neither kind nor signal; a set one has both.
 */
public record Connection(
    ConnectionKind kind,
    String signal
) {

    public static final Connection UNSET = new Connection(null, null);

    public Connection {
        if (kind == null && signal != null) {
            throw new IllegalArgumentException("An unset connection cannot carry a signal");
        }
        if (kind != null && (signal == null || signal.isBlank())) {
            throw new IllegalArgumentException("A " + kind.keyword() + " connection needs a signal name");
        }
    }

    public static Connection of(ConnectionKind kind, String signal) {
        return new Connection(kind, signal);
    }

    public boolean isSet() {
        return kind != null;
    }
}
