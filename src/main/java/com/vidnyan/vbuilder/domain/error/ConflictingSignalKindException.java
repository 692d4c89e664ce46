package com.vidnyan.vbuilder.domain.error;

import com.vidnyan.vbuilder.domain.model.ConnectionKind;

/**
 * The same top-level signal is used with different connection kinds.
 */
public class ConflictingSignalKindException extends DesignException {

    private final String signal;

    public ConflictingSignalKindException(String signal, ConnectionKind first, String firstUse,
                                          ConnectionKind second, String secondUse) {
        super(ErrorKind.CONFLICTING_SIGNAL_KIND, String.format(
                "Signal '%s' is used as %s by %s and as %s by %s",
                signal, first.keyword(), firstUse, second.keyword(), secondUse));
        this.signal = signal;
    }

    public String signal() {
        return signal;
    }
}
