package com.nosota.groupbuy.error;

import lombok.Getter;

/**
 * Base class of all ledger operation failures.
 *
 * <p>Unchecked so that the surrounding transaction is rolled back and no partial
 * state mutation or value transfer survives the failed operation.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
