package com.nosota.groupbuy.error;

public class StateConflictException extends LedgerException {
    public StateConflictException(String message) {
        super(ErrorKind.STATE_CONFLICT, message);
    }
}
