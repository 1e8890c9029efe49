package com.nosota.groupbuy.error;

public class DeadlineViolationException extends LedgerException {
    public DeadlineViolationException(String message) {
        super(ErrorKind.DEADLINE_VIOLATION, message);
    }
}
