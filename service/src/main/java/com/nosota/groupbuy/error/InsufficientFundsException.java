package com.nosota.groupbuy.error;

public class InsufficientFundsException extends LedgerException {
    public InsufficientFundsException(String message) {
        super(ErrorKind.INSUFFICIENT_FUNDS, message);
    }
}
