package com.nosota.groupbuy.error;

public class UnauthorizedException extends LedgerException {
    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
