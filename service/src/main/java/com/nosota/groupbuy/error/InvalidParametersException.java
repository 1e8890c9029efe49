package com.nosota.groupbuy.error;

public class InvalidParametersException extends LedgerException {
    public InvalidParametersException(String message) {
        super(ErrorKind.INVALID_PARAMETERS, message);
    }
}
