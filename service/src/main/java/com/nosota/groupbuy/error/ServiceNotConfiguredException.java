package com.nosota.groupbuy.error;

public class ServiceNotConfiguredException extends LedgerException {
    public ServiceNotConfiguredException(String message) {
        super(ErrorKind.SERVICE_NOT_CONFIGURED, message);
    }
}
