package com.nosota.groupbuy.error;

public class NoRewardException extends LedgerException {
    public NoRewardException(String message) {
        super(ErrorKind.NO_REWARD, message);
    }
}
