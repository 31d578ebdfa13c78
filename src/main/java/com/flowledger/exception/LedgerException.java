package com.flowledger.exception;

/**
 * A run ledger write failed. Fatal to the current attempt's bookkeeping;
 * propagated to the caller rather than dropped.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
