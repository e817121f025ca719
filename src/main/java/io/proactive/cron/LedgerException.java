package io.proactive.cron;

/**
 * The job ledger's underlying store failed (I/O, corruption, constraint violation).
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
