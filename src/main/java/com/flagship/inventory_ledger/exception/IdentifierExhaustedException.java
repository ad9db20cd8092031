package com.flagship.inventory_ledger.exception;

/**
 * No free identifier could be generated within the configured number of attempts.
 */
public class IdentifierExhaustedException extends RuntimeException {

    public IdentifierExhaustedException(String prefix, int attempts) {
        super(String.format("Unable to generate a unique %s identifier after %d attempts", prefix, attempts));
    }
}
