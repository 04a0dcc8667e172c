package com.phasegate.core.ledger;

/**
 * Result of walking the hash chain.
 *
 * @param entriesChecked entries examined before the walk stopped
 * @param brokenAt       1-based line of the first bad entry, null when valid
 * @param reason         why the chain broke, null when valid
 */
public record LedgerVerification(
    boolean valid,
    int entriesChecked,
    Integer brokenAt,
    String reason
) {

    static LedgerVerification ok(int entriesChecked) {
        return new LedgerVerification(true, entriesChecked, null, null);
    }

    static LedgerVerification broken(int entriesChecked, int line, String reason) {
        return new LedgerVerification(false, entriesChecked, line, reason);
    }
}
