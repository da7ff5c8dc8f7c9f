package com.flagship.fx_ledger.ledger;

/**
 * Kind of money movement recorded by a ledger entry.
 */
public enum EntryKind {
    FUNDING,
    TRANSFER,
    TRADE
}
