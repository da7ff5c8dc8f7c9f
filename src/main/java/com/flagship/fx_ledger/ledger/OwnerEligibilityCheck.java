package com.flagship.fx_ledger.ledger;

/**
 * Decides whether an owner may take part in ledger operations.
 */
public interface OwnerEligibilityCheck {

    /**
     * True when the owner may act on their wallet (registered and verified).
     */
    boolean isEligible(String ownerId);

    /**
     * True when the owner is known to the wallet, verified or not. Transfer
     * recipients only have to be registered.
     */
    boolean isRegistered(String ownerId);
}
