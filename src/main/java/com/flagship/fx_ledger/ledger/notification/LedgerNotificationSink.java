package com.flagship.fx_ledger.ledger.notification;

/**
 * Fire-and-forget delivery of ledger notifications.
 *
 * Implementations must not throw: a delivery failure never affects the ledger
 * operation that produced the notification.
 */
public interface LedgerNotificationSink {

    void publish(LedgerNotification notification);
}
