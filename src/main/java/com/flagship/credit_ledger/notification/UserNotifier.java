package com.flagship.credit_ledger.notification;

/**
 * Hands an outcome to the bot front-end.
 *
 * Delivery is asynchronous. A failed or slow delivery never rolls back the
 * ledger change the notification describes.
 */
public interface UserNotifier {

    void notify(UserNotification notification);
}
