package com.flagship.credit_ledger.notification;

import com.flagship.credit_ledger.outbox.AggregateTypes;
import com.flagship.credit_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Queues notifications in the outbox, in the caller's transaction. The publisher
 * relays them to the user-notifications topic after commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxUserNotifier implements UserNotifier {

    private final OutboxService outboxService;

    @Override
    public void notify(UserNotification notification) {
        outboxService.saveEvent(AggregateTypes.USER_NOTIFICATION, notification.getSubjectId(),
                notification.getEventType(), notification);
        log.debug("Queued {} notification for user {}", notification.getEventType(), notification.getUserId());
    }
}
