package com.lifegit.test;

import com.lifegit.trigger.event.BranchEvent;
import com.lifegit.trigger.event.BranchEventPublisher;
import com.lifegit.types.enums.BranchEventTypeEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class BranchEventPublisherTest {

    private final BranchEventPublisher publisher = new BranchEventPublisher();

    @AfterEach
    public void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    public void shouldDispatchOnlyToSubscribersOfTheBranch() {
        List<BranchEvent> first = new ArrayList<>();
        List<BranchEvent> second = new ArrayList<>();
        publisher.subscribe(1L, first::add);
        publisher.subscribe(2L, second::add);

        BranchEvent event = publisher.publish(BranchEventTypeEnum.BRANCH_COMPLETED, 1L, Map.of("status", "completed"));

        Assertions.assertEquals(1, first.size());
        Assertions.assertSame(event, first.get(0));
        Assertions.assertTrue(second.isEmpty());
        Assertions.assertNotNull(event.getOccurredAt());
    }

    @Test
    public void shouldAssignIncreasingEventIds() {
        BranchEvent first = publisher.publish(BranchEventTypeEnum.PLAN_UPDATED, 1L, null);
        BranchEvent second = publisher.publish(BranchEventTypeEnum.PLAN_UPDATED, 1L, null);

        Assertions.assertTrue(second.getEventId() > first.getEventId());
        Assertions.assertTrue(first.getPayload().isEmpty());
    }

    @Test
    public void shouldKeepDispatchingWhenOneSubscriberFails() {
        List<BranchEvent> received = new ArrayList<>();
        publisher.subscribe(1L, "broken", event -> {
            throw new IllegalStateException("subscriber down");
        });
        publisher.subscribe(1L, "healthy", received::add);

        publisher.publish(BranchEventTypeEnum.COMMIT_CREATED, 1L, Map.of());

        Assertions.assertEquals(1, received.size());
    }

    @Test
    public void shouldStopDispatchingAfterUnsubscribe() {
        List<BranchEvent> received = new ArrayList<>();
        String subscriberId = publisher.subscribe(1L, received::add);
        Assertions.assertEquals(1, publisher.subscriberCount(1L));

        publisher.unsubscribe(1L, subscriberId);
        publisher.publish(BranchEventTypeEnum.BRANCH_DELETED, 1L, Map.of());

        Assertions.assertTrue(received.isEmpty());
        Assertions.assertEquals(0, publisher.subscriberCount(1L));
    }

    @Test
    public void shouldDeferDispatchUntilTransactionCommits() {
        List<BranchEvent> received = new ArrayList<>();
        publisher.subscribe(1L, received::add);
        TransactionSynchronizationManager.initSynchronization();

        publisher.publish(BranchEventTypeEnum.BRANCH_MERGED, 1L, Map.of());
        Assertions.assertTrue(received.isEmpty());

        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        synchronizations.forEach(TransactionSynchronization::afterCommit);
        Assertions.assertEquals(1, received.size());
        Assertions.assertEquals(BranchEventTypeEnum.BRANCH_MERGED, received.get(0).getEventType());
    }
}
