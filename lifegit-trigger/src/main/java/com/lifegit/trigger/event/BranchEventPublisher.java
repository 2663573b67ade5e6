package com.lifegit.trigger.event;

import com.lifegit.types.enums.BranchEventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 分支事件发布器：进程内按分支分发。
 * <p>
 * 处于事务中时在提交之后分发，回滚的变更不会通知订阅方。
 * </p>
 */
@Slf4j
@Component
public class BranchEventPublisher {

    private final ConcurrentMap<Long, ConcurrentMap<String, Consumer<BranchEvent>>> subscribersByBranch;
    private final AtomicLong eventSequence;

    public BranchEventPublisher() {
        this.subscribersByBranch = new ConcurrentHashMap<>();
        this.eventSequence = new AtomicLong(0);
    }

    public BranchEvent publish(BranchEventTypeEnum eventType, Long branchId, Map<String, Object> payload) {
        BranchEvent event = BranchEvent.builder()
                .eventId(eventSequence.incrementAndGet())
                .eventType(eventType)
                .branchId(branchId)
                .payload(payload == null ? Collections.emptyMap() : new HashMap<>(payload))
                .occurredAt(LocalDateTime.now())
                .build();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(event);
                }
            });
        } else {
            dispatch(event);
        }
        return event;
    }

    /**
     * 订阅分支事件，返回订阅 ID，用于取消订阅。
     */
    public String subscribe(Long branchId, Consumer<BranchEvent> consumer) {
        String subscriberId = UUID.randomUUID().toString();
        subscribe(branchId, subscriberId, consumer);
        return subscriberId;
    }

    public void subscribe(Long branchId, String subscriberId, Consumer<BranchEvent> consumer) {
        if (branchId == null || subscriberId == null || consumer == null) {
            return;
        }
        subscribersByBranch.computeIfAbsent(branchId, key -> new ConcurrentHashMap<>()).put(subscriberId, consumer);
    }

    public void unsubscribe(Long branchId, String subscriberId) {
        if (branchId == null || subscriberId == null) {
            return;
        }
        ConcurrentMap<String, Consumer<BranchEvent>> subscribers = subscribersByBranch.get(branchId);
        if (subscribers == null) {
            return;
        }
        subscribers.remove(subscriberId);
        if (subscribers.isEmpty()) {
            subscribersByBranch.remove(branchId, subscribers);
        }
    }

    public int subscriberCount(Long branchId) {
        ConcurrentMap<String, Consumer<BranchEvent>> subscribers = branchId == null ? null : subscribersByBranch.get(branchId);
        return subscribers == null ? 0 : subscribers.size();
    }

    private void dispatch(BranchEvent event) {
        if (event == null || event.getBranchId() == null) {
            return;
        }
        ConcurrentMap<String, Consumer<BranchEvent>> subscribers = subscribersByBranch.get(event.getBranchId());
        if (subscribers == null || subscribers.isEmpty()) {
            return;
        }
        for (Map.Entry<String, Consumer<BranchEvent>> entry : subscribers.entrySet()) {
            try {
                entry.getValue().accept(event);
            } catch (Exception ex) {
                log.warn("BRANCH_EVENT_DISPATCH_FAILED branchId={}, subscriberId={}, eventType={}, reason={}",
                        event.getBranchId(), entry.getKey(), event.getEventType(), ex.getMessage());
            }
        }
    }
}
