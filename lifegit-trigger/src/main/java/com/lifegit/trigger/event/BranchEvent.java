package com.lifegit.trigger.event;

import com.lifegit.types.enums.BranchEventTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 分支实时事件。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchEvent {

    private Long eventId;
    private BranchEventTypeEnum eventType;
    private Long branchId;
    private Map<String, Object> payload;
    private LocalDateTime occurredAt;
}
