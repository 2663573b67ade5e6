package com.lifegit.domain.commit.model.valobj;

import com.lifegit.types.enums.CommitTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * 分支提交统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitStatistics {

    private Long branchId;

    private Long totalCount;

    /**
     * 各类型提交数，只包含出现过的类型
     */
    @Builder.Default
    private Map<CommitTypeEnum, Long> countByType = new EnumMap<>(CommitTypeEnum.class);

    private LocalDateTime firstCommitAt;

    private LocalDateTime lastCommitAt;
}
