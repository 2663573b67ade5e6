package com.lifegit.types.enums;

/**
 * 分支事件类型枚举
 *
 * @author lifegit
 * @since 2025-01-29
 */
public enum BranchEventTypeEnum {

    BRANCH_CREATED,

    BRANCH_COMPLETED,

    BRANCH_ABANDONED,

    BRANCH_REACTIVATED,

    BRANCH_MERGED,

    BRANCH_DELETED,

    PLAN_REGENERATED,

    PLAN_UPDATED,

    COMMIT_CREATED
}
