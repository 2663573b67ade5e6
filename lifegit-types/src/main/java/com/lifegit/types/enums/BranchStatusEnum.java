package com.lifegit.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 目标分支状态枚举
 *
 * @author lifegit
 * @since 2025-01-29
 */
public enum BranchStatusEnum {

    /**
     * 进行中 - 可提交、可完成、可废弃
     */
    ACTIVE("active"),

    /**
     * 已完成 - 可合并到主线
     */
    COMPLETED("completed"),

    /**
     * 已废弃 - 可重新激活
     */
    ABANDONED("abandoned"),

    /**
     * 主线 - 全局唯一，合并目标
     */
    MASTER("master");

    private final String code;

    BranchStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static BranchStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (BranchStatusEnum status : BranchStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown branch status code: " + code);
    }
}
