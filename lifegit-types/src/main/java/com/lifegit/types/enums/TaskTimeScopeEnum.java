package com.lifegit.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务时间维度枚举
 *
 * @author lifegit
 * @since 2025-01-29
 */
public enum TaskTimeScopeEnum {

    DAILY("daily"),

    WEEKLY("weekly"),

    MONTHLY("monthly");

    private final String code;

    TaskTimeScopeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TaskTimeScopeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskTimeScopeEnum scope : TaskTimeScopeEnum.values()) {
            if (scope.code.equalsIgnoreCase(code)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown task time scope code: " + code);
    }

    /**
     * 宽松解析：无法识别的取值回落为 DAILY。
     */
    public static TaskTimeScopeEnum fromCodeOrDaily(String code) {
        if (code == null) {
            return DAILY;
        }
        String normalized = code.trim();
        for (TaskTimeScopeEnum scope : TaskTimeScopeEnum.values()) {
            if (scope.code.equalsIgnoreCase(normalized) || scope.name().equalsIgnoreCase(normalized)) {
                return scope;
            }
        }
        return DAILY;
    }
}
