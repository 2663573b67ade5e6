package com.lifegit.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 提交类型枚举
 *
 * @author lifegit
 * @since 2025-01-29
 */
public enum CommitTypeEnum {

    TASK_COMPLETE("task_complete", "任务完成", "✅"),
    LEARNING("learning", "学习记录", "📚"),
    REFLECTION("reflection", "生活感悟", "🌟"),
    MILESTONE("milestone", "里程碑", "🏆"),
    HABIT("habit", "习惯养成", "🔄"),
    EXERCISE("exercise", "运动健身", "💪"),
    READING("reading", "阅读记录", "📖"),
    CREATIVITY("creativity", "创意创作", "🎨"),
    SOCIAL("social", "社交活动", "👥"),
    HEALTH("health", "健康管理", "🏥"),
    FINANCE("finance", "财务管理", "💰"),
    CAREER("career", "职业发展", "💼"),
    RELATIONSHIP("relationship", "人际关系", "💑"),
    TRAVEL("travel", "旅行体验", "✈️"),
    SKILL("skill", "技能学习", "🛠️"),
    PROJECT("project", "项目进展", "📋"),
    IDEA("idea", "想法记录", "💡"),
    CHALLENGE("challenge", "挑战克服", "⚡"),
    GRATITUDE("gratitude", "感恩记录", "🙏"),
    CUSTOM("custom", "自定义", "⭐");

    private final String code;

    @Getter
    private final String displayName;

    @Getter
    private final String emoji;

    CommitTypeEnum(String code, String displayName, String emoji) {
        this.code = code;
        this.displayName = displayName;
        this.emoji = emoji;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static CommitTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (CommitTypeEnum type : CommitTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown commit type code: " + code);
    }
}
