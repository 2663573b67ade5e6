package com.lifegit.types.common;

/**
 * 全局常量定义类。
 *
 * @author lifegit
 * @since 2025-01-29
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 主线分支名称 */
    public final static String MASTER_BRANCH_NAME = "人生主线";

    /** 主线分支描述 */
    public final static String MASTER_BRANCH_DESCRIPTION = "记录人生的主要历程和成就";

    /** 手动兜底计划的总时长标记 */
    public final static String MANUAL_PLAN_DURATION = "手动创建的任务计划";

    /** 完成目标提交信息前缀 */
    public final static String COMPLETE_COMMIT_PREFIX = "🎉 完成目标: ";

    /** 合并目标提交信息前缀 */
    public final static String MERGE_COMMIT_PREFIX = "合并目标: ";

    /** 完成任务提交信息前缀 */
    public final static String TASK_COMPLETE_COMMIT_PREFIX = "✅ 完成任务: ";

    /** 任务标题最大长度，与 task_item.title 列一致 */
    public final static int TASK_TITLE_MAX_LENGTH = 200;

    /** 计划总时长最大长度，与 task_plan.total_duration 列一致 */
    public final static int PLAN_TOTAL_DURATION_MAX_LENGTH = 128;

    /** 提交信息最大长度，与 commit_record.message 列一致 */
    public final static int COMMIT_MESSAGE_MAX_LENGTH = 500;

}
