package com.lifegit.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 0xxx 为通用码，1xxx 为分支生命周期，2xxx 为 AI 计划生成，3xxx 为持久化。
 * </p>
 *
 * @author lifegit
 * @since 2025-01-29
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数（用户输入校验失败） */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 非法的生命周期状态迁移 */
    INVALID_STATE("1001", "当前分支状态不允许该操作"),

    /** 主线分支不存在 */
    MASTER_NOT_FOUND("1002", "主线分支不存在"),

    /** 分支没有任务计划 */
    NO_TASK_PLAN("1003", "分支没有任务计划"),

    /** 分支不存在 */
    BRANCH_NOT_FOUND("1004", "分支不存在"),

    /** 任务项不存在 */
    TASK_ITEM_NOT_FOUND("1005", "任务不存在"),

    /** AI 服务调用失败 */
    AI_SERVICE_ERROR("2001", "AI 服务调用失败"),

    /** AI 返回内容无法解析 */
    AI_PARSING_ERROR("2002", "AI 返回内容无法解析"),

    /** AI 生成的计划未通过校验 */
    AI_PLAN_VALIDATION_ERROR("2003", "AI 生成的任务计划无效"),

    /** 持久化失败 */
    REPOSITORY_ERROR("3001", "数据存储失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
