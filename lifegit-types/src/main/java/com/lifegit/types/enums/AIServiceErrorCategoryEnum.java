package com.lifegit.types.enums;

/**
 * AI 计划生成失败分类。
 * <p>
 * retryable 为 true 的分类由失败策略按指数退避重试，其余立即走兜底。
 * </p>
 *
 * @author lifegit
 * @since 2025-01-29
 */
public enum AIServiceErrorCategoryEnum {

    /** 网络不可达、超时 */
    NETWORK(true),

    /** 429 限流 */
    RATE_LIMITED(true),

    /** 5xx 服务端错误 */
    SERVER_ERROR(true),

    /** 返回内容为空 */
    EMPTY_RESPONSE(true),

    /** 未能识别的错误 */
    UNKNOWN(true),

    /** 401/403 鉴权失败 */
    UNAUTHORIZED(false),

    /** 400 请求非法 */
    BAD_REQUEST(false),

    /** 返回内容不是合法的计划 JSON */
    PARSING(false),

    /** 计划结构不满足约束 */
    VALIDATION(false);

    private final boolean retryable;

    AIServiceErrorCategoryEnum(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * 分类对应的响应码。
     */
    public ResponseCode toResponseCode() {
        return switch (this) {
            case PARSING -> ResponseCode.AI_PARSING_ERROR;
            case VALIDATION -> ResponseCode.AI_PLAN_VALIDATION_ERROR;
            default -> ResponseCode.AI_SERVICE_ERROR;
        };
    }
}
