package com.lifegit.types.exception;

import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * AI 计划生成失败异常，携带失败分类供失败策略判定是否重试。
 *
 * @author lifegit
 * @since 2025-01-29
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class AIServiceException extends AppException {

    private static final long serialVersionUID = -2184413375094522271L;

    private final AIServiceErrorCategoryEnum category;

    public AIServiceException(AIServiceErrorCategoryEnum category, String message) {
        super(resolveCategory(category).toResponseCode().getCode(), message);
        this.category = resolveCategory(category);
    }

    public AIServiceException(AIServiceErrorCategoryEnum category, String message, Throwable cause) {
        super(resolveCategory(category).toResponseCode().getCode(), message, cause);
        this.category = resolveCategory(category);
    }

    public boolean isRetryable() {
        return category.isRetryable();
    }

    private static AIServiceErrorCategoryEnum resolveCategory(AIServiceErrorCategoryEnum category) {
        return category == null ? AIServiceErrorCategoryEnum.UNKNOWN : category;
    }

    @Override
    public String toString() {
        return "com.lifegit.types.exception.AIServiceException{" +
                "code='" + getCode() + '\'' +
                ", category=" + category +
                ", info='" + getInfo() + '\'' +
                '}';
    }
}
