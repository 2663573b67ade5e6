package com.lifegit.infrastructure.ai;

import com.lifegit.domain.plan.adapter.gateway.ICompletionGateway;
import com.lifegit.domain.plan.model.valobj.CompletionRequest;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import com.lifegit.types.exception.AIServiceException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于 Spring AI ChatClient 的补全网关。
 * <p>
 * 传输与服务端失败统一转换为带分类的 {@link AIServiceException}：
 * 401/403 鉴权失败，429 限流，5xx 服务端错误，其余 4xx 请求非法，I/O 与超时为网络失败。
 * </p>
 */
@Slf4j
@Component
public class SpringAiCompletionGateway implements ICompletionGateway {

    private static final Pattern STATUS_PREFIX = Pattern.compile("^\\s*(?:HTTP\\s+)?(\\d{3})\\b");

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final String provider;

    public SpringAiCompletionGateway(ObjectProvider<ChatModel> chatModelProvider,
                                     @Value("${lifegit.ai.provider:openai}") String provider) {
        this.chatModelProvider = chatModelProvider;
        this.provider = StringUtils.defaultIfBlank(provider, "openai");
    }

    @Override
    public String complete(CompletionRequest request) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new AIServiceException(AIServiceErrorCategoryEnum.UNAUTHORIZED, "AI 模型未配置");
        }
        String content;
        try {
            content = ChatClient.builder(chatModel)
                    .build()
                    .prompt()
                    .system(request.getSystemPrompt())
                    .user(request.getUserPrompt())
                    .options(buildChatOptions(request))
                    .call()
                    .content();
        } catch (AIServiceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            AIServiceErrorCategoryEnum category = categorize(ex);
            log.warn("AI_COMPLETION_FAILED model={}, category={}, errorType={}, reason={}",
                    request.getModel(), category, ex.getClass().getSimpleName(), ex.getMessage());
            throw new AIServiceException(category, StringUtils.defaultIfBlank(ex.getMessage(), category.name()), ex);
        }
        if (StringUtils.isBlank(content)) {
            throw new AIServiceException(AIServiceErrorCategoryEnum.EMPTY_RESPONSE, "AI 返回内容为空");
        }
        return content;
    }

    /**
     * 将调用异常映射为失败分类。
     */
    public AIServiceErrorCategoryEnum categorize(Throwable error) {
        Throwable cursor = error;
        while (cursor != null) {
            if (cursor instanceof AIServiceException aiServiceException) {
                return aiServiceException.getCategory();
            }
            if (cursor instanceof RestClientResponseException responseException) {
                return byStatus(responseException.getStatusCode().value());
            }
            if (cursor instanceof ResourceAccessException
                    || cursor instanceof IOException
                    || cursor instanceof TimeoutException) {
                return AIServiceErrorCategoryEnum.NETWORK;
            }
            if (cursor instanceof TransientAiException) {
                Integer status = parseStatus(cursor.getMessage());
                return status == null ? AIServiceErrorCategoryEnum.SERVER_ERROR : byStatus(status);
            }
            if (cursor instanceof NonTransientAiException) {
                Integer status = parseStatus(cursor.getMessage());
                return status == null ? AIServiceErrorCategoryEnum.BAD_REQUEST : byStatus(status);
            }
            if (cursor.getCause() == cursor) {
                break;
            }
            cursor = cursor.getCause();
        }
        return AIServiceErrorCategoryEnum.UNKNOWN;
    }

    private AIServiceErrorCategoryEnum byStatus(int status) {
        if (status == 401 || status == 403) {
            return AIServiceErrorCategoryEnum.UNAUTHORIZED;
        }
        if (status == 429) {
            return AIServiceErrorCategoryEnum.RATE_LIMITED;
        }
        if (status >= 500) {
            return AIServiceErrorCategoryEnum.SERVER_ERROR;
        }
        if (status >= 400) {
            return AIServiceErrorCategoryEnum.BAD_REQUEST;
        }
        return AIServiceErrorCategoryEnum.UNKNOWN;
    }

    private Integer parseStatus(String message) {
        if (StringUtils.isBlank(message)) {
            return null;
        }
        Matcher matcher = STATUS_PREFIX.matcher(message);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    private ChatOptions buildChatOptions(CompletionRequest request) {
        if ("openai".equalsIgnoreCase(provider)) {
            OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder();
            if (StringUtils.isNotBlank(request.getModel())) {
                builder.model(request.getModel());
            }
            if (request.getTemperature() != null) {
                builder.temperature(request.getTemperature());
            }
            if (request.getMaxTokens() != null) {
                builder.maxTokens(request.getMaxTokens());
            }
            return builder.build();
        }
        ChatOptions.Builder builder = ChatOptions.builder();
        if (StringUtils.isNotBlank(request.getModel())) {
            builder.model(request.getModel());
        }
        if (request.getTemperature() != null) {
            builder.temperature(request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            builder.maxTokens(request.getMaxTokens());
        }
        return builder.build();
    }
}
