package com.lifegit.test;

import com.lifegit.domain.plan.model.valobj.CompletionRequest;
import com.lifegit.infrastructure.ai.SpringAiCompletionGateway;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import com.lifegit.types.exception.AIServiceException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SpringAiCompletionGatewayTest {

    private ObjectProvider<ChatModel> chatModelProvider;
    private SpringAiCompletionGateway gateway;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        chatModelProvider = mock(ObjectProvider.class);
        gateway = new SpringAiCompletionGateway(chatModelProvider, "openai");
    }

    @Test
    public void shouldFailAsUnauthorizedWhenNoModelConfigured() {
        when(chatModelProvider.getIfAvailable()).thenReturn(null);

        AIServiceException ex = Assertions.assertThrows(AIServiceException.class,
                () -> gateway.complete(CompletionRequest.builder().userPrompt("hi").build()));

        Assertions.assertEquals(AIServiceErrorCategoryEnum.UNAUTHORIZED, ex.getCategory());
        Assertions.assertFalse(ex.isRetryable());
    }

    @Test
    public void shouldCategorizeHttpStatusErrors() {
        Assertions.assertEquals(AIServiceErrorCategoryEnum.UNAUTHORIZED,
                gateway.categorize(new HttpClientErrorException(HttpStatus.UNAUTHORIZED)));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.UNAUTHORIZED,
                gateway.categorize(new HttpClientErrorException(HttpStatus.FORBIDDEN)));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.RATE_LIMITED,
                gateway.categorize(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS)));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.BAD_REQUEST,
                gateway.categorize(new HttpClientErrorException(HttpStatus.BAD_REQUEST)));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.SERVER_ERROR,
                gateway.categorize(new HttpServerErrorException(HttpStatus.BAD_GATEWAY)));
    }

    @Test
    public void shouldCategorizeSpringAiExceptionsByStatusPrefix() {
        Assertions.assertEquals(AIServiceErrorCategoryEnum.SERVER_ERROR,
                gateway.categorize(new TransientAiException("HTTP 503 - Service Unavailable")));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.RATE_LIMITED,
                gateway.categorize(new TransientAiException("429 - Too Many Requests")));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.SERVER_ERROR,
                gateway.categorize(new TransientAiException("upstream hiccup")));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.UNAUTHORIZED,
                gateway.categorize(new NonTransientAiException("401 - Incorrect API key provided")));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.BAD_REQUEST,
                gateway.categorize(new NonTransientAiException("model not supported")));
    }

    @Test
    public void shouldCategorizeTransportFailuresAsNetwork() {
        Assertions.assertEquals(AIServiceErrorCategoryEnum.NETWORK,
                gateway.categorize(new ResourceAccessException("I/O error on POST request")));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.NETWORK,
                gateway.categorize(new RuntimeException("wrapped", new SocketTimeoutException("Read timed out"))));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.UNKNOWN,
                gateway.categorize(new IllegalStateException("boom")));
    }
}
