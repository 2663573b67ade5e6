package com.lifegit.test;

import com.lifegit.api.response.Response;
import com.lifegit.trigger.http.GlobalApiExceptionHandler;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AIServiceException;
import com.lifegit.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class GlobalApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ErrorController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldHandleAppException() throws Exception {
        mockMvc.perform(get("/api/test/app-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.REPOSITORY_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value("数据存储失败: branch.update"));
    }

    @Test
    public void shouldHandleAiServiceExceptionWithCategory() throws Exception {
        mockMvc.perform(get("/api/test/ai-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.AI_SERVICE_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value("[RATE_LIMITED] 429 Too Many Requests"));
    }

    @Test
    public void shouldTruncateLongInfo() throws Exception {
        mockMvc.perform(get("/api/test/long-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info").value("x".repeat(300)));
    }

    @Test
    public void shouldHandleUnknownException() throws Exception {
        mockMvc.perform(get("/api/test/runtime-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }

    @Test
    public void shouldHandleTypeMismatchExceptionAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/type-error/not-number"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @RestController
    private static class ErrorController {

        @GetMapping("/api/test/app-error")
        public Response<Void> appError() {
            throw new AppException(ResponseCode.REPOSITORY_ERROR.getCode(), "数据存储失败: branch.update");
        }

        @GetMapping("/api/test/ai-error")
        public Response<Void> aiError() {
            throw new AIServiceException(AIServiceErrorCategoryEnum.RATE_LIMITED, "429 Too Many Requests");
        }

        @GetMapping("/api/test/long-error")
        public Response<Void> longError() {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "x".repeat(500));
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new RuntimeException("boom");
        }

        @GetMapping("/api/test/type-error/{id}")
        public Response<String> typeError(@PathVariable("id") Long id) {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(String.valueOf(id))
                    .build();
        }
    }
}
