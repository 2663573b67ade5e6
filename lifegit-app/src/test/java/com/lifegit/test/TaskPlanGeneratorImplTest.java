package com.lifegit.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifegit.domain.plan.adapter.gateway.ICompletionGateway;
import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.model.valobj.CompletionRequest;
import com.lifegit.domain.plan.model.valobj.GoalDescriptor;
import com.lifegit.domain.plan.service.TaskPlanAssemblyDomainService;
import com.lifegit.infrastructure.planning.TaskPlanGeneratorImpl;
import com.lifegit.infrastructure.util.JsonCodec;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import com.lifegit.types.enums.TaskTimeScopeEnum;
import com.lifegit.types.exception.AIServiceException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TaskPlanGeneratorImplTest {

    private static final String SINGLE_TASK_PLAN = "{\"totalDuration\":\"2周\",\"tasks\":[{\"title\":\"读官方教程\","
            + "\"description\":\"完成前六章\",\"timeScope\":\"daily\",\"estimatedDuration\":60,\"orderIndex\":0,"
            + "\"executionTips\":\"每天固定时段\"}]}";

    private ICompletionGateway completionGateway;
    private TaskPlanGeneratorImpl generator;
    private GoalDescriptor goal;

    @BeforeEach
    public void setUp() {
        completionGateway = mock(ICompletionGateway.class);
        generator = new TaskPlanGeneratorImpl(completionGateway,
                new TaskPlanAssemblyDomainService(),
                new JsonCodec(new ObjectMapper()),
                "deepseek-reasoner",
                0.7D,
                2000);
        goal = GoalDescriptor.builder().title("学习 Rust").description("三个月入门").timeframe("3个月").build();
    }

    @Test
    public void shouldParseValidPlan() {
        when(completionGateway.complete(any())).thenReturn(SINGLE_TASK_PLAN);

        TaskPlanEntity plan = generator.generate(goal);

        Assertions.assertTrue(plan.isAiPlan());
        Assertions.assertEquals("2周", plan.getTotalDuration());
        Assertions.assertEquals(1, plan.totalCount());
        TaskItemEntity task = plan.getTasks().get(0);
        Assertions.assertEquals("读官方教程", task.getTitle());
        Assertions.assertEquals(60, task.getEstimatedDuration());
        Assertions.assertEquals(TaskTimeScopeEnum.DAILY, task.getTimeScope());
        Assertions.assertEquals("每天固定时段", task.getExecutionTips());
        Assertions.assertFalse(task.isDone());
        Assertions.assertTrue(task.getAiGenerated());
    }

    @Test
    public void shouldSendGoalAndModelSettingsInOneRequest() {
        when(completionGateway.complete(any())).thenReturn(SINGLE_TASK_PLAN);

        generator.generate(goal);

        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionGateway).complete(captor.capture());
        CompletionRequest request = captor.getValue();
        Assertions.assertEquals("deepseek-reasoner", request.getModel());
        Assertions.assertEquals(0.7D, request.getTemperature());
        Assertions.assertEquals(2000, request.getMaxTokens());
        Assertions.assertTrue(request.getUserPrompt().contains("目标标题：学习 Rust"));
        Assertions.assertTrue(request.getUserPrompt().contains("目标描述：三个月入门"));
        Assertions.assertTrue(request.getUserPrompt().contains("预期完成时间：3个月"));
        Assertions.assertTrue(request.getSystemPrompt().contains("JSON"));
    }

    @Test
    public void shouldStripMarkdownFenceAndSurroundingText() {
        when(completionGateway.complete(any())).thenReturn("好的，这是计划：\n```json\n" + SINGLE_TASK_PLAN + "\n```\n祝你顺利");

        TaskPlanEntity plan = generator.generate(goal);

        Assertions.assertEquals(1, plan.totalCount());
    }

    @Test
    public void shouldSortTasksAndDefaultUnknownTimeScope() {
        when(completionGateway.complete(any())).thenReturn("{\"totalDuration\":\"1个月\",\"tasks\":["
                + "{\"title\":\"B\",\"description\":\"b\",\"timeScope\":\"YEARLY\",\"estimatedDuration\":30,\"orderIndex\":2},"
                + "{\"title\":\"A\",\"description\":\"a\",\"timeScope\":\"Weekly\",\"estimatedDuration\":45,\"orderIndex\":1}]}");

        TaskPlanEntity plan = generator.generate(goal);

        Assertions.assertEquals("A", plan.getTasks().get(0).getTitle());
        Assertions.assertEquals(TaskTimeScopeEnum.WEEKLY, plan.getTasks().get(0).getTimeScope());
        Assertions.assertEquals(TaskTimeScopeEnum.DAILY, plan.getTasks().get(1).getTimeScope());
    }

    @Test
    public void shouldRejectPlanWithoutTasks() {
        when(completionGateway.complete(any())).thenReturn("{\"totalDuration\":\"2周\",\"tasks\":[]}");

        AIServiceException ex = Assertions.assertThrows(AIServiceException.class, () -> generator.generate(goal));

        Assertions.assertEquals(AIServiceErrorCategoryEnum.VALIDATION, ex.getCategory());
        Assertions.assertEquals("Task plan must contain at least one task", ex.getInfo());
    }

    @Test
    public void shouldRejectNonPositiveDuration() {
        when(completionGateway.complete(any())).thenReturn("{\"totalDuration\":\"2周\",\"tasks\":[{\"title\":\"t\","
                + "\"description\":\"d\",\"timeScope\":\"daily\",\"estimatedDuration\":0,\"orderIndex\":0}]}");

        AIServiceException ex = Assertions.assertThrows(AIServiceException.class, () -> generator.generate(goal));

        Assertions.assertEquals(AIServiceErrorCategoryEnum.VALIDATION, ex.getCategory());
        Assertions.assertEquals("Task 0 estimated duration must be positive", ex.getInfo());
    }

    @Test
    public void shouldReportMissingRequiredFieldAsParsingFailure() {
        when(completionGateway.complete(any())).thenReturn("{\"totalDuration\":\"2周\",\"tasks\":[{\"title\":\"t\","
                + "\"description\":\"d\",\"estimatedDuration\":30,\"orderIndex\":0}]}");

        AIServiceException ex = Assertions.assertThrows(AIServiceException.class, () -> generator.generate(goal));

        Assertions.assertEquals(AIServiceErrorCategoryEnum.PARSING, ex.getCategory());
        Assertions.assertTrue(ex.getInfo().startsWith("JSON parsing failed: "));
        Assertions.assertTrue(ex.getInfo().contains("timeScope"));
    }

    @Test
    public void shouldReportNonJsonAsParsingFailure() {
        when(completionGateway.complete(any())).thenReturn("抱歉，我无法完成这个请求");

        AIServiceException ex = Assertions.assertThrows(AIServiceException.class, () -> generator.generate(goal));

        Assertions.assertEquals(AIServiceErrorCategoryEnum.PARSING, ex.getCategory());
        Assertions.assertFalse(ex.isRetryable());
    }

    @Test
    public void shouldReportBlankContentAsEmptyResponse() {
        when(completionGateway.complete(any())).thenReturn("   ");

        AIServiceException ex = Assertions.assertThrows(AIServiceException.class, () -> generator.generate(goal));

        Assertions.assertEquals(AIServiceErrorCategoryEnum.EMPTY_RESPONSE, ex.getCategory());
        Assertions.assertTrue(ex.isRetryable());
    }

    @Test
    public void shouldRejectBlankGoalWithoutCallingModel() {
        AIServiceException ex = Assertions.assertThrows(AIServiceException.class,
                () -> generator.generate(GoalDescriptor.builder().title(" ").build()));

        Assertions.assertEquals(AIServiceErrorCategoryEnum.BAD_REQUEST, ex.getCategory());
        verify(completionGateway, never()).complete(any());
    }
}
