package com.lifegit.test.domain;

import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.model.valobj.AIGeneratedTaskPlan;
import com.lifegit.domain.plan.model.valobj.GoalDescriptor;
import com.lifegit.domain.plan.service.TaskPlanAssemblyDomainService;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import com.lifegit.types.enums.TaskTimeScopeEnum;
import com.lifegit.types.exception.AIServiceException;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class TaskPlanAssemblyDomainServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 9, 30);

    private TaskPlanAssemblyDomainService assemblyService;

    @BeforeEach
    public void setUp() {
        assemblyService = new TaskPlanAssemblyDomainService();
    }

    @Test
    public void shouldStampCreationAndModificationTimeOnAiPlan() {
        TaskPlanEntity plan = assemblyService.assemble(raw("2周", task("写一个 CLI", 2), task("读完官方教程", 1)), NOW);

        Assertions.assertEquals(NOW, plan.getCreatedAt());
        Assertions.assertEquals(NOW, plan.getLastModifiedAt());
        for (TaskItemEntity item : plan.getTasks()) {
            Assertions.assertEquals(NOW, item.getCreatedAt());
            Assertions.assertEquals(NOW, item.getLastModifiedAt());
        }
        Assertions.assertEquals("读完官方教程", plan.getTasks().get(0).getTitle());
        Assertions.assertTrue(plan.isAiPlan());
    }

    @Test
    public void shouldStampCreationAndModificationTimeOnFallbackPlan() {
        GoalDescriptor goal = GoalDescriptor.builder().title("学习 Rust").description("三个月入门").build();

        TaskPlanEntity plan = assemblyService.manualFallbackPlan(goal, NOW);

        Assertions.assertEquals(NOW, plan.getLastModifiedAt());
        Assertions.assertEquals(NOW, plan.getTasks().get(0).getLastModifiedAt());
        Assertions.assertFalse(plan.isAiPlan());
    }

    @Test
    public void shouldNormalizeUnknownTimeScope() {
        AIGeneratedTaskPlan.AIGeneratedTask task = task("冥想", 0);
        task.setTimeScope("HOURLY");

        TaskPlanEntity plan = assemblyService.assemble(raw("1周", task), NOW);

        Assertions.assertEquals(TaskTimeScopeEnum.DAILY, plan.getTasks().get(0).getTimeScope());
    }

    @Test
    public void shouldAcceptTitleAtColumnLimit() {
        TaskPlanEntity plan = assemblyService.assemble(raw("2周", task(StringUtils.repeat('读', 200), 0)), NOW);

        Assertions.assertEquals(200, plan.getTasks().get(0).getTitle().length());
    }

    @Test
    public void shouldRejectTitleLongerThanColumn() {
        AIServiceException ex = Assertions.assertThrows(AIServiceException.class,
                () -> assemblyService.assemble(raw("2周", task("第一步", 0), task(StringUtils.repeat('读', 201), 1)), NOW));

        Assertions.assertEquals(AIServiceErrorCategoryEnum.VALIDATION, ex.getCategory());
        Assertions.assertEquals("Task 1 title must not exceed 200 characters", ex.getMessage());
    }

    @Test
    public void shouldRejectTotalDurationLongerThanColumn() {
        AIServiceException ex = Assertions.assertThrows(AIServiceException.class,
                () -> assemblyService.assemble(raw(StringUtils.repeat('周', 129), task("第一步", 0)), NOW));

        Assertions.assertEquals(AIServiceErrorCategoryEnum.VALIDATION, ex.getCategory());
    }

    @Test
    public void shouldRejectEmptyTaskList() {
        AIServiceException ex = Assertions.assertThrows(AIServiceException.class,
                () -> assemblyService.assemble(raw("2周"), NOW));

        Assertions.assertEquals("Task plan must contain at least one task", ex.getMessage());
    }

    private AIGeneratedTaskPlan raw(String totalDuration, AIGeneratedTaskPlan.AIGeneratedTask... tasks) {
        return AIGeneratedTaskPlan.builder()
                .totalDuration(totalDuration)
                .tasks(new ArrayList<>(List.of(tasks)))
                .build();
    }

    private AIGeneratedTaskPlan.AIGeneratedTask task(String title, int orderIndex) {
        return AIGeneratedTaskPlan.AIGeneratedTask.builder()
                .title(title)
                .description(title + " 说明")
                .estimatedDuration(30)
                .timeScope("weekly")
                .orderIndex(orderIndex)
                .build();
    }
}
