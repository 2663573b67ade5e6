package com.lifegit.infrastructure.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.lifegit.domain.plan.adapter.gateway.ICompletionGateway;
import com.lifegit.domain.plan.adapter.gateway.ITaskPlanGenerator;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.model.valobj.AIGeneratedTaskPlan;
import com.lifegit.domain.plan.model.valobj.CompletionRequest;
import com.lifegit.domain.plan.model.valobj.GoalDescriptor;
import com.lifegit.domain.plan.service.TaskPlanAssemblyDomainService;
import com.lifegit.infrastructure.util.JsonCodec;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import com.lifegit.types.exception.AIServiceException;
import com.lifegit.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于补全网关的任务计划生成实现。
 * <p>
 * 每次调用只发出一个补全请求；返回文本去掉 markdown 代码块和 JSON 之外的说明文字后严格解码，
 * 缺少必填字段或类型不符视为解析失败，之后交给 {@link TaskPlanAssemblyDomainService} 校验与转换。
 * </p>
 */
@Slf4j
@Component
public class TaskPlanGeneratorImpl implements ITaskPlanGenerator {

    private static final String SYSTEM_PROMPT = "你是一个专业的目标管理和任务规划助手，负责把用户的目标拆解成具体、可执行的任务计划。\n\n"
            + "请遵循以下原则：\n"
            + "1. 任务要具体、可衡量、可执行\n"
            + "2. 合理估算时间，避免过于乐观或悲观\n"
            + "3. 考虑难度递进，从简单到复杂\n"
            + "4. 为每个任务提供实用的执行建议\n\n"
            + "只返回有效的 JSON，结构如下：\n"
            + "{\n"
            + "  \"totalDuration\": \"总预计时长描述\",\n"
            + "  \"tasks\": [\n"
            + "    {\n"
            + "      \"title\": \"任务标题\",\n"
            + "      \"description\": \"任务详细描述\",\n"
            + "      \"timeScope\": \"daily|weekly|monthly\",\n"
            + "      \"estimatedDuration\": 预计时长分钟数,\n"
            + "      \"orderIndex\": 任务顺序索引,\n"
            + "      \"executionTips\": \"执行建议\"\n"
            + "    }\n"
            + "  ]\n"
            + "}";

    private static final String[] REQUIRED_TASK_FIELDS = {
            "title", "description", "timeScope", "estimatedDuration", "orderIndex"
    };

    private final ICompletionGateway completionGateway;
    private final TaskPlanAssemblyDomainService taskPlanAssemblyDomainService;
    private final JsonCodec jsonCodec;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public TaskPlanGeneratorImpl(ICompletionGateway completionGateway,
                                 TaskPlanAssemblyDomainService taskPlanAssemblyDomainService,
                                 JsonCodec jsonCodec,
                                 @Value("${lifegit.ai.model:deepseek-reasoner}") String model,
                                 @Value("${lifegit.ai.temperature:0.7}") double temperature,
                                 @Value("${lifegit.ai.max-tokens:2000}") int maxTokens) {
        this.completionGateway = completionGateway;
        this.taskPlanAssemblyDomainService = taskPlanAssemblyDomainService;
        this.jsonCodec = jsonCodec;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public TaskPlanEntity generate(GoalDescriptor goal) {
        if (goal == null || StringUtils.isBlank(goal.getTitle())) {
            throw new AIServiceException(AIServiceErrorCategoryEnum.BAD_REQUEST, "目标标题为空，无法生成任务计划");
        }
        CompletionRequest request = CompletionRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .userPrompt(buildUserPrompt(goal))
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
        if (log.isDebugEnabled()) {
            log.debug("PLAN_REQUEST request={}", jsonCodec.writeValue(request));
        }
        String content = completionGateway.complete(request);
        if (StringUtils.isBlank(content)) {
            throw new AIServiceException(AIServiceErrorCategoryEnum.EMPTY_RESPONSE, "AI 返回内容为空");
        }
        AIGeneratedTaskPlan raw = parse(content);
        TaskPlanEntity plan = taskPlanAssemblyDomainService.assemble(raw, LocalDateTime.now());
        log.info("PLAN_PARSED goal={}, tasks={}, totalDuration={}", goal.getTitle(), plan.totalCount(), plan.getTotalDuration());
        return plan;
    }

    String buildUserPrompt(GoalDescriptor goal) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("请为以下目标生成详细的任务计划：\n\n");
        prompt.append("目标标题：").append(goal.getTitle().trim()).append('\n');
        prompt.append("目标描述：").append(StringUtils.defaultString(goal.getDescription()).trim());
        if (StringUtils.isNotBlank(goal.getTimeframe())) {
            prompt.append("\n预期完成时间：").append(goal.getTimeframe().trim());
        }
        prompt.append("\n\n请生成一个结构化的任务计划：\n");
        prompt.append("1. 将目标拆解为具体的、可执行的任务\n");
        prompt.append("2. 为每个任务分配合理的时间维度（daily、weekly、monthly）\n");
        prompt.append("3. 估算每个任务的预计时长（分钟）\n");
        prompt.append("4. 提供任务的详细描述和执行建议\n");
        prompt.append("5. 确保任务之间有逻辑顺序\n\n");
        prompt.append("请严格按照JSON格式返回，不要包含任何其他文本。");
        return prompt.toString();
    }

    /**
     * 去掉代码块标记以及最外层花括号之外的文字。
     */
    String cleanJsonResponse(String content) {
        String cleaned = content.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring("```json".length());
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            cleaned = cleaned.substring(start, end + 1);
        }
        return cleaned.trim();
    }

    AIGeneratedTaskPlan parse(String content) {
        JsonNode root;
        try {
            root = jsonCodec.readTree(cleanJsonResponse(content));
        } catch (AppException ex) {
            throw parsing("JSON parsing failed: " + ex.getInfo(), ex);
        }
        if (root == null || !root.isObject()) {
            throw parsing("JSON parsing failed: root is not an object", null);
        }
        String totalDuration = requireText(root, "totalDuration", "plan");
        JsonNode tasksNode = root.get("tasks");
        if (tasksNode == null || !tasksNode.isArray()) {
            throw parsing("JSON parsing failed: missing array field 'tasks'", null);
        }
        List<AIGeneratedTaskPlan.AIGeneratedTask> tasks = new ArrayList<>();
        for (int i = 0; i < tasksNode.size(); i++) {
            JsonNode taskNode = tasksNode.get(i);
            String path = "tasks[" + i + "]";
            if (taskNode == null || !taskNode.isObject()) {
                throw parsing("JSON parsing failed: " + path + " is not an object", null);
            }
            for (String field : REQUIRED_TASK_FIELDS) {
                if (!taskNode.hasNonNull(field)) {
                    throw parsing("JSON parsing failed: missing field '" + field + "' in " + path, null);
                }
            }
            tasks.add(AIGeneratedTaskPlan.AIGeneratedTask.builder()
                    .title(requireText(taskNode, "title", path))
                    .description(requireText(taskNode, "description", path))
                    .timeScope(requireText(taskNode, "timeScope", path))
                    .estimatedDuration(requireInt(taskNode, "estimatedDuration", path))
                    .orderIndex(requireInt(taskNode, "orderIndex", path))
                    .executionTips(optionalText(taskNode, "executionTips"))
                    .build());
        }
        return AIGeneratedTaskPlan.builder()
                .totalDuration(totalDuration)
                .tasks(tasks)
                .build();
    }

    private String requireText(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw parsing("JSON parsing failed: missing field '" + field + "' in " + path, null);
        }
        if (!value.isTextual()) {
            throw parsing("JSON parsing failed: field '" + field + "' in " + path + " is not a string", null);
        }
        return value.asText();
    }

    private Integer requireInt(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw parsing("JSON parsing failed: missing field '" + field + "' in " + path, null);
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isNumber() && value.doubleValue() == Math.rint(value.doubleValue()) && value.canConvertToInt()) {
            return value.intValue();
        }
        throw parsing("JSON parsing failed: field '" + field + "' in " + path + " is not an integer", null);
    }

    private String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value.toString();
    }

    private AIServiceException parsing(String message, Throwable cause) {
        log.warn("PLAN_PARSE_FAILED reason={}", message);
        return cause == null
                ? new AIServiceException(AIServiceErrorCategoryEnum.PARSING, message)
                : new AIServiceException(AIServiceErrorCategoryEnum.PARSING, message, cause);
    }
}
