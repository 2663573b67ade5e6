package com.lifegit.domain.plan.adapter.gateway;

import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.model.valobj.GoalDescriptor;

/**
 * AI 任务计划生成端口。
 */
public interface ITaskPlanGenerator {

    /**
     * 发起一次补全请求并转换为任务计划，不做重试。
     *
     * @param goal 目标描述
     * @return 未持久化的 AI 计划（aiGenerated = true，任务按 orderIndex 排序）
     * @throws com.lifegit.types.exception.AIServiceException 调用、解析或校验失败
     */
    TaskPlanEntity generate(GoalDescriptor goal);
}
