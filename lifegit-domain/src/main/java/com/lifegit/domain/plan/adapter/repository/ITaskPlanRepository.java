package com.lifegit.domain.plan.adapter.repository;

import com.lifegit.domain.plan.model.entity.TaskPlanEntity;

import java.util.List;

/**
 * 任务计划仓储接口，计划与任务项一起读写。
 *
 * @author lifegit
 * @since 2025-01-29
 */
public interface ITaskPlanRepository {

    /**
     * 保存计划及其任务项，回填 ID
     */
    TaskPlanEntity save(TaskPlanEntity entity);

    /**
     * 更新计划及其任务项（新增、修改、删除的任务项一并同步）
     */
    TaskPlanEntity update(TaskPlanEntity entity);

    /**
     * 删除计划及其任务项
     */
    boolean deleteById(Long id);

    TaskPlanEntity findById(Long id);

    /**
     * 根据分支查询计划，无计划返回 null
     */
    TaskPlanEntity findByBranchId(Long branchId);

    List<TaskPlanEntity> findAll();
}
