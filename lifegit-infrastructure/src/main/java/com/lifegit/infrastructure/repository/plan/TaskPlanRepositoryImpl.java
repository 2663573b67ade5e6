package com.lifegit.infrastructure.repository.plan;

import com.lifegit.domain.plan.adapter.repository.ITaskPlanRepository;
import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.infrastructure.dao.TaskItemDao;
import com.lifegit.infrastructure.dao.TaskPlanDao;
import com.lifegit.infrastructure.dao.po.TaskItemPO;
import com.lifegit.infrastructure.dao.po.TaskPlanPO;
import com.lifegit.types.enums.TaskTimeScopeEnum;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.lifegit.infrastructure.repository.RepositoryErrors.call;

/**
 * 任务计划仓储实现，计划行与任务项行一起读写。
 * <p>
 * 写操作在同一事务内完成，任务项写入失败时计划行一并回滚，不会留下半份计划。
 * </p>
 */
@Repository
public class TaskPlanRepositoryImpl implements ITaskPlanRepository {

    private final TaskPlanDao taskPlanDao;
    private final TaskItemDao taskItemDao;

    public TaskPlanRepositoryImpl(TaskPlanDao taskPlanDao, TaskItemDao taskItemDao) {
        this.taskPlanDao = taskPlanDao;
        this.taskItemDao = taskItemDao;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public TaskPlanEntity save(TaskPlanEntity entity) {
        TaskPlanPO po = toPO(entity);
        call("taskPlan.insert", () -> taskPlanDao.insert(po));
        entity.setId(po.getId());
        if (entity.getTasks() != null) {
            for (TaskItemEntity task : entity.getTasks()) {
                insertItem(entity.getId(), task);
            }
        }
        return entity;
    }

    /**
     * 同步任务项：有 ID 的更新，无 ID 的新增，库中有而实体中没有的删除。
     */
    @Override
    @Transactional(rollbackFor = Exception.class)
    public TaskPlanEntity update(TaskPlanEntity entity) {
        call("taskPlan.update", () -> taskPlanDao.update(toPO(entity)));
        List<TaskItemPO> existing = call("taskItem.selectByPlanId", () -> taskItemDao.selectByPlanId(entity.getId()));
        Set<Long> keptIds = new HashSet<>();
        if (entity.getTasks() != null) {
            for (TaskItemEntity task : entity.getTasks()) {
                if (task.getId() == null) {
                    insertItem(entity.getId(), task);
                } else {
                    task.setPlanId(entity.getId());
                    call("taskItem.update", () -> taskItemDao.update(toItemPO(task)));
                }
                keptIds.add(task.getId());
            }
        }
        if (existing != null) {
            for (TaskItemPO item : existing) {
                if (!keptIds.contains(item.getId())) {
                    call("taskItem.delete", () -> taskItemDao.deleteById(item.getId()));
                }
            }
        }
        return findById(entity.getId());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean deleteById(Long id) {
        call("taskItem.deleteByPlanId", () -> taskItemDao.deleteByPlanId(id));
        return call("taskPlan.delete", () -> taskPlanDao.deleteById(id)) > 0;
    }

    @Override
    public TaskPlanEntity findById(Long id) {
        TaskPlanPO po = call("taskPlan.selectById", () -> taskPlanDao.selectById(id));
        return po == null ? null : toEntity(po);
    }

    @Override
    public TaskPlanEntity findByBranchId(Long branchId) {
        TaskPlanPO po = call("taskPlan.selectLatestByBranchId", () -> taskPlanDao.selectLatestByBranchId(branchId));
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<TaskPlanEntity> findAll() {
        List<TaskPlanPO> pos = call("taskPlan.selectAll", taskPlanDao::selectAll);
        List<TaskPlanEntity> entities = new ArrayList<>();
        if (pos == null) {
            return entities;
        }
        for (TaskPlanPO po : pos) {
            entities.add(toEntity(po));
        }
        return entities;
    }

    private void insertItem(Long planId, TaskItemEntity task) {
        task.setPlanId(planId);
        TaskItemPO itemPO = toItemPO(task);
        call("taskItem.insert", () -> taskItemDao.insert(itemPO));
        task.setId(itemPO.getId());
    }

    private TaskPlanEntity toEntity(TaskPlanPO po) {
        TaskPlanEntity entity = new TaskPlanEntity();
        entity.setId(po.getId());
        entity.setBranchId(po.getBranchId());
        entity.setTotalDuration(po.getTotalDuration());
        entity.setAiGenerated(po.getAiGenerated());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setLastModifiedAt(po.getLastModifiedAt());
        List<TaskItemPO> items = call("taskItem.selectByPlanId", () -> taskItemDao.selectByPlanId(po.getId()));
        List<TaskItemEntity> tasks = new ArrayList<>();
        if (items != null) {
            for (TaskItemPO item : items) {
                tasks.add(toItemEntity(item));
            }
        }
        entity.setTasks(tasks);
        return entity;
    }

    private TaskPlanPO toPO(TaskPlanEntity entity) {
        return TaskPlanPO.builder()
                .id(entity.getId())
                .branchId(entity.getBranchId())
                .totalDuration(entity.getTotalDuration())
                .aiGenerated(entity.getAiGenerated())
                .createdAt(entity.getCreatedAt())
                .lastModifiedAt(entity.getLastModifiedAt())
                .build();
    }

    private TaskItemEntity toItemEntity(TaskItemPO po) {
        TaskItemEntity entity = new TaskItemEntity();
        entity.setId(po.getId());
        entity.setPlanId(po.getPlanId());
        entity.setTitle(po.getTitle());
        entity.setDescription(po.getDescription());
        entity.setEstimatedDuration(po.getEstimatedDuration());
        entity.setTimeScope(TaskTimeScopeEnum.fromCodeOrDaily(po.getTimeScope()));
        entity.setOrderIndex(po.getOrderIndex());
        entity.setCompleted(po.getCompleted());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setAiGenerated(po.getAiGenerated());
        entity.setExecutionTips(po.getExecutionTips());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setLastModifiedAt(po.getLastModifiedAt());
        return entity;
    }

    private TaskItemPO toItemPO(TaskItemEntity entity) {
        return TaskItemPO.builder()
                .id(entity.getId())
                .planId(entity.getPlanId())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .estimatedDuration(entity.getEstimatedDuration())
                .timeScope(entity.getTimeScope() == null ? null : entity.getTimeScope().getCode())
                .orderIndex(entity.getOrderIndex())
                .completed(entity.getCompleted())
                .completedAt(entity.getCompletedAt())
                .aiGenerated(entity.getAiGenerated())
                .executionTips(entity.getExecutionTips())
                .createdAt(entity.getCreatedAt())
                .lastModifiedAt(entity.getLastModifiedAt())
                .build();
    }
}
