package com.lifegit.infrastructure.dao;

import com.lifegit.infrastructure.dao.po.TaskPlanPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 任务计划 DAO。
 */
@Mapper
public interface TaskPlanDao {

    int insert(TaskPlanPO po);

    int update(TaskPlanPO po);

    int deleteById(@Param("id") Long id);

    TaskPlanPO selectById(@Param("id") Long id);

    /**
     * 替换计划期间同一分支可能短暂存在两份计划，取最新的一份。
     */
    TaskPlanPO selectLatestByBranchId(@Param("branchId") Long branchId);

    List<TaskPlanPO> selectAll();
}
