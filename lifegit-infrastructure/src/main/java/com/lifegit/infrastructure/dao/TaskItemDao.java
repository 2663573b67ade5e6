package com.lifegit.infrastructure.dao;

import com.lifegit.infrastructure.dao.po.TaskItemPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 任务项 DAO。
 */
@Mapper
public interface TaskItemDao {

    int insert(TaskItemPO po);

    int update(TaskItemPO po);

    int deleteById(@Param("id") Long id);

    int deleteByPlanId(@Param("planId") Long planId);

    List<TaskItemPO> selectByPlanId(@Param("planId") Long planId);
}
