package com.lifegit.infrastructure.dao;

import com.lifegit.infrastructure.dao.po.CommitPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 提交记录 DAO。
 */
@Mapper
public interface CommitDao {

    int insert(CommitPO po);

    int deleteById(@Param("id") Long id);

    int deleteByBranchId(@Param("branchId") Long branchId);

    CommitPO selectById(@Param("id") Long id);

    List<CommitPO> selectByBranchId(@Param("branchId") Long branchId);

    long countByBranchId(@Param("branchId") Long branchId);

    List<CommitPO> selectAll();
}
