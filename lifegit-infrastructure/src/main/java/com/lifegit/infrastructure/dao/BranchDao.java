package com.lifegit.infrastructure.dao;

import com.lifegit.infrastructure.dao.po.BranchPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 目标分支 DAO。
 */
@Mapper
public interface BranchDao {

    int insert(BranchPO po);

    int update(BranchPO po);

    int deleteById(@Param("id") Long id);

    BranchPO selectById(@Param("id") Long id);

    BranchPO selectMaster();

    List<BranchPO> selectByStatus(@Param("status") String status);

    List<BranchPO> selectAll();
}
