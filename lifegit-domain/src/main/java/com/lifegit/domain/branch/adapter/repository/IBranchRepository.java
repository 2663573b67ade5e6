package com.lifegit.domain.branch.adapter.repository;

import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.types.enums.BranchStatusEnum;

import java.util.List;

/**
 * 目标分支仓储接口
 *
 * @author lifegit
 * @since 2025-01-29
 */
public interface IBranchRepository {

    /**
     * 保存分支，回填 ID
     */
    BranchEntity save(BranchEntity entity);

    /**
     * 更新分支
     */
    BranchEntity update(BranchEntity entity);

    /**
     * 根据 ID 删除
     */
    boolean deleteById(Long id);

    /**
     * 根据 ID 查询
     */
    BranchEntity findById(Long id);

    /**
     * 查询主线分支
     */
    BranchEntity findMaster();

    /**
     * 根据状态查询
     */
    List<BranchEntity> findByStatus(BranchStatusEnum status);

    /**
     * 查询所有分支
     */
    List<BranchEntity> findAll();
}
