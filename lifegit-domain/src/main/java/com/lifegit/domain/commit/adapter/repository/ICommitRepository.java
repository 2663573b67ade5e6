package com.lifegit.domain.commit.adapter.repository;

import com.lifegit.domain.commit.model.entity.CommitEntity;

import java.util.List;

/**
 * 提交记录仓储接口
 *
 * @author lifegit
 * @since 2025-01-29
 */
public interface ICommitRepository {

    /**
     * 追加提交，回填 ID
     */
    CommitEntity save(CommitEntity entity);

    boolean deleteById(Long id);

    /**
     * 删除分支下全部提交
     */
    int deleteByBranchId(Long branchId);

    CommitEntity findById(Long id);

    /**
     * 按时间升序（同时间按 ID 升序）查询分支提交
     */
    List<CommitEntity> findByBranchId(Long branchId);

    long countByBranchId(Long branchId);

    List<CommitEntity> findAll();
}
