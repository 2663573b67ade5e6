package com.lifegit.infrastructure.repository.commit;

import com.lifegit.domain.commit.adapter.repository.ICommitRepository;
import com.lifegit.domain.commit.model.entity.CommitEntity;
import com.lifegit.infrastructure.dao.CommitDao;
import com.lifegit.infrastructure.dao.po.CommitPO;
import com.lifegit.types.enums.CommitTypeEnum;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

import static com.lifegit.infrastructure.repository.RepositoryErrors.call;

/**
 * 提交记录仓储实现。
 */
@Repository
public class CommitRepositoryImpl implements ICommitRepository {

    private final CommitDao commitDao;

    public CommitRepositoryImpl(CommitDao commitDao) {
        this.commitDao = commitDao;
    }

    @Override
    public CommitEntity save(CommitEntity entity) {
        CommitPO po = toPO(entity);
        call("commit.insert", () -> commitDao.insert(po));
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public boolean deleteById(Long id) {
        return call("commit.delete", () -> commitDao.deleteById(id)) > 0;
    }

    @Override
    public int deleteByBranchId(Long branchId) {
        return call("commit.deleteByBranchId", () -> commitDao.deleteByBranchId(branchId));
    }

    @Override
    public CommitEntity findById(Long id) {
        CommitPO po = call("commit.selectById", () -> commitDao.selectById(id));
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<CommitEntity> findByBranchId(Long branchId) {
        return toEntities(call("commit.selectByBranchId", () -> commitDao.selectByBranchId(branchId)));
    }

    @Override
    public long countByBranchId(Long branchId) {
        return call("commit.countByBranchId", () -> commitDao.countByBranchId(branchId));
    }

    @Override
    public List<CommitEntity> findAll() {
        return toEntities(call("commit.selectAll", commitDao::selectAll));
    }

    private List<CommitEntity> toEntities(List<CommitPO> pos) {
        List<CommitEntity> entities = new ArrayList<>();
        if (pos == null) {
            return entities;
        }
        for (CommitPO po : pos) {
            entities.add(toEntity(po));
        }
        return entities;
    }

    private CommitEntity toEntity(CommitPO po) {
        CommitEntity entity = new CommitEntity();
        entity.setId(po.getId());
        entity.setBranchId(po.getBranchId());
        entity.setMessage(po.getMessage());
        entity.setType(CommitTypeEnum.fromCode(po.getType()));
        entity.setRelatedTaskId(po.getRelatedTaskId());
        entity.setTimestamp(po.getCommitTime());
        return entity;
    }

    private CommitPO toPO(CommitEntity entity) {
        return CommitPO.builder()
                .id(entity.getId())
                .branchId(entity.getBranchId())
                .message(entity.getMessage())
                .type(entity.getType() == null ? null : entity.getType().getCode())
                .relatedTaskId(entity.getRelatedTaskId())
                .commitTime(entity.getTimestamp())
                .build();
    }
}
