package com.lifegit.infrastructure.repository.branch;

import com.lifegit.domain.branch.adapter.repository.IBranchRepository;
import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.infrastructure.dao.BranchDao;
import com.lifegit.infrastructure.dao.po.BranchPO;
import com.lifegit.types.enums.BranchStatusEnum;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

import static com.lifegit.infrastructure.repository.RepositoryErrors.call;

/**
 * 目标分支仓储实现。
 */
@Repository
public class BranchRepositoryImpl implements IBranchRepository {

    private final BranchDao branchDao;

    public BranchRepositoryImpl(BranchDao branchDao) {
        this.branchDao = branchDao;
    }

    @Override
    public BranchEntity save(BranchEntity entity) {
        BranchPO po = toPO(entity);
        call("branch.insert", () -> branchDao.insert(po));
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public BranchEntity update(BranchEntity entity) {
        call("branch.update", () -> branchDao.update(toPO(entity)));
        return entity;
    }

    @Override
    public boolean deleteById(Long id) {
        return call("branch.delete", () -> branchDao.deleteById(id)) > 0;
    }

    @Override
    public BranchEntity findById(Long id) {
        BranchPO po = call("branch.selectById", () -> branchDao.selectById(id));
        return po == null ? null : toEntity(po);
    }

    @Override
    public BranchEntity findMaster() {
        BranchPO po = call("branch.selectMaster", branchDao::selectMaster);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<BranchEntity> findByStatus(BranchStatusEnum status) {
        return toEntities(call("branch.selectByStatus", () -> branchDao.selectByStatus(status.getCode())));
    }

    @Override
    public List<BranchEntity> findAll() {
        return toEntities(call("branch.selectAll", branchDao::selectAll));
    }

    private List<BranchEntity> toEntities(List<BranchPO> pos) {
        List<BranchEntity> entities = new ArrayList<>();
        if (pos == null) {
            return entities;
        }
        for (BranchPO po : pos) {
            entities.add(toEntity(po));
        }
        return entities;
    }

    private BranchEntity toEntity(BranchPO po) {
        BranchEntity entity = new BranchEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setDescription(po.getDescription());
        entity.setStatus(BranchStatusEnum.fromCode(po.getStatus()));
        entity.setProgress(po.getProgress());
        entity.setExpectedCompletionDate(po.getExpectedCompletionDate());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setAbandonedAt(po.getAbandonedAt());
        entity.setMergedAt(po.getMergedAt());
        return entity;
    }

    private BranchPO toPO(BranchEntity entity) {
        return BranchPO.builder()
                .id(entity.getId())
                .name(entity.getName())
                .description(entity.getDescription())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .progress(entity.getProgress())
                .expectedCompletionDate(entity.getExpectedCompletionDate())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .completedAt(entity.getCompletedAt())
                .abandonedAt(entity.getAbandonedAt())
                .mergedAt(entity.getMergedAt())
                .build();
    }
}
