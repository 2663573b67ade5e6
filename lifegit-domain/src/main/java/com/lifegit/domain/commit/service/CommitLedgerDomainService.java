package com.lifegit.domain.commit.service;

import com.lifegit.domain.branch.adapter.repository.IBranchRepository;
import com.lifegit.domain.commit.adapter.repository.ICommitRepository;
import com.lifegit.domain.commit.model.entity.CommitEntity;
import com.lifegit.domain.commit.model.valobj.CommitStatistics;
import com.lifegit.types.common.Constants;
import com.lifegit.types.enums.CommitTypeEnum;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 提交账本领域服务：按分支追加与查询提交，提交只追加不修改。
 */
@Slf4j
@Service
public class CommitLedgerDomainService {

    private static final Comparator<CommitEntity> TIMELINE_ORDER = Comparator
            .comparing(CommitEntity::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CommitEntity::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ICommitRepository commitRepository;
    private final IBranchRepository branchRepository;

    public CommitLedgerDomainService(ICommitRepository commitRepository,
                                     IBranchRepository branchRepository) {
        this.commitRepository = commitRepository;
        this.branchRepository = branchRepository;
    }

    /**
     * 追加一条提交，时间戳为空时取当前时间。
     */
    public CommitEntity append(CommitEntity commit) {
        if (commit == null || commit.getBranchId() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "提交必须关联分支");
        }
        if (StringUtils.isBlank(commit.getMessage())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "提交信息不能为空");
        }
        if (commit.getType() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "提交类型不能为空");
        }
        if (commit.getTimestamp() == null) {
            commit.setTimestamp(LocalDateTime.now());
        }
        CommitEntity saved = commitRepository.save(commit);
        log.info("COMMIT_APPENDED branchId={}, commitId={}, type={}, relatedTaskId={}",
                saved.getBranchId(), saved.getId(), saved.getType(), saved.getRelatedTaskId());
        return saved;
    }

    /**
     * 用户创建提交：分支必须存在，信息不能为空且不超过长度上限。
     */
    public CommitEntity createCommit(Long branchId, String message, CommitTypeEnum type, Long relatedTaskId) {
        if (StringUtils.isBlank(message)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "提交信息不能为空");
        }
        if (message.trim().length() > Constants.COMMIT_MESSAGE_MAX_LENGTH) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "提交信息不能超过" + Constants.COMMIT_MESSAGE_MAX_LENGTH + "个字符");
        }
        if (branchId == null || branchRepository.findById(branchId) == null) {
            throw new AppException(ResponseCode.BRANCH_NOT_FOUND, "分支不存在: " + branchId);
        }
        return append(CommitEntity.of(branchId, message.trim(), type, relatedTaskId, LocalDateTime.now()));
    }

    /**
     * 分支提交历史，时间升序，同一时间按写入顺序。
     */
    public List<CommitEntity> history(Long branchId) {
        List<CommitEntity> commits = commitRepository.findByBranchId(branchId);
        List<CommitEntity> sorted = new ArrayList<>(commits == null ? List.of() : commits);
        sorted.sort(TIMELINE_ORDER);
        return sorted;
    }

    public List<CommitEntity> historyByType(Long branchId, CommitTypeEnum type) {
        List<CommitEntity> filtered = new ArrayList<>();
        for (CommitEntity commit : history(branchId)) {
            if (type == null || commit.getType() == type) {
                filtered.add(commit);
            }
        }
        return filtered;
    }

    public long count(Long branchId) {
        return commitRepository.countByBranchId(branchId);
    }

    public CommitStatistics statistics(Long branchId) {
        List<CommitEntity> commits = history(branchId);
        Map<CommitTypeEnum, Long> countByType = new EnumMap<>(CommitTypeEnum.class);
        for (CommitEntity commit : commits) {
            if (commit.getType() != null) {
                countByType.merge(commit.getType(), 1L, Long::sum);
            }
        }
        return CommitStatistics.builder()
                .branchId(branchId)
                .totalCount((long) commits.size())
                .countByType(countByType)
                .firstCommitAt(commits.isEmpty() ? null : commits.get(0).getTimestamp())
                .lastCommitAt(commits.isEmpty() ? null : commits.get(commits.size() - 1).getTimestamp())
                .build();
    }

    /**
     * 截止 today 的连续提交天数，today 无提交则为 0。
     */
    public int streak(Long branchId, LocalDate today) {
        if (today == null) {
            return 0;
        }
        Set<LocalDate> days = new HashSet<>();
        for (CommitEntity commit : history(branchId)) {
            if (commit.getTimestamp() != null) {
                days.add(commit.getTimestamp().toLocalDate());
            }
        }
        int streak = 0;
        LocalDate cursor = today;
        while (days.contains(cursor)) {
            streak++;
            cursor = cursor.minusDays(1);
        }
        return streak;
    }

    /**
     * 删除分支下全部提交，仅用于分支级联删除。
     */
    public int purge(Long branchId) {
        int deleted = commitRepository.deleteByBranchId(branchId);
        log.info("COMMITS_PURGED branchId={}, deleted={}", branchId, deleted);
        return deleted;
    }
}
