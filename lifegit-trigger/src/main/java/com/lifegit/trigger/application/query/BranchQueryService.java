package com.lifegit.trigger.application.query;

import com.google.common.cache.Cache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.lifegit.api.dto.BranchDTO;
import com.lifegit.api.dto.BranchStatisticsDTO;
import com.lifegit.api.dto.CommitDTO;
import com.lifegit.api.dto.CommitStatisticsDTO;
import com.lifegit.api.dto.TaskPlanDTO;
import com.lifegit.domain.branch.adapter.repository.IBranchRepository;
import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.domain.branch.model.valobj.BranchStatistics;
import com.lifegit.domain.branch.service.BranchLifecycleDomainService;
import com.lifegit.domain.commit.service.CommitLedgerDomainService;
import com.lifegit.trigger.application.common.BranchViewAssembler;
import com.lifegit.types.enums.BranchStatusEnum;
import com.lifegit.types.enums.CommitTypeEnum;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * 分支读用例：列表、详情、计划、提交历史与统计。
 */
@Service
public class BranchQueryService {

    private final IBranchRepository branchRepository;
    private final BranchLifecycleDomainService branchLifecycleDomainService;
    private final CommitLedgerDomainService commitLedgerDomainService;
    private final BranchViewAssembler branchViewAssembler;
    private final Cache<Long, BranchStatistics> branchStatisticsCache;

    public BranchQueryService(IBranchRepository branchRepository,
                              BranchLifecycleDomainService branchLifecycleDomainService,
                              CommitLedgerDomainService commitLedgerDomainService,
                              BranchViewAssembler branchViewAssembler,
                              @Qualifier("branchStatisticsCache") Cache<Long, BranchStatistics> branchStatisticsCache) {
        this.branchRepository = branchRepository;
        this.branchLifecycleDomainService = branchLifecycleDomainService;
        this.commitLedgerDomainService = commitLedgerDomainService;
        this.branchViewAssembler = branchViewAssembler;
        this.branchStatisticsCache = branchStatisticsCache;
    }

    /**
     * status 为空时返回全部分支。
     */
    public List<BranchDTO> listBranches(String status) {
        List<BranchEntity> branches;
        if (StringUtils.isBlank(status)) {
            branches = branchRepository.findAll();
        } else {
            branches = branchRepository.findByStatus(parseStatus(status));
        }
        List<BranchDTO> result = new ArrayList<>();
        if (branches == null) {
            return result;
        }
        for (BranchEntity branch : branches) {
            result.add(branchViewAssembler.toBranchDTO(branch,
                    branchLifecycleDomainService.planState(branch.getId()).hasPlan()));
        }
        return result;
    }

    public BranchDTO getBranch(Long branchId) {
        BranchEntity branch = requireBranch(branchId);
        return branchViewAssembler.toBranchDTO(branch,
                branchLifecycleDomainService.planState(branchId).hasPlan());
    }

    public BranchDTO getMaster() {
        BranchEntity master = branchRepository.findMaster();
        if (master == null) {
            throw new AppException(ResponseCode.MASTER_NOT_FOUND);
        }
        return branchViewAssembler.toBranchDTO(master, false);
    }

    public TaskPlanDTO getPlan(Long branchId) {
        requireBranch(branchId);
        return branchViewAssembler.toTaskPlanDTO(
                branchLifecycleDomainService.planState(branchId).requirePlan(branchId));
    }

    public BranchStatisticsDTO getStatistics(Long branchId) {
        try {
            BranchStatistics statistics = branchStatisticsCache.get(branchId,
                    () -> branchLifecycleDomainService.getStatistics(requireBranch(branchId)));
            return branchViewAssembler.toStatisticsDTO(statistics);
        } catch (ExecutionException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "统计加载失败: " + ex.getMessage(), ex);
        } catch (UncheckedExecutionException ex) {
            if (ex.getCause() instanceof AppException appException) {
                throw appException;
            }
            throw ex;
        }
    }

    /**
     * type 为空时返回全部提交，时间升序。
     */
    public List<CommitDTO> listCommits(Long branchId, String type) {
        requireBranch(branchId);
        CommitTypeEnum commitType = null;
        if (StringUtils.isNotBlank(type)) {
            try {
                commitType = CommitTypeEnum.fromCode(type.trim());
            } catch (IllegalArgumentException ex) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "不支持的提交类型: " + type);
            }
        }
        return branchViewAssembler.toCommitDTOs(commitLedgerDomainService.historyByType(branchId, commitType));
    }

    public CommitStatisticsDTO getCommitStatistics(Long branchId) {
        requireBranch(branchId);
        return branchViewAssembler.toCommitStatisticsDTO(
                commitLedgerDomainService.statistics(branchId),
                commitLedgerDomainService.streak(branchId, LocalDate.now()));
    }

    private BranchStatusEnum parseStatus(String status) {
        try {
            return BranchStatusEnum.fromCode(status.trim());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "不支持的分支状态: " + status);
        }
    }

    private BranchEntity requireBranch(Long branchId) {
        BranchEntity branch = branchId == null ? null : branchRepository.findById(branchId);
        if (branch == null) {
            throw new AppException(ResponseCode.BRANCH_NOT_FOUND, "分支不存在: " + branchId);
        }
        return branch;
    }
}
