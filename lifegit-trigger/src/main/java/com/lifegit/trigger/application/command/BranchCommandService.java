package com.lifegit.trigger.application.command;

import com.google.common.cache.Cache;
import com.lifegit.api.dto.BranchCreateRequestDTO;
import com.lifegit.api.dto.BranchDTO;
import com.lifegit.domain.branch.adapter.repository.IBranchRepository;
import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.domain.branch.model.valobj.BranchStatistics;
import com.lifegit.domain.branch.service.BranchLifecycleDomainService;
import com.lifegit.trigger.application.common.BranchViewAssembler;
import com.lifegit.trigger.event.BranchEventPublisher;
import com.lifegit.types.enums.BranchEventTypeEnum;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AppException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 分支写用例：创建、完成、废弃、恢复、合并、删除。
 */
@Service
public class BranchCommandService {

    private final IBranchRepository branchRepository;
    private final BranchLifecycleDomainService branchLifecycleDomainService;
    private final BranchEventPublisher branchEventPublisher;
    private final BranchViewAssembler branchViewAssembler;
    private final Cache<Long, BranchStatistics> branchStatisticsCache;

    public BranchCommandService(IBranchRepository branchRepository,
                                BranchLifecycleDomainService branchLifecycleDomainService,
                                BranchEventPublisher branchEventPublisher,
                                BranchViewAssembler branchViewAssembler,
                                @Qualifier("branchStatisticsCache") Cache<Long, BranchStatistics> branchStatisticsCache) {
        this.branchRepository = branchRepository;
        this.branchLifecycleDomainService = branchLifecycleDomainService;
        this.branchEventPublisher = branchEventPublisher;
        this.branchViewAssembler = branchViewAssembler;
        this.branchStatisticsCache = branchStatisticsCache;
    }

    public BranchDTO ensureMaster() {
        BranchEntity master = branchLifecycleDomainService.ensureMasterBranch();
        return branchViewAssembler.toBranchDTO(master, false);
    }

    /**
     * 创建目标。AI 调用耗时较长，不放在数据库事务里；写入失败由领域服务补偿。
     * 计划生成与退避等待在后台完成，返回的 future 在分支写库后完成。
     */
    public CompletableFuture<BranchDTO> createBranch(BranchCreateRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        return branchLifecycleDomainService.createBranchAsync(request.getName(),
                        request.getDescription(),
                        request.getTimeframe(),
                        request.getExpectedCompletionDate())
                .thenApply(branch -> {
                    Map<String, Object> payload = new HashMap<>();
                    payload.put("name", branch.getName());
                    branchEventPublisher.publish(BranchEventTypeEnum.BRANCH_CREATED, branch.getId(), payload);
                    return branchViewAssembler.toBranchDTO(branch, true);
                });
    }

    @Transactional(rollbackFor = Exception.class)
    public BranchDTO completeBranch(Long branchId) {
        BranchEntity branch = branchLifecycleDomainService.completeBranch(requireBranch(branchId));
        return afterTransition(branch, BranchEventTypeEnum.BRANCH_COMPLETED);
    }

    @Transactional(rollbackFor = Exception.class)
    public BranchDTO abandonBranch(Long branchId) {
        BranchEntity branch = branchLifecycleDomainService.abandonBranch(requireBranch(branchId));
        return afterTransition(branch, BranchEventTypeEnum.BRANCH_ABANDONED);
    }

    @Transactional(rollbackFor = Exception.class)
    public BranchDTO reactivateBranch(Long branchId) {
        BranchEntity branch = branchLifecycleDomainService.reactivateBranch(requireBranch(branchId));
        return afterTransition(branch, BranchEventTypeEnum.BRANCH_REACTIVATED);
    }

    @Transactional(rollbackFor = Exception.class)
    public BranchDTO mergeBranch(Long branchId) {
        BranchEntity branch = branchLifecycleDomainService.mergeBranch(requireBranch(branchId));
        // 主线多了一条提交
        branchStatisticsCache.invalidateAll();
        return afterTransition(branch, BranchEventTypeEnum.BRANCH_MERGED);
    }

    @Transactional(rollbackFor = Exception.class)
    public void deleteBranch(Long branchId) {
        BranchEntity branch = requireBranch(branchId);
        branchLifecycleDomainService.deleteBranch(branch);
        branchStatisticsCache.invalidate(branchId);
        Map<String, Object> payload = new HashMap<>();
        payload.put("name", branch.getName());
        branchEventPublisher.publish(BranchEventTypeEnum.BRANCH_DELETED, branchId, payload);
    }

    private BranchDTO afterTransition(BranchEntity branch, BranchEventTypeEnum eventType) {
        branchStatisticsCache.invalidate(branch.getId());
        Map<String, Object> payload = new HashMap<>();
        payload.put("status", branch.getStatus().getCode());
        payload.put("merged", branch.isMerged());
        branchEventPublisher.publish(eventType, branch.getId(), payload);
        boolean hasPlan = branchLifecycleDomainService.planState(branch.getId()).hasPlan();
        return branchViewAssembler.toBranchDTO(branch, hasPlan);
    }

    private BranchEntity requireBranch(Long branchId) {
        BranchEntity branch = branchId == null ? null : branchRepository.findById(branchId);
        if (branch == null) {
            throw new AppException(ResponseCode.BRANCH_NOT_FOUND, "分支不存在: " + branchId);
        }
        return branch;
    }
}
