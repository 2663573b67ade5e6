package com.lifegit.trigger.application.command;

import com.google.common.cache.Cache;
import com.lifegit.api.dto.CommitCreateRequestDTO;
import com.lifegit.api.dto.CommitDTO;
import com.lifegit.domain.branch.model.valobj.BranchStatistics;
import com.lifegit.domain.commit.model.entity.CommitEntity;
import com.lifegit.domain.commit.service.CommitLedgerDomainService;
import com.lifegit.trigger.application.common.BranchViewAssembler;
import com.lifegit.trigger.event.BranchEventPublisher;
import com.lifegit.types.enums.BranchEventTypeEnum;
import com.lifegit.types.enums.CommitTypeEnum;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;

/**
 * 提交写用例。
 */
@Service
public class CommitCommandService {

    private final CommitLedgerDomainService commitLedgerDomainService;
    private final BranchEventPublisher branchEventPublisher;
    private final BranchViewAssembler branchViewAssembler;
    private final Cache<Long, BranchStatistics> branchStatisticsCache;

    public CommitCommandService(CommitLedgerDomainService commitLedgerDomainService,
                                BranchEventPublisher branchEventPublisher,
                                BranchViewAssembler branchViewAssembler,
                                @Qualifier("branchStatisticsCache") Cache<Long, BranchStatistics> branchStatisticsCache) {
        this.commitLedgerDomainService = commitLedgerDomainService;
        this.branchEventPublisher = branchEventPublisher;
        this.branchViewAssembler = branchViewAssembler;
        this.branchStatisticsCache = branchStatisticsCache;
    }

    @Transactional(rollbackFor = Exception.class)
    public CommitDTO createCommit(Long branchId, CommitCreateRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        CommitEntity commit = commitLedgerDomainService.createCommit(branchId,
                request.getMessage(),
                parseType(request.getType()),
                request.getRelatedTaskId());
        branchStatisticsCache.invalidate(branchId);
        Map<String, Object> payload = new HashMap<>();
        payload.put("commitId", commit.getId());
        payload.put("type", commit.getType().getCode());
        branchEventPublisher.publish(BranchEventTypeEnum.COMMIT_CREATED, branchId, payload);
        return branchViewAssembler.toCommitDTO(commit);
    }

    /**
     * 未指定类型按自定义处理。
     */
    private CommitTypeEnum parseType(String type) {
        if (StringUtils.isBlank(type)) {
            return CommitTypeEnum.CUSTOM;
        }
        try {
            return CommitTypeEnum.fromCode(type.trim());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "不支持的提交类型: " + type);
        }
    }
}
