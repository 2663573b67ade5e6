package com.lifegit.trigger.job;

import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.domain.branch.service.BranchLifecycleDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 启动时确保人生主线存在。
 */
@Slf4j
@Component
@ConditionalOnProperty(value = "lifegit.bootstrap.master-branch", havingValue = "true", matchIfMissing = true)
public class MasterBranchBootstrap implements ApplicationRunner {

    private final BranchLifecycleDomainService branchLifecycleDomainService;

    public MasterBranchBootstrap(BranchLifecycleDomainService branchLifecycleDomainService) {
        this.branchLifecycleDomainService = branchLifecycleDomainService;
    }

    @Override
    public void run(ApplicationArguments args) {
        BranchEntity master = branchLifecycleDomainService.ensureMasterBranch();
        log.info("MASTER_BRANCH_READY branchId={}, name={}", master.getId(), master.getName());
    }
}
