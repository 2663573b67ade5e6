package com.lifegit.test.domain;

import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.domain.branch.service.BranchLifecycleDomainService;
import com.lifegit.domain.commit.service.CommitLedgerDomainService;
import com.lifegit.domain.plan.adapter.gateway.ITaskPlanGenerator;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.service.AIFailurePolicyDomainService;
import com.lifegit.domain.plan.service.ProgressTrackerDomainService;
import com.lifegit.domain.plan.service.TaskPlanAssemblyDomainService;
import com.lifegit.infrastructure.dao.TaskItemDao;
import com.lifegit.infrastructure.dao.TaskPlanDao;
import com.lifegit.infrastructure.dao.po.TaskItemPO;
import com.lifegit.infrastructure.dao.po.TaskPlanPO;
import com.lifegit.infrastructure.repository.plan.TaskPlanRepositoryImpl;
import com.lifegit.test.support.ImmediateBackoffScheduler;
import com.lifegit.test.support.InMemoryBranchRepository;
import com.lifegit.test.support.InMemoryCommitRepository;
import com.lifegit.test.support.LifeGitTestContext;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 计划写到一半失败（计划行已插入、第二个任务项插入失败）时的补偿：
 * 已分配 ID 的计划按 ID 删除，创建路径还要删掉分支。
 */
public class PartialPlanCompensationTest {

    private TaskPlanDao taskPlanDao;
    private TaskItemDao taskItemDao;
    private InMemoryBranchRepository branchRepository;
    private ITaskPlanGenerator taskPlanGenerator;
    private BranchLifecycleDomainService lifecycle;
    private AtomicLong planIds;
    private AtomicInteger itemInserts;
    private int failOnItemInsert;

    @BeforeEach
    public void setUp() {
        taskPlanDao = mock(TaskPlanDao.class);
        taskItemDao = mock(TaskItemDao.class);
        branchRepository = new InMemoryBranchRepository();
        taskPlanGenerator = mock(ITaskPlanGenerator.class);
        planIds = new AtomicLong(40);
        itemInserts = new AtomicInteger();
        failOnItemInsert = -1;

        doAnswer(invocation -> {
            invocation.<TaskPlanPO>getArgument(0).setId(planIds.incrementAndGet());
            return 1;
        }).when(taskPlanDao).insert(any());
        doAnswer(invocation -> {
            int n = itemInserts.incrementAndGet();
            if (n == failOnItemInsert) {
                throw new DataIntegrityViolationException("value too long for type character varying(200)");
            }
            invocation.<TaskItemPO>getArgument(0).setId(100L + n);
            return 1;
        }).when(taskItemDao).insert(any());
        when(taskPlanDao.deleteById(any())).thenReturn(1);

        TaskPlanRepositoryImpl taskPlanRepository = new TaskPlanRepositoryImpl(taskPlanDao, taskItemDao);
        CommitLedgerDomainService commitLedger = new CommitLedgerDomainService(new InMemoryCommitRepository(), branchRepository);
        AIFailurePolicyDomainService failurePolicy = new AIFailurePolicyDomainService(taskPlanGenerator,
                new TaskPlanAssemblyDomainService(), new ImmediateBackoffScheduler(), 0, 1000);
        lifecycle = new BranchLifecycleDomainService(branchRepository,
                taskPlanRepository,
                commitLedger,
                failurePolicy,
                taskPlanGenerator,
                new ProgressTrackerDomainService(),
                100,
                500);
    }

    @Test
    public void shouldDeletePartialPlanAndBranchWhenItemInsertFails() {
        when(taskPlanGenerator.generate(any())).thenAnswer(invocation -> LifeGitTestContext.aiPlan("读文档", "写练习"));
        failOnItemInsert = 2;

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> lifecycle.createBranch("学习 Rust", "desc", null));

        Assertions.assertEquals(ResponseCode.REPOSITORY_ERROR.getCode(), ex.getCode());
        verify(taskItemDao).deleteByPlanId(41L);
        verify(taskPlanDao).deleteById(41L);
        Assertions.assertEquals(0, branchRepository.size());
    }

    @Test
    public void shouldDeletePartialPlanWhenRegenerationFails() {
        when(taskPlanGenerator.generate(any()))
                .thenAnswer(invocation -> LifeGitTestContext.aiPlan("读文档"))
                .thenAnswer(invocation -> LifeGitTestContext.aiPlan("新任务一", "新任务二"));
        BranchEntity branch = lifecycle.createBranch("学习 Rust", "desc", null);
        when(taskPlanDao.selectLatestByBranchId(branch.getId()))
                .thenReturn(TaskPlanPO.builder().id(41L).branchId(branch.getId()).totalDuration("2周").build());
        failOnItemInsert = 3;

        AppException ex = Assertions.assertThrows(AppException.class, () -> lifecycle.regenerateTaskPlan(branch));

        Assertions.assertEquals(ResponseCode.REPOSITORY_ERROR.getCode(), ex.getCode());
        verify(taskItemDao).deleteByPlanId(42L);
        verify(taskPlanDao).deleteById(42L);
        verify(taskPlanDao, never()).deleteById(41L);
        Assertions.assertNotNull(branchRepository.findById(branch.getId()));
    }

    @Test
    public void shouldKeepFullySavedPlan() {
        when(taskPlanGenerator.generate(any())).thenAnswer(invocation -> LifeGitTestContext.aiPlan("读文档", "写练习"));

        BranchEntity branch = lifecycle.createBranch("学习 Rust", "desc", null);

        Assertions.assertNotNull(branch.getId());
        Assertions.assertEquals(2, itemInserts.get());
        verify(taskPlanDao, never()).deleteById(any());
    }

    @Test
    public void shouldNotTouchRepositoryWhenPlanHasNoId() {
        TaskPlanEntity plan = LifeGitTestContext.aiPlan("读文档");
        when(taskPlanGenerator.generate(any())).thenReturn(plan);
        doAnswer(invocation -> {
            throw new DataIntegrityViolationException("plan insert failed");
        }).when(taskPlanDao).insert(any());

        Assertions.assertThrows(AppException.class, () -> lifecycle.createBranch("学习 Rust", "desc", null));

        Assertions.assertNull(plan.getId());
        verify(taskPlanDao, never()).deleteById(any());
        Assertions.assertEquals(0, branchRepository.size());
    }
}
