package com.lifegit.trigger.http;

import com.lifegit.api.dto.BranchCreateRequestDTO;
import com.lifegit.api.dto.BranchDTO;
import com.lifegit.api.dto.BranchStatisticsDTO;
import com.lifegit.api.response.Response;
import com.lifegit.trigger.application.command.BranchCommandService;
import com.lifegit.trigger.application.query.BranchQueryService;
import com.lifegit.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 目标分支 API。
 */
@RestController
@RequestMapping("/api/branches")
public class BranchController {

    private final BranchCommandService branchCommandService;
    private final BranchQueryService branchQueryService;

    public BranchController(BranchCommandService branchCommandService,
                            BranchQueryService branchQueryService) {
        this.branchCommandService = branchCommandService;
        this.branchQueryService = branchQueryService;
    }

    @GetMapping
    public Response<List<BranchDTO>> list(@RequestParam(value = "status", required = false) String status) {
        return success(branchQueryService.listBranches(status));
    }

    @GetMapping("/master")
    public Response<BranchDTO> master() {
        return success(branchQueryService.getMaster());
    }

    @GetMapping("/{id}")
    public Response<BranchDTO> get(@PathVariable("id") Long branchId) {
        return success(branchQueryService.getBranch(branchId));
    }

    /**
     * 异步返回，计划生成期间不占用请求线程。
     */
    @PostMapping
    public CompletableFuture<Response<BranchDTO>> create(@RequestBody BranchCreateRequestDTO request) {
        return branchCommandService.createBranch(request).thenApply(this::success);
    }

    @PostMapping("/{id}/complete")
    public Response<BranchDTO> complete(@PathVariable("id") Long branchId) {
        return success(branchCommandService.completeBranch(branchId));
    }

    @PostMapping("/{id}/abandon")
    public Response<BranchDTO> abandon(@PathVariable("id") Long branchId) {
        return success(branchCommandService.abandonBranch(branchId));
    }

    @PostMapping("/{id}/reactivate")
    public Response<BranchDTO> reactivate(@PathVariable("id") Long branchId) {
        return success(branchCommandService.reactivateBranch(branchId));
    }

    @PostMapping("/{id}/merge")
    public Response<BranchDTO> merge(@PathVariable("id") Long branchId) {
        return success(branchCommandService.mergeBranch(branchId));
    }

    @DeleteMapping("/{id}")
    public Response<Boolean> delete(@PathVariable("id") Long branchId) {
        branchCommandService.deleteBranch(branchId);
        return success(Boolean.TRUE);
    }

    @GetMapping("/{id}/statistics")
    public Response<BranchStatisticsDTO> statistics(@PathVariable("id") Long branchId) {
        return success(branchQueryService.getStatistics(branchId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
