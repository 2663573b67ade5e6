package com.lifegit.trigger.http;

import com.lifegit.api.dto.CommitCreateRequestDTO;
import com.lifegit.api.dto.CommitDTO;
import com.lifegit.api.dto.CommitStatisticsDTO;
import com.lifegit.api.response.Response;
import com.lifegit.trigger.application.command.CommitCommandService;
import com.lifegit.trigger.application.query.BranchQueryService;
import com.lifegit.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 提交记录 API。
 */
@RestController
@RequestMapping("/api/branches/{branchId}/commits")
public class CommitController {

    private final CommitCommandService commitCommandService;
    private final BranchQueryService branchQueryService;

    public CommitController(CommitCommandService commitCommandService,
                            BranchQueryService branchQueryService) {
        this.commitCommandService = commitCommandService;
        this.branchQueryService = branchQueryService;
    }

    @GetMapping
    public Response<List<CommitDTO>> list(@PathVariable("branchId") Long branchId,
                                          @RequestParam(value = "type", required = false) String type) {
        return success(branchQueryService.listCommits(branchId, type));
    }

    @PostMapping
    public Response<CommitDTO> create(@PathVariable("branchId") Long branchId,
                                      @RequestBody CommitCreateRequestDTO request) {
        return success(commitCommandService.createCommit(branchId, request));
    }

    @GetMapping("/statistics")
    public Response<CommitStatisticsDTO> statistics(@PathVariable("branchId") Long branchId) {
        return success(branchQueryService.getCommitStatistics(branchId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
