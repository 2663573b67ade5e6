package com.lifegit.trigger.http;

import com.lifegit.api.dto.TaskItemDTO;
import com.lifegit.api.dto.TaskItemRequestDTO;
import com.lifegit.api.dto.TaskPlanDTO;
import com.lifegit.api.dto.TaskReorderRequestDTO;
import com.lifegit.api.response.Response;
import com.lifegit.trigger.application.command.TaskPlanCommandService;
import com.lifegit.trigger.application.query.BranchQueryService;
import com.lifegit.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 任务计划 API。
 */
@RestController
@RequestMapping("/api/branches/{branchId}/plan")
public class TaskPlanController {

    private final TaskPlanCommandService taskPlanCommandService;
    private final BranchQueryService branchQueryService;

    public TaskPlanController(TaskPlanCommandService taskPlanCommandService,
                              BranchQueryService branchQueryService) {
        this.taskPlanCommandService = taskPlanCommandService;
        this.branchQueryService = branchQueryService;
    }

    @GetMapping
    public Response<TaskPlanDTO> get(@PathVariable("branchId") Long branchId) {
        return success(branchQueryService.getPlan(branchId));
    }

    @PostMapping("/regenerate")
    public Response<TaskPlanDTO> regenerate(@PathVariable("branchId") Long branchId) {
        return success(taskPlanCommandService.regenerate(branchId));
    }

    @PostMapping("/tasks")
    public Response<TaskItemDTO> addTask(@PathVariable("branchId") Long branchId,
                                         @RequestBody TaskItemRequestDTO request) {
        return success(taskPlanCommandService.addTask(branchId, request));
    }

    @PutMapping("/tasks/{taskId}")
    public Response<TaskItemDTO> updateTask(@PathVariable("branchId") Long branchId,
                                            @PathVariable("taskId") Long taskId,
                                            @RequestBody TaskItemRequestDTO request) {
        return success(taskPlanCommandService.updateTask(branchId, taskId, request));
    }

    @DeleteMapping("/tasks/{taskId}")
    public Response<TaskPlanDTO> removeTask(@PathVariable("branchId") Long branchId,
                                            @PathVariable("taskId") Long taskId) {
        return success(taskPlanCommandService.removeTask(branchId, taskId));
    }

    @PostMapping("/tasks/{taskId}/toggle")
    public Response<TaskItemDTO> toggleTask(@PathVariable("branchId") Long branchId,
                                            @PathVariable("taskId") Long taskId) {
        return success(taskPlanCommandService.toggleTask(branchId, taskId));
    }

    @PutMapping("/order")
    public Response<TaskPlanDTO> reorder(@PathVariable("branchId") Long branchId,
                                         @RequestBody TaskReorderRequestDTO request) {
        return success(taskPlanCommandService.reorderTasks(branchId, request == null ? null : request.getTaskIds()));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
