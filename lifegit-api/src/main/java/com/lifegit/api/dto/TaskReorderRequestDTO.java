package com.lifegit.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 任务重排请求 DTO。
 */
@Data
public class TaskReorderRequestDTO {

    private List<Long> taskIds;
}
